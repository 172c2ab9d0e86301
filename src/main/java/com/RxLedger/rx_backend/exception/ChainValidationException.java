package com.RxLedger.rx_backend.exception;

import com.RxLedger.rx_backend.enums.ChainErrorCode;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed rejection from the on-chain validation gate. The context map holds the
 * identifier, the compared values and the raw underlying error, if any.
 */
@Getter
public class ChainValidationException extends ApiException {
    private final ChainErrorCode code;
    private final Map<String, Object> context;

    public ChainValidationException(ChainErrorCode code, String message, Map<String, Object> context) {
        this(code, message, context, null);
    }

    public ChainValidationException(ChainErrorCode code, String message, Map<String, Object> context, Throwable cause) {
        super(message, code.getHttpStatus(), code.name(), cause);
        this.code = code;
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }
}
