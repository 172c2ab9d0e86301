package com.RxLedger.rx_backend.enums;

import org.springframework.http.HttpStatus;

/**
 * Rejection reasons of the on-chain validation gate, in check order.
 * Only {@link #CHAIN_UNREACHABLE} is transient.
 */
public enum ChainErrorCode {
    CHAIN_UNREACHABLE(HttpStatus.SERVICE_UNAVAILABLE, true, "Prescription ledger is unavailable"),
    NOT_FOUND_ON_CHAIN(HttpStatus.FORBIDDEN, false, "Prescription is not registered on the ledger"),
    STATUS_MISMATCH(HttpStatus.FORBIDDEN, false, "Prescription is not active"),
    USAGE_EXHAUSTED(HttpStatus.FORBIDDEN, false, "Prescription already dispensed"),
    EXPIRED_ON_CHAIN(HttpStatus.FORBIDDEN, false, "Prescription expired"),
    HASH_MISMATCH(HttpStatus.FORBIDDEN, false, "Data integrity check failed");

    private final HttpStatus httpStatus;
    private final boolean retryable;
    private final String reason;

    ChainErrorCode(HttpStatus httpStatus, boolean retryable, String reason) {
        this.httpStatus = httpStatus;
        this.retryable = retryable;
        this.reason = reason;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public String getReason() {
        return reason;
    }

    public boolean isSecurityEvent() {
        return this == HASH_MISMATCH;
    }
}
