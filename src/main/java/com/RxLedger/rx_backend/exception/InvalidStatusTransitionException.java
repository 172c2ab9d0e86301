package com.RxLedger.rx_backend.exception;

import com.RxLedger.rx_backend.enums.PrescriptionStatus;
import org.springframework.http.HttpStatus;

public class InvalidStatusTransitionException extends ApiException {
    public InvalidStatusTransitionException(String blockchainId, PrescriptionStatus current, PrescriptionStatus requested) {
        super(String.format("Invalid transition for %s: %s -> %s. Allowed: %s",
                        blockchainId, current, requested, current.allowedTransitions()),
                HttpStatus.CONFLICT,
                "INVALID_STATUS_TRANSITION");
    }
}
