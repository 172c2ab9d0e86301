package com.RxLedger.rx_backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Raised when a prescription snapshot cannot be canonicalized. Never substituted
 * with a default value, since a silently coerced field would change the commitment.
 */
public class CanonicalizationException extends ApiException {
    public CanonicalizationException(String message) {
        super(message, HttpStatus.BAD_REQUEST, "MALFORMED_SNAPSHOT");
    }
}
