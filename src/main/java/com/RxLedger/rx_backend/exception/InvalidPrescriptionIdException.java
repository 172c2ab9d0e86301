package com.RxLedger.rx_backend.exception;

import org.springframework.http.HttpStatus;

public class InvalidPrescriptionIdException extends ApiException {
    public InvalidPrescriptionIdException(String message) {
        super(message, HttpStatus.BAD_REQUEST, "INVALID_PRESCRIPTION_ID");
    }
}
