package com.RxLedger.rx_backend.exception;

import org.springframework.http.HttpStatus;

/**
 * A ledger call was rejected (reverted) or could not be delivered.
 */
public class LedgerException extends ApiException {

    public static final String NOT_OWNER = "Not the owner";
    public static final String NOT_DOCTOR = "Not a doctor";
    public static final String NOT_PHARMACY = "Not a pharmacy";
    public static final String ALREADY_EXISTS = "Prescription already exists";
    public static final String NOT_ACTIVE = "Prescription not active";

    public LedgerException(String reason, HttpStatus status) {
        super(reason, status, "LEDGER_REJECTED");
    }

    public LedgerException(String message, Throwable cause) {
        super(message, HttpStatus.SERVICE_UNAVAILABLE, "LEDGER_UNAVAILABLE", cause);
    }

    public static LedgerException reverted(String reason) {
        HttpStatus status;
        if (NOT_OWNER.equals(reason) || NOT_DOCTOR.equals(reason) || NOT_PHARMACY.equals(reason)) {
            status = HttpStatus.FORBIDDEN;
        } else if (ALREADY_EXISTS.equals(reason) || NOT_ACTIVE.equals(reason)) {
            status = HttpStatus.CONFLICT;
        } else {
            status = HttpStatus.BAD_REQUEST;
        }
        return new LedgerException(reason, status);
    }

    public boolean isUnavailable() {
        return getStatus() == HttpStatus.SERVICE_UNAVAILABLE;
    }
}
