package com.RxLedger.rx_backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Role {
    ADMIN,
    DOCTOR,
    PHARMACY,
    PATIENT;

    @JsonValue
    public String getValue() {
        return this.name().toLowerCase();
    }
}
