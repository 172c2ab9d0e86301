package com.RxLedger.rx_backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Prescription status as stored by the ledger contract. The numeric codes are the
 * contract's enum ordinals and must not be reordered.
 */
public enum OnChainStatus {
    CREATED(0),
    ACTIVE(1),
    USED(2),
    EXPIRED(3);

    private final int code;

    OnChainStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    @JsonValue
    public String getLabel() {
        return name();
    }

    public static OnChainStatus fromCode(int code) {
        for (OnChainStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown on-chain status code: " + code);
    }
}
