package com.RxLedger.rx_backend.ledger;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LedgerEvent {

    public enum Type {
        PRESCRIPTION_CREATED,
        PRESCRIPTION_DISPENSED,
        PRESCRIPTION_EXPIRED
    }

    Type type;
    String prescriptionId;
    // issuer for CREATED, pharmacy for DISPENSED, null for EXPIRED
    String actor;
    String medicationHash;
    Long remainingUsage;
}
