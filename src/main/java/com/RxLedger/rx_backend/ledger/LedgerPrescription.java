package com.RxLedger.rx_backend.ledger;

import com.RxLedger.rx_backend.enums.OnChainStatus;
import com.RxLedger.rx_backend.util.PrescriptionIdCodec;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

/**
 * Prescription record as held by the ledger. Unknown identifiers come back as the
 * zero record ({@link #isEmpty()}), never as null.
 */
@Value
@Builder(toBuilder = true)
public class LedgerPrescription {
    private static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";
    private static final String ZERO_HASH = PrescriptionIdCodec.ZERO_ID;

    String id;
    String issuer;
    OnChainStatus status;
    long usageCount;
    long maxUsage;
    long quantity;
    long expiryDate;
    String patientHash;
    String medicationHash;

    public static LedgerPrescription empty() {
        return LedgerPrescription.builder()
                .id(PrescriptionIdCodec.ZERO_ID)
                .issuer(ZERO_ADDRESS)
                .status(OnChainStatus.CREATED)
                .patientHash(ZERO_HASH)
                .medicationHash(ZERO_HASH)
                .build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return PrescriptionIdCodec.isZero(id);
    }

    public String getShortCode() {
        return isEmpty() ? null : PrescriptionIdCodec.decode(id);
    }

    public long getRemainingUsage() {
        return Math.max(0L, maxUsage - usageCount);
    }
}
