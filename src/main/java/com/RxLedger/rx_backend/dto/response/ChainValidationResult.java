package com.RxLedger.rx_backend.dto.response;

import com.RxLedger.rx_backend.ledger.LedgerPrescription;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Successful gate outcome. Failures are raised as {@code ChainValidationException}.
 */
@Value
@Builder
public class ChainValidationResult {
    String prescriptionId;
    LedgerPrescription onChainState;
    HashIntegrity hashIntegrity;
    Instant validatedAt;

    public boolean isValid() {
        return true;
    }
}
