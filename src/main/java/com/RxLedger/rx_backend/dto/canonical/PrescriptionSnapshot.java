package com.RxLedger.rx_backend.dto.canonical;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Fields of an off-chain prescription that its ledger commitments are derived from.
 */
@Value
@Builder(toBuilder = true)
public class PrescriptionSnapshot {
    String patientName;
    Object patientAge;
    @Singular
    List<RawMedicine> medicines;
}
