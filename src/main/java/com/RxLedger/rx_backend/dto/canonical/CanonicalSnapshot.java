package com.RxLedger.rx_backend.dto.canonical;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CanonicalSnapshot {
    String version;
    String patientIdentityHash;
    String medicationHash;
    List<CanonicalMedicine> medicines;
    String canonicalJson;

    public long totalQuantity() {
        return medicines.stream().mapToLong(CanonicalMedicine::getQuantity).sum();
    }
}
