package com.RxLedger.rx_backend.dto.response;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class HashIntegrity {
    boolean patientMatch;
    boolean medMatch;
    String recomputedPatientHash;
    String recomputedMedHash;
    String canonicalVersion;
}
