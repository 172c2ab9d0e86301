package com.RxLedger.rx_backend.ledger;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class IssueCommand {
    String prescriptionId;
    String patientHash;
    String medicationHash;
    long quantity;
    long expiryDate;
    long maxUsage;
}
