package com.RxLedger.rx_backend.dto.response;

import com.RxLedger.rx_backend.enums.PrescriptionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrescriptionResponse {
    private UUID id;
    private String blockchainId;
    private String ledgerId;
    private String doctorAddress;
    private String patientName;
    private String patientAge;
    private String diagnosis;
    private String allergies;
    private String notes;
    private PrescriptionStatus status;
    private long usageCount;
    private long maxUsage;
    private LocalDateTime expiryDate;
    private String patientHash;
    private String medicationHash;
    private boolean blockchainSynced;
    private String issueTxHash;
    private String confirmedTxHash;
    private String dispensedBy;
    private LocalDateTime dispensedAt;
    private List<PrescriptionItemResponse> items;
    private LocalDateTime issuedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PrescriptionItemResponse {
        private String name;
        private String dosage;
        private long quantity;
        private String instructions;
    }
}
