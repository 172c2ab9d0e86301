package com.RxLedger.rx_backend.dto.response;

import com.RxLedger.rx_backend.enums.PrescriptionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispenseResponse {
    private String blockchainId;
    private PrescriptionStatus status;
    private long usageCount;
    private long maxUsage;
    private long remainingUsage;
    private String transactionHash;
    private long blockNumber;
    private String pharmacyAddress;
    private LocalDateTime dispensedAt;
}
