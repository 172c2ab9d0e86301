package com.RxLedger.rx_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationReport {

    public enum Outcome {
        MATCH,
        HASH_MISMATCH,
        NOT_ON_CHAIN,
        UNREADABLE
    }

    private boolean fixMode;
    private int total;
    private int matchCount;
    private int mismatchCount;
    private int notOnChainCount;
    private int unreadableCount;
    private int fixedCount;
    @Builder.Default
    private List<Entry> entries = new ArrayList<>();
    private LocalDateTime completedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entry {
        private String blockchainId;
        private Outcome outcome;
        private boolean patientMatch;
        private boolean medMatch;
        private String onChainStatus;
        private String detail;
        private boolean fixed;
    }
}
