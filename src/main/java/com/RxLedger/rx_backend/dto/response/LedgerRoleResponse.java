package com.RxLedger.rx_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerRoleResponse {
    private String address;
    private boolean doctor;
    private boolean pharmacy;
    private String transactionHash;
}
