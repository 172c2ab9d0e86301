package com.RxLedger.rx_backend.service;

import com.RxLedger.rx_backend.dto.response.LedgerRoleResponse;
import com.RxLedger.rx_backend.ledger.LedgerPrescription;
import com.RxLedger.rx_backend.ledger.LedgerReceipt;
import com.RxLedger.rx_backend.ledger.PrescriptionLedger;
import com.RxLedger.rx_backend.util.PrescriptionIdCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;

@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerAdminService {

    private final PrescriptionLedger prescriptionLedger;

    public LedgerRoleResponse registerDoctor(String address) {
        LedgerReceipt receipt = prescriptionLedger.registerDoctor(prescriptionLedger.adminAddress(), address);
        log.info("Doctor {} registered on the ledger (tx {})", address, receipt.getTransactionHash());
        return roleStatus(address, receipt);
    }

    public LedgerRoleResponse registerPharmacy(String address) {
        LedgerReceipt receipt = prescriptionLedger.registerPharmacy(prescriptionLedger.adminAddress(), address);
        log.info("Pharmacy {} registered on the ledger (tx {})", address, receipt.getTransactionHash());
        return roleStatus(address, receipt);
    }

    public LedgerRoleResponse getRoles(String address) {
        return roleStatus(address, null);
    }

    /**
     * Raw ledger record, the zero record included.
     */
    public LedgerPrescription getOnChainState(String blockchainId) {
        return prescriptionLedger.getPrescription(PrescriptionIdCodec.encode(blockchainId));
    }

    private LedgerRoleResponse roleStatus(String address, LedgerReceipt receipt) {
        return LedgerRoleResponse.builder()
                .address(address.toLowerCase(Locale.ROOT))
                .doctor(prescriptionLedger.isDoctor(address))
                .pharmacy(prescriptionLedger.isPharmacy(address))
                .transactionHash(receipt == null ? null : receipt.getTransactionHash())
                .build();
    }
}
