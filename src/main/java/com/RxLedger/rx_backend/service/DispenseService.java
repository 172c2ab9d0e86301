package com.RxLedger.rx_backend.service;

import com.RxLedger.rx_backend.dto.response.ChainValidationResult;
import com.RxLedger.rx_backend.dto.response.DispenseResponse;
import com.RxLedger.rx_backend.enums.ChainErrorCode;
import com.RxLedger.rx_backend.enums.PrescriptionStatus;
import com.RxLedger.rx_backend.exception.ChainValidationException;
import com.RxLedger.rx_backend.exception.InvalidStatusTransitionException;
import com.RxLedger.rx_backend.exception.LedgerException;
import com.RxLedger.rx_backend.ledger.LedgerEvent;
import com.RxLedger.rx_backend.ledger.LedgerReceipt;
import com.RxLedger.rx_backend.ledger.PrescriptionLedger;
import com.RxLedger.rx_backend.model.Prescription;
import com.RxLedger.rx_backend.repository.PrescriptionRepository;
import com.RxLedger.rx_backend.util.PrescriptionIdCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class DispenseService {

    private final PrescriptionRepository prescriptionRepository;
    private final PrescriptionService prescriptionService;
    private final ChainValidationService chainValidationService;
    private final PrescriptionLedger prescriptionLedger;
    private final IntegrityAuditService integrityAuditService;
    private final Clock clock;

    /**
     * Dry run: the gate alone, no ledger submission and no store mutation.
     */
    @Transactional(readOnly = true)
    public ChainValidationResult validateDispense(String blockchainId, String actorAddress) {
        Prescription prescription = prescriptionService.findPrescription(blockchainId);
        return runGate(prescription, actorAddress);
    }

    /**
     * Gate, then the ledger dispense call, then the off-chain update. The store is only
     * touched once the ledger has accepted the call.
     */
    @Transactional(noRollbackFor = ChainValidationException.class)
    public DispenseResponse dispense(String blockchainId, String pharmacyAddress) {
        Prescription prescription = prescriptionService.findPrescription(blockchainId);
        ChainValidationResult validation = runGate(prescription, pharmacyAddress);

        if (!prescription.getStatus().canTransitionTo(PrescriptionStatus.USED)) {
            throw new InvalidStatusTransitionException(blockchainId, prescription.getStatus(), PrescriptionStatus.USED);
        }

        LedgerReceipt receipt = prescriptionLedger.dispensePrescription(
                pharmacyAddress, PrescriptionIdCodec.encode(blockchainId));

        Optional<LedgerEvent> dispensed = receipt.findEvent(LedgerEvent.Type.PRESCRIPTION_DISPENSED);
        if (dispensed.isEmpty()) {
            if (receipt.findEvent(LedgerEvent.Type.PRESCRIPTION_EXPIRED).isPresent()) {
                throw expiredByLedger(prescription, receipt, pharmacyAddress);
            }
            throw new LedgerException("Dispense of " + blockchainId + " produced no dispense event (tx "
                    + receipt.getTransactionHash() + ")", HttpStatus.BAD_GATEWAY);
        }

        long remaining = dispensed.get().getRemainingUsage();
        PrescriptionStatus next = remaining == 0 ? PrescriptionStatus.USED : PrescriptionStatus.DISPENSED;
        long usageCount = validation.getOnChainState().getMaxUsage() - remaining;

        int updated = prescriptionRepository.recordDispense(blockchainId, next, PrescriptionStatus.sourcesOf(next),
                usageCount, LocalDateTime.now(clock), pharmacyAddress.toLowerCase(Locale.ROOT),
                receipt.getTransactionHash());
        if (updated == 0) {
            // a concurrent dispense with a later receipt got there first
            log.warn("Prescription {} dispense tx {} (usage {}) not applied, store already holds a later state",
                    blockchainId, receipt.getTransactionHash(), usageCount);
        }
        Prescription saved = prescriptionService.findPrescription(blockchainId);

        log.info("Prescription {} dispensed by {} (tx {}), status {} usage {}/{}",
                blockchainId, pharmacyAddress, receipt.getTransactionHash(), saved.getStatus(),
                saved.getUsageCount(), saved.getMaxUsage());

        return DispenseResponse.builder()
                .blockchainId(blockchainId)
                .status(saved.getStatus())
                .usageCount(saved.getUsageCount())
                .maxUsage(saved.getMaxUsage())
                .remainingUsage(Math.max(0L, saved.getMaxUsage() - saved.getUsageCount()))
                .transactionHash(receipt.getTransactionHash())
                .blockNumber(receipt.getBlockNumber())
                .pharmacyAddress(saved.getDispensedBy())
                .dispensedAt(saved.getDispensedAt())
                .build();
    }

    private ChainValidationResult runGate(Prescription prescription, String actorAddress) {
        try {
            return chainValidationService.validateOnChainState(
                    prescription.getBlockchainId(), prescriptionService.snapshotOf(prescription));
        } catch (ChainValidationException e) {
            integrityAuditService.recordRejection(e, actorAddress);
            throw e;
        }
    }

    // The ledger moved the record to EXPIRED instead of dispensing; mirror that off-chain
    private ChainValidationException expiredByLedger(Prescription prescription, LedgerReceipt receipt, String pharmacyAddress) {
        prescriptionRepository.updateStatus(prescription.getBlockchainId(), PrescriptionStatus.EXPIRED,
                PrescriptionStatus.sourcesOf(PrescriptionStatus.EXPIRED));

        long nowUnix = clock.instant().getEpochSecond();
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("prescriptionId", prescription.getBlockchainId());
        context.put("transactionHash", receipt.getTransactionHash());
        context.put("nowUnix", nowUnix);
        context.put("nowISO", Instant.ofEpochSecond(nowUnix).toString());
        ChainValidationException ex = new ChainValidationException(ChainErrorCode.EXPIRED_ON_CHAIN,
                "Prescription " + prescription.getBlockchainId() + " expired on-chain during dispense", context);
        integrityAuditService.recordRejection(ex, pharmacyAddress);
        return ex;
    }
}
