package com.RxLedger.rx_backend.service;

import com.RxLedger.rx_backend.dto.canonical.PrescriptionSnapshot;
import com.RxLedger.rx_backend.dto.response.ReconciliationReport;
import com.RxLedger.rx_backend.enums.ChainErrorCode;
import com.RxLedger.rx_backend.exception.CanonicalizationException;
import com.RxLedger.rx_backend.exception.ChainValidationException;
import com.RxLedger.rx_backend.exception.InvalidPrescriptionIdException;
import com.RxLedger.rx_backend.exception.LedgerException;
import com.RxLedger.rx_backend.ledger.LedgerPrescription;
import com.RxLedger.rx_backend.ledger.PrescriptionLedger;
import com.RxLedger.rx_backend.model.Prescription;
import com.RxLedger.rx_backend.repository.PrescriptionRepository;
import com.RxLedger.rx_backend.util.CanonicalSnapshotBuilder;
import com.RxLedger.rx_backend.util.PrescriptionIdCodec;
import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Compares every off-chain record with its ledger counterpart. In fix mode, records
 * missing from the ledger lose their synced flag; nothing else is changed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationService {

    static final int PAGE_SIZE = 200;

    private final PrescriptionRepository prescriptionRepository;
    private final PrescriptionLedger prescriptionLedger;
    private final PrescriptionService prescriptionService;
    private final Clock clock;
    private final EntityManager entityManager;

    @Transactional
    public ReconciliationReport reconcile(boolean fix) {
        long block = readLedger(null, prescriptionLedger::blockNumber);
        log.info("Reconciling prescriptions against ledger at block {} (fix={})", block, fix);

        ReconciliationReport report = ReconciliationReport.builder()
                .fixMode(fix)
                .build();

        Pageable pageable = PageRequest.of(0, PAGE_SIZE, Sort.by("issuedAt", "id"));
        Page<Prescription> page;
        do {
            page = prescriptionRepository.findAll(pageable);
            for (Prescription prescription : page.getContent()) {
                ReconciliationReport.Entry entry = check(prescription);
                if (entry.getOutcome() == ReconciliationReport.Outcome.NOT_ON_CHAIN && fix && prescription.isBlockchainSynced()) {
                    prescription.setBlockchainSynced(false);
                    prescriptionRepository.save(prescription);
                    entry.setFixed(true);
                    report.setFixedCount(report.getFixedCount() + 1);
                }
                count(report, entry.getOutcome());
                report.getEntries().add(entry);
                report.setTotal(report.getTotal() + 1);
            }
            // keep the persistence context to one page
            prescriptionRepository.flush();
            entityManager.clear();
            pageable = page.nextPageable();
        } while (page.hasNext());

        report.setCompletedAt(LocalDateTime.now(clock));
        log.info("Reconciliation done: {} match, {} mismatch, {} not on chain, {} unreadable, {} fixed",
                report.getMatchCount(), report.getMismatchCount(), report.getNotOnChainCount(),
                report.getUnreadableCount(), report.getFixedCount());
        return report;
    }

    private ReconciliationReport.Entry check(Prescription prescription) {
        String blockchainId = prescription.getBlockchainId();
        ReconciliationReport.Entry.EntryBuilder entry = ReconciliationReport.Entry.builder().blockchainId(blockchainId);

        String ledgerId;
        try {
            ledgerId = PrescriptionIdCodec.encode(blockchainId);
        } catch (InvalidPrescriptionIdException e) {
            log.warn("Prescription {} has an invalid identifier: {}", blockchainId, e.getMessage());
            return entry.outcome(ReconciliationReport.Outcome.UNREADABLE)
                    .detail(e.getMessage())
                    .build();
        }

        LedgerPrescription onChain = readLedger(blockchainId, () -> prescriptionLedger.getPrescription(ledgerId));
        if (onChain.isEmpty()) {
            log.warn("Prescription {} has no ledger record", blockchainId);
            return entry.outcome(ReconciliationReport.Outcome.NOT_ON_CHAIN)
                    .detail("No record for this identifier on the ledger")
                    .build();
        }
        entry.onChainStatus(onChain.getStatus().getLabel());

        String patientHash;
        String medHash;
        try {
            PrescriptionSnapshot snapshot = prescriptionService.snapshotOf(prescription);
            patientHash = CanonicalSnapshotBuilder.patientIdentityHash(snapshot.getPatientName(), snapshot.getPatientAge());
            medHash = CanonicalSnapshotBuilder.medicationHash(snapshot.getMedicines());
        } catch (CanonicalizationException e) {
            log.warn("Prescription {} cannot be canonicalized: {}", blockchainId, e.getMessage());
            return entry.outcome(ReconciliationReport.Outcome.UNREADABLE)
                    .detail(e.getMessage())
                    .build();
        }

        boolean patientMatch = CanonicalSnapshotBuilder.hashesEqual(patientHash, onChain.getPatientHash());
        boolean medMatch = CanonicalSnapshotBuilder.hashesEqual(medHash, onChain.getMedicationHash());
        entry.patientMatch(patientMatch).medMatch(medMatch);
        if (patientMatch && medMatch) {
            return entry.outcome(ReconciliationReport.Outcome.MATCH).build();
        }

        log.error("[{}] prescriptionId={} patientMatch={} medMatch={} (reconciliation)",
                ChainErrorCode.HASH_MISMATCH, blockchainId, patientMatch, medMatch);
        return entry.outcome(ReconciliationReport.Outcome.HASH_MISMATCH)
                .detail("Off-chain data does not match on-chain hashes")
                .build();
    }

    private static void count(ReconciliationReport report, ReconciliationReport.Outcome outcome) {
        switch (outcome) {
            case MATCH -> report.setMatchCount(report.getMatchCount() + 1);
            case HASH_MISMATCH -> report.setMismatchCount(report.getMismatchCount() + 1);
            case NOT_ON_CHAIN -> report.setNotOnChainCount(report.getNotOnChainCount() + 1);
            case UNREADABLE -> report.setUnreadableCount(report.getUnreadableCount() + 1);
        }
    }

    // A ledger failure aborts the whole run rather than reporting records as missing
    private static <T> T readLedger(String blockchainId, Supplier<T> read) {
        try {
            return read.get();
        } catch (LedgerException e) {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("prescriptionId", blockchainId);
            context.put("rawError", e.getMessage());
            throw new ChainValidationException(ChainErrorCode.CHAIN_UNREACHABLE,
                    "Reconciliation aborted, ledger unreadable: " + e.getMessage(), context, e);
        }
    }
}
