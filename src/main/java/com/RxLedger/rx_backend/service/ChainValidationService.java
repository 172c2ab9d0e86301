package com.RxLedger.rx_backend.service;

import com.RxLedger.rx_backend.config.LedgerProperties;
import com.RxLedger.rx_backend.dto.canonical.PrescriptionSnapshot;
import com.RxLedger.rx_backend.dto.response.ChainValidationResult;
import com.RxLedger.rx_backend.dto.response.HashIntegrity;
import com.RxLedger.rx_backend.enums.ChainErrorCode;
import com.RxLedger.rx_backend.enums.OnChainStatus;
import com.RxLedger.rx_backend.exception.ChainValidationException;
import com.RxLedger.rx_backend.ledger.LedgerPrescription;
import com.RxLedger.rx_backend.ledger.PrescriptionLedger;
import com.RxLedger.rx_backend.util.CanonicalSnapshotBuilder;
import com.RxLedger.rx_backend.util.PrescriptionIdCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Pre-mutation check of a prescription against the ledger. Runs, in order and stopping
 * at the first failure: connectivity, existence, status, usage, expiry, hash integrity.
 * <p>
 * Strict: an unreachable ledger is a failure, never a reason to trust the off-chain copy.
 * The gate reads only; a passing result is a precondition for the ledger dispense call,
 * not a lock, since another dispense may commit in between.
 */
@Service
@Slf4j
public class ChainValidationService {

    private final PrescriptionLedger prescriptionLedger;
    private final LedgerProperties ledgerProperties;
    private final Clock clock;
    private final Executor ledgerQueryExecutor;

    public ChainValidationService(PrescriptionLedger prescriptionLedger,
                                  LedgerProperties ledgerProperties,
                                  Clock clock,
                                  @Qualifier("ledgerQueryExecutor") Executor ledgerQueryExecutor) {
        this.prescriptionLedger = prescriptionLedger;
        this.ledgerProperties = ledgerProperties;
        this.clock = clock;
        this.ledgerQueryExecutor = ledgerQueryExecutor;
    }

    public ChainValidationResult validateOnChainState(String blockchainId, PrescriptionSnapshot snapshot) {
        String ledgerId = PrescriptionIdCodec.encode(blockchainId);

        // Step 1: connectivity
        try {
            queryLedger(prescriptionLedger::blockNumber);
        } catch (LedgerQueryFailure e) {
            Map<String, Object> context = context(blockchainId);
            context.put("rpcUrl", ledgerProperties.getRpcUrl());
            context.put("rawError", e.getMessage());
            throw reject(ChainErrorCode.CHAIN_UNREACHABLE,
                    "Blockchain RPC unreachable: " + e.getMessage(), context, e.getCause());
        }

        // Step 2: existence
        LedgerPrescription onChain;
        try {
            onChain = queryLedger(() -> prescriptionLedger.getPrescription(ledgerId));
        } catch (LedgerQueryFailure e) {
            Map<String, Object> context = context(blockchainId);
            context.put("rawError", e.getMessage());
            throw reject(ChainErrorCode.CHAIN_UNREACHABLE,
                    "Failed to read on-chain state: " + e.getMessage(), context, e.getCause());
        }
        if (onChain == null || onChain.isEmpty()) {
            throw reject(ChainErrorCode.NOT_FOUND_ON_CHAIN,
                    "Prescription " + blockchainId + " not found on blockchain", context(blockchainId), null);
        }

        // Step 3: status
        if (onChain.getStatus() != OnChainStatus.ACTIVE) {
            Map<String, Object> context = context(blockchainId);
            context.put("expected", OnChainStatus.ACTIVE.getLabel());
            context.put("actual", onChain.getStatus().getLabel());
            context.put("onChainState", onChain);
            throw reject(ChainErrorCode.STATUS_MISMATCH,
                    "Prescription " + blockchainId + " is not ACTIVE on-chain (current: " + onChain.getStatus().getLabel() + ")",
                    context, null);
        }

        // Step 4: usage
        if (onChain.getUsageCount() >= onChain.getMaxUsage()) {
            Map<String, Object> context = context(blockchainId);
            context.put("usageCount", onChain.getUsageCount());
            context.put("maxUsage", onChain.getMaxUsage());
            context.put("onChainState", onChain);
            throw reject(ChainErrorCode.USAGE_EXHAUSTED,
                    "Prescription " + blockchainId + " usage limit exhausted (" + onChain.getUsageCount() + "/" + onChain.getMaxUsage() + ")",
                    context, null);
        }

        // Step 5: expiry
        Instant now = clock.instant();
        long nowUnix = now.getEpochSecond();
        if (onChain.getExpiryDate() <= nowUnix) {
            String expiryIso = Instant.ofEpochSecond(onChain.getExpiryDate()).toString();
            Map<String, Object> context = context(blockchainId);
            context.put("expiryDate", onChain.getExpiryDate());
            context.put("nowUnix", nowUnix);
            context.put("expiryISO", expiryIso);
            context.put("nowISO", Instant.ofEpochSecond(nowUnix).toString());
            context.put("onChainState", onChain);
            throw reject(ChainErrorCode.EXPIRED_ON_CHAIN,
                    "Prescription " + blockchainId + " has expired on-chain (expiry: " + expiryIso + ")",
                    context, null);
        }

        // Step 6: hash integrity, recomputed from the current off-chain snapshot
        String recomputedPatientHash = CanonicalSnapshotBuilder.patientIdentityHash(
                snapshot.getPatientName(), snapshot.getPatientAge());
        String recomputedMedHash = CanonicalSnapshotBuilder.medicationHash(snapshot.getMedicines());
        boolean patientMatch = CanonicalSnapshotBuilder.hashesEqual(recomputedPatientHash, onChain.getPatientHash());
        boolean medMatch = CanonicalSnapshotBuilder.hashesEqual(recomputedMedHash, onChain.getMedicationHash());

        if (!patientMatch || !medMatch) {
            Map<String, Object> context = context(blockchainId);
            context.put("patientMatch", patientMatch);
            context.put("medMatch", medMatch);
            context.put("onChainPatientHash", onChain.getPatientHash());
            context.put("recomputedPatientHash", recomputedPatientHash);
            context.put("onChainMedHash", onChain.getMedicationHash());
            context.put("recomputedMedHash", recomputedMedHash);
            context.put("onChainState", onChain);
            throw reject(ChainErrorCode.HASH_MISMATCH,
                    "Prescription " + blockchainId + " data integrity check failed: off-chain data does not match on-chain hashes",
                    context, null);
        }

        log.info("[CHAIN_VALID] prescriptionId={} status={} usage={}/{} hashOK=true",
                blockchainId, onChain.getStatus(), onChain.getUsageCount(), onChain.getMaxUsage());

        return ChainValidationResult.builder()
                .prescriptionId(blockchainId)
                .onChainState(onChain)
                .hashIntegrity(HashIntegrity.builder()
                        .patientMatch(true)
                        .medMatch(true)
                        .recomputedPatientHash(recomputedPatientHash)
                        .recomputedMedHash(recomputedMedHash)
                        .canonicalVersion(CanonicalSnapshotBuilder.VERSION)
                        .build())
                .validatedAt(now)
                .build();
    }

    /**
     * Runs one blocking ledger read, bounded by the configured timeout.
     */
    private <T> T queryLedger(Supplier<T> query) throws LedgerQueryFailure {
        Duration timeout = ledgerProperties.getTimeout();
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(query, ledgerQueryExecutor);
        } catch (RejectedExecutionException e) {
            throw new LedgerQueryFailure("Ledger query rejected: " + e.getMessage(), e);
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new LedgerQueryFailure("RPC timeout after " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new LedgerQueryFailure(cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new LedgerQueryFailure("Validation interrupted", e);
        }
    }

    private ChainValidationException reject(ChainErrorCode code, String message, Map<String, Object> context, Throwable cause) {
        if (code.isSecurityEvent()) {
            log.error("[{}] prescriptionId={} patientMatch={} medMatch={}",
                    code, context.get("prescriptionId"), context.get("patientMatch"), context.get("medMatch"));
        } else {
            log.warn("[{}] prescriptionId={} {}", code, context.get("prescriptionId"), message);
        }
        return new ChainValidationException(code, message, context, cause);
    }

    private static Map<String, Object> context(String blockchainId) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("prescriptionId", blockchainId);
        return context;
    }

    private static final class LedgerQueryFailure extends Exception {
        private LedgerQueryFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
