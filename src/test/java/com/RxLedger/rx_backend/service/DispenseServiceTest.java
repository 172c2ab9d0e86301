package com.RxLedger.rx_backend.service;

import com.RxLedger.rx_backend.dto.canonical.PrescriptionSnapshot;
import com.RxLedger.rx_backend.dto.response.ChainValidationResult;
import com.RxLedger.rx_backend.dto.response.DispenseResponse;
import com.RxLedger.rx_backend.enums.ChainErrorCode;
import com.RxLedger.rx_backend.enums.OnChainStatus;
import com.RxLedger.rx_backend.enums.PrescriptionStatus;
import com.RxLedger.rx_backend.exception.ChainValidationException;
import com.RxLedger.rx_backend.exception.InvalidStatusTransitionException;
import com.RxLedger.rx_backend.exception.LedgerException;
import com.RxLedger.rx_backend.ledger.LedgerEvent;
import com.RxLedger.rx_backend.ledger.LedgerPrescription;
import com.RxLedger.rx_backend.ledger.LedgerReceipt;
import com.RxLedger.rx_backend.ledger.PrescriptionLedger;
import com.RxLedger.rx_backend.model.Prescription;
import com.RxLedger.rx_backend.repository.PrescriptionRepository;
import com.RxLedger.rx_backend.util.PrescriptionIdCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DispenseServiceTest {

    private static final String PHARMACY = "0x2222222222222222222222222222222222222222";
    private static final String LEDGER_ID = PrescriptionIdCodec.encode("RX01");
    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    @Mock
    private PrescriptionRepository prescriptionRepository;
    @Mock
    private PrescriptionService prescriptionService;
    @Mock
    private ChainValidationService chainValidationService;
    @Mock
    private PrescriptionLedger prescriptionLedger;
    @Mock
    private IntegrityAuditService integrityAuditService;

    private DispenseService dispenseService;
    private Prescription prescription;
    private final PrescriptionSnapshot snapshot = PrescriptionSnapshot.builder()
            .patientName("Jane Doe")
            .patientAge("42")
            .build();

    @BeforeEach
    void setUp() {
        dispenseService = new DispenseService(prescriptionRepository, prescriptionService, chainValidationService,
                prescriptionLedger, integrityAuditService, Clock.fixed(NOW, ZoneOffset.UTC));
        prescription = Prescription.builder()
                .blockchainId("RX01")
                .doctorAddress("0x1111111111111111111111111111111111111111")
                .patientName("Jane Doe")
                .patientAge("42")
                .status(PrescriptionStatus.ACTIVE)
                .maxUsage(1L)
                .expiryDate(LocalDateTime.ofInstant(NOW.plusSeconds(3600), ZoneOffset.UTC))
                .blockchainSynced(true)
                .items(Collections.emptyList())
                .build();
        when(prescriptionService.findPrescription("RX01")).thenReturn(prescription);
        when(prescriptionService.snapshotOf(prescription)).thenReturn(snapshot);
    }

    private ChainValidationResult passingGate(long usageCount, long maxUsage) {
        ChainValidationResult result = ChainValidationResult.builder()
                .prescriptionId("RX01")
                .onChainState(LedgerPrescription.builder()
                        .id(LEDGER_ID)
                        .status(OnChainStatus.ACTIVE)
                        .usageCount(usageCount)
                        .maxUsage(maxUsage)
                        .build())
                .validatedAt(NOW)
                .build();
        when(chainValidationService.validateOnChainState("RX01", snapshot)).thenReturn(result);
        return result;
    }

    // Same guard as the repository query: allowed source status and a strictly higher usage count
    private void storeAppliesGuardedDispense() {
        when(prescriptionRepository.recordDispense(eq("RX01"), any(PrescriptionStatus.class), anyCollection(),
                anyLong(), any(LocalDateTime.class), anyString(), anyString()))
                .thenAnswer(invocation -> {
                    synchronized (prescription) {
                        Collection<PrescriptionStatus> allowedFrom = invocation.getArgument(2);
                        long usageCount = invocation.getArgument(3);
                        if (!allowedFrom.contains(prescription.getStatus()) || prescription.getUsageCount() >= usageCount) {
                            return 0;
                        }
                        prescription.setStatus(invocation.getArgument(1));
                        prescription.setUsageCount(usageCount);
                        prescription.setDispensedAt(invocation.getArgument(4));
                        prescription.setDispensedBy(invocation.getArgument(5));
                        prescription.setConfirmedTxHash(invocation.getArgument(6));
                        return 1;
                    }
                });
    }

    private static LedgerReceipt dispensedReceipt(long remaining) {
        return dispensedReceipt(remaining, "0xabc");
    }

    private static LedgerReceipt dispensedReceipt(long remaining, String txHash) {
        return LedgerReceipt.builder()
                .transactionHash(txHash)
                .blockNumber(7L)
                .event(LedgerEvent.builder()
                        .type(LedgerEvent.Type.PRESCRIPTION_DISPENSED)
                        .prescriptionId(LEDGER_ID)
                        .actor(PHARMACY)
                        .remainingUsage(remaining)
                        .build())
                .build();
    }

    @Test
    void lastUsageMovesRecordToUsed() {
        passingGate(0, 1);
        when(prescriptionLedger.dispensePrescription(PHARMACY, LEDGER_ID)).thenReturn(dispensedReceipt(0));
        storeAppliesGuardedDispense();

        DispenseResponse response = dispenseService.dispense("RX01", PHARMACY);

        assertThat(response.getStatus()).isEqualTo(PrescriptionStatus.USED);
        assertThat(response.getUsageCount()).isEqualTo(1);
        assertThat(response.getRemainingUsage()).isZero();
        assertThat(response.getTransactionHash()).isEqualTo("0xabc");
        assertThat(response.getBlockNumber()).isEqualTo(7L);
        assertThat(prescription.getStatus()).isEqualTo(PrescriptionStatus.USED);
        assertThat(prescription.getConfirmedTxHash()).isEqualTo("0xabc");
        assertThat(prescription.getDispensedBy()).isEqualTo(PHARMACY);
        assertThat(prescription.getDispensedAt()).isEqualTo(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
    }

    @Test
    void partialUsageMovesRecordToDispensed() {
        prescription.setMaxUsage(3L);
        passingGate(0, 3);
        when(prescriptionLedger.dispensePrescription(PHARMACY, LEDGER_ID)).thenReturn(dispensedReceipt(2));
        storeAppliesGuardedDispense();

        DispenseResponse response = dispenseService.dispense("RX01", PHARMACY);

        assertThat(response.getStatus()).isEqualTo(PrescriptionStatus.DISPENSED);
        assertThat(response.getUsageCount()).isEqualTo(1);
        assertThat(response.getRemainingUsage()).isEqualTo(2);
        verify(prescriptionRepository).recordDispense(eq("RX01"), eq(PrescriptionStatus.DISPENSED),
                eq(EnumSet.of(PrescriptionStatus.ACTIVE, PrescriptionStatus.DISPENSED)), eq(1L),
                any(LocalDateTime.class), eq(PHARMACY), eq("0xabc"));
    }

    @Test
    void concurrentDispensesKeepTheLatestLedgerState() throws Exception {
        prescription.setMaxUsage(2L);
        passingGate(0, 2);
        when(prescriptionLedger.dispensePrescription(PHARMACY, LEDGER_ID))
                .thenReturn(dispensedReceipt(1, "0xfirst"), dispensedReceipt(0, "0xsecond"));
        CountDownLatch secondStored = new CountDownLatch(1);
        when(prescriptionRepository.recordDispense(eq("RX01"), any(PrescriptionStatus.class), anyCollection(),
                anyLong(), any(LocalDateTime.class), anyString(), anyString()))
                .thenAnswer(invocation -> {
                    long usageCount = invocation.getArgument(3);
                    if (usageCount == 1L) {
                        // hold the earlier receipt back until the later one is stored
                        assertThat(secondStored.await(5, TimeUnit.SECONDS)).isTrue();
                    }
                    synchronized (prescription) {
                        Collection<PrescriptionStatus> allowedFrom = invocation.getArgument(2);
                        if (!allowedFrom.contains(prescription.getStatus()) || prescription.getUsageCount() >= usageCount) {
                            return 0;
                        }
                        prescription.setStatus(invocation.getArgument(1));
                        prescription.setUsageCount(usageCount);
                        prescription.setConfirmedTxHash(invocation.getArgument(6));
                    }
                    if (usageCount == 2L) {
                        secondStored.countDown();
                    }
                    return 1;
                });

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<DispenseResponse> first = pool.submit(() -> dispenseService.dispense("RX01", PHARMACY));
            Future<DispenseResponse> second = pool.submit(() -> dispenseService.dispense("RX01", PHARMACY));

            assertThat(first.get(10, TimeUnit.SECONDS).getStatus()).isEqualTo(PrescriptionStatus.USED);
            assertThat(second.get(10, TimeUnit.SECONDS).getStatus()).isEqualTo(PrescriptionStatus.USED);
        } finally {
            pool.shutdownNow();
        }

        assertThat(prescription.getStatus()).isEqualTo(PrescriptionStatus.USED);
        assertThat(prescription.getUsageCount()).isEqualTo(2L);
        assertThat(prescription.getConfirmedTxHash()).isEqualTo("0xsecond");
    }

    @Test
    void gateRejectionIsAuditedAndNothingIsSubmitted() {
        ChainValidationException rejection = new ChainValidationException(ChainErrorCode.HASH_MISMATCH,
                "integrity", Collections.singletonMap("prescriptionId", "RX01"));
        when(chainValidationService.validateOnChainState("RX01", snapshot)).thenThrow(rejection);

        assertThatThrownBy(() -> dispenseService.dispense("RX01", PHARMACY)).isSameAs(rejection);

        verify(integrityAuditService).recordRejection(rejection, PHARMACY);
        verifyNoInteractions(prescriptionLedger, prescriptionRepository);
        assertThat(prescription.getStatus()).isEqualTo(PrescriptionStatus.ACTIVE);
    }

    @Test
    void ledgerRevertLeavesRecordUntouched() {
        passingGate(0, 1);
        when(prescriptionLedger.dispensePrescription(PHARMACY, LEDGER_ID))
                .thenThrow(LedgerException.reverted(LedgerException.NOT_ACTIVE));

        assertThatThrownBy(() -> dispenseService.dispense("RX01", PHARMACY))
                .isInstanceOf(LedgerException.class)
                .hasMessage(LedgerException.NOT_ACTIVE);

        verifyNoInteractions(prescriptionRepository);
        assertThat(prescription.getStatus()).isEqualTo(PrescriptionStatus.ACTIVE);
        assertThat(prescription.getConfirmedTxHash()).isNull();
    }

    @Test
    void expiryReportedByLedgerMarksRecordExpired() {
        passingGate(0, 1);
        when(prescriptionLedger.dispensePrescription(PHARMACY, LEDGER_ID)).thenReturn(LedgerReceipt.builder()
                .transactionHash("0xdef")
                .blockNumber(8L)
                .event(LedgerEvent.builder()
                        .type(LedgerEvent.Type.PRESCRIPTION_EXPIRED)
                        .prescriptionId(LEDGER_ID)
                        .build())
                .build());

        assertThatThrownBy(() -> dispenseService.dispense("RX01", PHARMACY))
                .isInstanceOfSatisfying(ChainValidationException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo(ChainErrorCode.EXPIRED_ON_CHAIN);
                    assertThat(ex.getContext()).containsEntry("transactionHash", "0xdef");
                });

        verify(prescriptionRepository).updateStatus("RX01", PrescriptionStatus.EXPIRED,
                EnumSet.of(PrescriptionStatus.ACTIVE, PrescriptionStatus.DISPENSED));
        verify(integrityAuditService).recordRejection(any(ChainValidationException.class), eq(PHARMACY));
    }

    @Test
    void terminalOffChainRecordIsNotSubmitted() {
        prescription.setStatus(PrescriptionStatus.USED);
        passingGate(0, 1);

        assertThatThrownBy(() -> dispenseService.dispense("RX01", PHARMACY))
                .isInstanceOf(InvalidStatusTransitionException.class);

        verifyNoInteractions(prescriptionLedger);
    }

    @Test
    void validateDispenseOnlyRunsTheGate() {
        ChainValidationResult expected = passingGate(0, 1);

        ChainValidationResult result = dispenseService.validateDispense("RX01", PHARMACY);

        assertThat(result).isSameAs(expected);
        verifyNoInteractions(prescriptionLedger, prescriptionRepository, integrityAuditService);
    }
}
