package com.RxLedger.rx_backend.service;

import com.RxLedger.rx_backend.exception.ChainValidationException;
import com.RxLedger.rx_backend.model.IntegrityAlert;
import com.RxLedger.rx_backend.repository.IntegrityAlertRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class IntegrityAuditService {

    private final IntegrityAlertRepository integrityAlertRepository;

    /**
     * One audit line per gate rejection. Hash mismatches are also stored as alerts,
     * in their own transaction so the caller's rollback does not erase them.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordRejection(ChainValidationException ex, String actorAddress) {
        log.warn("AUDIT code={} retryable={} prescriptionId={} actor={} context={}",
                ex.getCode(), ex.isRetryable(), ex.getContext().get("prescriptionId"), actorAddress, ex.getContext());

        if (!ex.getCode().isSecurityEvent()) {
            return;
        }

        IntegrityAlert alert = IntegrityAlert.builder()
                .code(ex.getCode())
                .blockchainId(String.valueOf(ex.getContext().get("prescriptionId")))
                .actorAddress(actorAddress)
                .description(ex.getMessage())
                .patientMatch(Boolean.TRUE.equals(ex.getContext().get("patientMatch")))
                .medMatch(Boolean.TRUE.equals(ex.getContext().get("medMatch")))
                .build();
        integrityAlertRepository.save(alert);
        log.error("SECURITY integrity alert raised for prescription {} (patientMatch={}, medMatch={})",
                alert.getBlockchainId(), alert.isPatientMatch(), alert.isMedMatch());
    }

    @Transactional(readOnly = true)
    public List<IntegrityAlert> getRecentAlerts(int limit) {
        return integrityAlertRepository.findAllByOrderByDetectedAtDesc(PageRequest.of(0, limit));
    }
}
