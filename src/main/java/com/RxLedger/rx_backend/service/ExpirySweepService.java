package com.RxLedger.rx_backend.service;

import com.RxLedger.rx_backend.enums.PrescriptionStatus;
import com.RxLedger.rx_backend.repository.PrescriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;

/**
 * Marks off-chain records past their expiry date as EXPIRED. This only tidies the
 * off-chain view; the dispense gate reads expiry from the ledger.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpirySweepService {

    private final PrescriptionRepository prescriptionRepository;
    private final Clock clock;

    @Scheduled(cron = "${rx.expiry-sweep.cron:0 0 * * * *}")
    @Transactional
    public int markExpiredPrescriptions() {
        LocalDateTime now = LocalDateTime.now(clock);
        int updated = prescriptionRepository.markExpired(now,
                EnumSet.of(PrescriptionStatus.ACTIVE, PrescriptionStatus.DISPENSED));
        if (updated > 0) {
            log.info("Expiry sweep marked {} prescriptions as EXPIRED", updated);
        } else {
            log.debug("Expiry sweep found nothing to expire");
        }
        return updated;
    }
}
