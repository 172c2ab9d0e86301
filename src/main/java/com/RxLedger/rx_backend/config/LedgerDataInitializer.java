package com.RxLedger.rx_backend.config;

import com.RxLedger.rx_backend.exception.LedgerException;
import com.RxLedger.rx_backend.ledger.PrescriptionLedger;
import com.RxLedger.rx_backend.service.LedgerAdminService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class LedgerDataInitializer {

    private final LedgerProperties ledgerProperties;
    private final LedgerAdminService ledgerAdminService;
    private final PrescriptionLedger prescriptionLedger;

    @Bean
    CommandLineRunner seedLedgerRoles() {
        return args -> {
            for (String doctor : ledgerProperties.getSeedDoctors()) {
                if (prescriptionLedger.isDoctor(doctor)) {
                    log.info("Doctor {} already registered", doctor);
                    continue;
                }
                try {
                    ledgerAdminService.registerDoctor(doctor);
                    log.info("✅ Seeded doctor {}", doctor);
                } catch (LedgerException e) {
                    log.warn("Could not seed doctor {}: {}", doctor, e.getMessage());
                }
            }
            for (String pharmacy : ledgerProperties.getSeedPharmacies()) {
                if (prescriptionLedger.isPharmacy(pharmacy)) {
                    log.info("Pharmacy {} already registered", pharmacy);
                    continue;
                }
                try {
                    ledgerAdminService.registerPharmacy(pharmacy);
                    log.info("✅ Seeded pharmacy {}", pharmacy);
                } catch (LedgerException e) {
                    log.warn("Could not seed pharmacy {}: {}", pharmacy, e.getMessage());
                }
            }
        };
    }
}
