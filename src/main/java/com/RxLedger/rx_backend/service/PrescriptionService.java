package com.RxLedger.rx_backend.service;

import com.RxLedger.rx_backend.config.LedgerProperties;
import com.RxLedger.rx_backend.dto.canonical.CanonicalSnapshot;
import com.RxLedger.rx_backend.dto.canonical.PrescriptionSnapshot;
import com.RxLedger.rx_backend.dto.canonical.RawMedicine;
import com.RxLedger.rx_backend.dto.request.PrescriptionRequest;
import com.RxLedger.rx_backend.dto.response.PrescriptionResponse;
import com.RxLedger.rx_backend.enums.PrescriptionStatus;
import com.RxLedger.rx_backend.exception.ApiException;
import com.RxLedger.rx_backend.exception.ResourceNotFoundException;
import com.RxLedger.rx_backend.ledger.IssueCommand;
import com.RxLedger.rx_backend.ledger.LedgerReceipt;
import com.RxLedger.rx_backend.ledger.PrescriptionLedger;
import com.RxLedger.rx_backend.model.Prescription;
import com.RxLedger.rx_backend.model.PrescriptionItem;
import com.RxLedger.rx_backend.repository.PrescriptionRepository;
import com.RxLedger.rx_backend.util.CanonicalSnapshotBuilder;
import com.RxLedger.rx_backend.util.PrescriptionIdCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class PrescriptionService {

    private static final int MAX_ID_ATTEMPTS = 5;

    private final PrescriptionRepository prescriptionRepository;
    private final PrescriptionLedger prescriptionLedger;
    private final LedgerProperties ledgerProperties;
    private final Clock clock;

    /**
     * Commits the prescription to the ledger, then stores the off-chain record.
     * Nothing is stored when the ledger rejects the issue call.
     */
    @Transactional
    public PrescriptionResponse issuePrescription(PrescriptionRequest request) {
        List<RawMedicine> medicines = request.getItems().stream()
                .map(item -> RawMedicine.builder()
                        .name(item.getName())
                        .dosage(item.getDosage())
                        .quantity(item.getQuantity())
                        .instructions(item.getInstructions())
                        .build())
                .collect(Collectors.toList());

        CanonicalSnapshot snapshot = CanonicalSnapshotBuilder.build(
                request.getPatientName(), request.getPatientAge(), medicines);

        Instant now = clock.instant();
        String blockchainId = newBlockchainId(request, now);
        int expiryDays = request.getExpiryDays() != null
                ? request.getExpiryDays() : ledgerProperties.getDefaultExpiryDays();
        long maxUsage = request.getMaxUsage() != null
                ? request.getMaxUsage() : ledgerProperties.getDefaultMaxUsage();
        long expiryDate = now.plus(Duration.ofDays(expiryDays)).getEpochSecond();

        LedgerReceipt receipt = prescriptionLedger.issuePrescription(request.getDoctorAddress(), IssueCommand.builder()
                .prescriptionId(PrescriptionIdCodec.encode(blockchainId))
                .patientHash(snapshot.getPatientIdentityHash())
                .medicationHash(snapshot.getMedicationHash())
                .quantity(snapshot.totalQuantity())
                .expiryDate(expiryDate)
                .maxUsage(maxUsage)
                .build());

        Prescription prescription = Prescription.builder()
                .blockchainId(blockchainId)
                .doctorAddress(request.getDoctorAddress().toLowerCase(Locale.ROOT))
                .patientName(request.getPatientName().trim())
                .patientAge(request.getPatientAge().trim())
                .diagnosis(request.getDiagnosis())
                .allergies(request.getAllergies())
                .notes(request.getNotes())
                .status(PrescriptionStatus.ACTIVE)
                .usageCount(0L)
                .maxUsage(maxUsage)
                .expiryDate(LocalDateTime.ofEpochSecond(expiryDate, 0, ZoneOffset.UTC))
                .patientHash(snapshot.getPatientIdentityHash())
                .medicationHash(snapshot.getMedicationHash())
                .blockchainSynced(true)
                .issueTxHash(receipt.getTransactionHash())
                .build();

        List<PrescriptionItem> items = new ArrayList<>();
        for (RawMedicine medicine : medicines) {
            String name = medicine.getName().trim();
            items.add(PrescriptionItem.builder()
                    .prescription(prescription)
                    .name(name)
                    .dosage(medicine.getDosage() == null ? "" : medicine.getDosage().trim())
                    .quantity(CanonicalSnapshotBuilder.coerceQuantity(medicine.getQuantity(), name))
                    .instructions(medicine.getInstructions())
                    .build());
        }
        prescription.setItems(items);

        Prescription saved = prescriptionRepository.save(prescription);
        log.info("Prescription {} issued by {} (tx {}, medHash {})",
                blockchainId, saved.getDoctorAddress(), receipt.getTransactionHash(), snapshot.getMedicationHash());
        return mapToPrescriptionResponse(saved);
    }

    @Transactional(readOnly = true)
    public PrescriptionResponse getPrescription(String blockchainId) {
        return mapToPrescriptionResponse(findPrescription(blockchainId));
    }

    @Transactional(readOnly = true)
    public List<PrescriptionResponse> getPrescriptionsByDoctor(String doctorAddress) {
        return prescriptionRepository.findByDoctorAddressOrderByIssuedAtDesc(doctorAddress.toLowerCase(Locale.ROOT))
                .stream()
                .map(this::mapToPrescriptionResponse)
                .collect(Collectors.toList());
    }

    public long countPrescriptionsByStatus(PrescriptionStatus status) {
        return prescriptionRepository.countByStatus(status);
    }

    public Prescription findPrescription(String blockchainId) {
        return prescriptionRepository.findByBlockchainId(blockchainId)
                .orElseThrow(() -> new ResourceNotFoundException("Prescription", "blockchainId", blockchainId));
    }

    /**
     * The fields of the stored record that its ledger commitments are computed from.
     */
    public PrescriptionSnapshot snapshotOf(Prescription prescription) {
        return PrescriptionSnapshot.builder()
                .patientName(prescription.getPatientName())
                .patientAge(prescription.getPatientAge())
                .medicines(prescription.getItems().stream()
                        .map(item -> RawMedicine.builder()
                                .name(item.getName())
                                .dosage(item.getDosage())
                                .quantity(item.getQuantity())
                                .instructions(item.getInstructions())
                                .build())
                        .collect(Collectors.toList()))
                .build();
    }

    private String newBlockchainId(PrescriptionRequest request, Instant now) {
        for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
            String candidate = PrescriptionIdCodec.generateShortCode(
                    request.getPatientName(), request.getPatientAge(), now.plusMillis(attempt));
            if (!prescriptionRepository.existsByBlockchainId(candidate)
                    && prescriptionLedger.getPrescription(PrescriptionIdCodec.encode(candidate)).isEmpty()) {
                return candidate;
            }
            log.debug("Prescription code {} already taken, retrying", candidate);
        }
        throw new ApiException("Could not allocate a unique prescription code", HttpStatus.CONFLICT, "ID_COLLISION");
    }

    PrescriptionResponse mapToPrescriptionResponse(Prescription prescription) {
        PrescriptionResponse response = PrescriptionResponse.builder()
                .id(prescription.getId())
                .blockchainId(prescription.getBlockchainId())
                .ledgerId(PrescriptionIdCodec.encode(prescription.getBlockchainId()))
                .doctorAddress(prescription.getDoctorAddress())
                .patientName(prescription.getPatientName())
                .patientAge(prescription.getPatientAge())
                .diagnosis(prescription.getDiagnosis())
                .allergies(prescription.getAllergies())
                .notes(prescription.getNotes())
                .status(prescription.getStatus())
                .usageCount(prescription.getUsageCount())
                .maxUsage(prescription.getMaxUsage())
                .expiryDate(prescription.getExpiryDate())
                .patientHash(prescription.getPatientHash())
                .medicationHash(prescription.getMedicationHash())
                .blockchainSynced(prescription.isBlockchainSynced())
                .issueTxHash(prescription.getIssueTxHash())
                .confirmedTxHash(prescription.getConfirmedTxHash())
                .dispensedBy(prescription.getDispensedBy())
                .dispensedAt(prescription.getDispensedAt())
                .issuedAt(prescription.getIssuedAt())
                .build();

        if (prescription.getItems() != null && !prescription.getItems().isEmpty()) {
            response.setItems(prescription.getItems().stream()
                    .map(item -> PrescriptionResponse.PrescriptionItemResponse.builder()
                            .name(item.getName())
                            .dosage(item.getDosage())
                            .quantity(item.getQuantity())
                            .instructions(item.getInstructions())
                            .build())
                    .collect(Collectors.toList()));
        } else {
            response.setItems(new ArrayList<>());
        }

        return response;
    }
}
