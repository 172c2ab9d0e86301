package com.RxLedger.rx_backend.controller;

import com.RxLedger.rx_backend.dto.request.DispenseRequest;
import com.RxLedger.rx_backend.dto.request.PrescriptionRequest;
import com.RxLedger.rx_backend.dto.response.ApiResponse;
import com.RxLedger.rx_backend.dto.response.ChainValidationResult;
import com.RxLedger.rx_backend.dto.response.DispenseResponse;
import com.RxLedger.rx_backend.dto.response.PrescriptionResponse;
import com.RxLedger.rx_backend.enums.PrescriptionStatus;
import com.RxLedger.rx_backend.service.CallerIdentityService;
import com.RxLedger.rx_backend.service.DispenseService;
import com.RxLedger.rx_backend.service.PrescriptionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/prescriptions")
@RequiredArgsConstructor
public class PrescriptionController {

    private final PrescriptionService prescriptionService;
    private final DispenseService dispenseService;
    private final CallerIdentityService callerIdentityService;

    @PostMapping
    @PreAuthorize("hasRole('DOCTOR')")
    public ResponseEntity<ApiResponse<PrescriptionResponse>> issuePrescription(
            @Valid @RequestBody PrescriptionRequest request,
            Authentication authentication) {

        // Issue as the doctor account bound to the current user, never one named by the client
        request.setDoctorAddress(callerIdentityService.resolveLedgerAddress(authentication, request.getDoctorAddress()));
        PrescriptionResponse prescription = prescriptionService.issuePrescription(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(prescription, "Prescription issued successfully"));
    }

    // Patients only see the prescription linked to their account
    @GetMapping("/{id}")
    @PreAuthorize("hasAnyRole('DOCTOR', 'PHARMACY', 'ADMIN') or hasAuthority('RX_' + #id)")
    public ResponseEntity<ApiResponse<PrescriptionResponse>> getPrescription(@PathVariable("id") String id) {
        PrescriptionResponse prescription = prescriptionService.getPrescription(id);
        return ResponseEntity.ok(ApiResponse.success(prescription));
    }

    @GetMapping("/doctor/{address}")
    @PreAuthorize("hasAnyRole('DOCTOR', 'ADMIN')")
    public ResponseEntity<ApiResponse<List<PrescriptionResponse>>> getPrescriptionsByDoctor(
            @PathVariable("address") String address) {
        List<PrescriptionResponse> prescriptions = prescriptionService.getPrescriptionsByDoctor(address);
        return ResponseEntity.ok(ApiResponse.success(prescriptions));
    }

    @PostMapping("/{id}/validate-dispense")
    @PreAuthorize("hasRole('PHARMACY')")
    public ResponseEntity<ApiResponse<ChainValidationResult>> validateDispense(
            @PathVariable("id") String id,
            @Valid @RequestBody(required = false) DispenseRequest request,
            Authentication authentication) {

        String pharmacyAddress = callerIdentityService.resolveLedgerAddress(
                authentication, request == null ? null : request.getPharmacyAddress());

        ChainValidationResult result = dispenseService.validateDispense(id, pharmacyAddress);
        return ResponseEntity.ok(ApiResponse.success(result, "Prescription is valid for dispensing"));
    }

    @PostMapping("/{id}/dispense")
    @PreAuthorize("hasRole('PHARMACY')")
    public ResponseEntity<ApiResponse<DispenseResponse>> dispensePrescription(
            @PathVariable("id") String id,
            @Valid @RequestBody(required = false) DispenseRequest request,
            Authentication authentication) {

        String pharmacyAddress = callerIdentityService.resolveLedgerAddress(
                authentication, request == null ? null : request.getPharmacyAddress());

        DispenseResponse response = dispenseService.dispense(id, pharmacyAddress);
        return ResponseEntity.ok(ApiResponse.success(response, "Prescription dispensed successfully"));
    }

    @GetMapping("/stats")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<Object>> getPrescriptionStats() {
        long activePrescriptions = prescriptionService.countPrescriptionsByStatus(PrescriptionStatus.ACTIVE);
        long dispensedPrescriptions = prescriptionService.countPrescriptionsByStatus(PrescriptionStatus.DISPENSED);
        long usedPrescriptions = prescriptionService.countPrescriptionsByStatus(PrescriptionStatus.USED);
        long expiredPrescriptions = prescriptionService.countPrescriptionsByStatus(PrescriptionStatus.EXPIRED);

        var stats = new Object() {
            public final long activeCount = activePrescriptions;
            public final long dispensedCount = dispensedPrescriptions;
            public final long usedCount = usedPrescriptions;
            public final long expiredCount = expiredPrescriptions;
            public final long totalCount = activePrescriptions + dispensedPrescriptions + usedPrescriptions + expiredPrescriptions;
        };

        return ResponseEntity.ok(ApiResponse.success(stats));
    }
}
