package com.RxLedger.rx_backend.controller;

import com.RxLedger.rx_backend.dto.request.RoleGrantRequest;
import com.RxLedger.rx_backend.dto.response.ApiResponse;
import com.RxLedger.rx_backend.dto.response.LedgerRoleResponse;
import com.RxLedger.rx_backend.dto.response.ReconciliationReport;
import com.RxLedger.rx_backend.ledger.LedgerPrescription;
import com.RxLedger.rx_backend.service.LedgerAdminService;
import com.RxLedger.rx_backend.service.ReconciliationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
public class LedgerController {

    private final LedgerAdminService ledgerAdminService;
    private final ReconciliationService reconciliationService;

    @GetMapping("/prescriptions/{id}")
    @PreAuthorize("hasAnyRole('ADMIN', 'PHARMACY')")
    public ResponseEntity<ApiResponse<LedgerPrescription>> getOnChainState(@PathVariable("id") String id) {
        return ResponseEntity.ok(ApiResponse.success(ledgerAdminService.getOnChainState(id)));
    }

    @GetMapping("/roles/{address}")
    @PreAuthorize("hasAnyRole('ADMIN', 'PHARMACY')")
    public ResponseEntity<ApiResponse<LedgerRoleResponse>> getRoles(@PathVariable("address") String address) {
        return ResponseEntity.ok(ApiResponse.success(ledgerAdminService.getRoles(address)));
    }

    @PostMapping("/doctors")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<LedgerRoleResponse>> registerDoctor(@Valid @RequestBody RoleGrantRequest request) {
        LedgerRoleResponse response = ledgerAdminService.registerDoctor(request.getAddress());
        return ResponseEntity.ok(ApiResponse.success(response, "Doctor registered successfully"));
    }

    @PostMapping("/pharmacies")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<LedgerRoleResponse>> registerPharmacy(@Valid @RequestBody RoleGrantRequest request) {
        LedgerRoleResponse response = ledgerAdminService.registerPharmacy(request.getAddress());
        return ResponseEntity.ok(ApiResponse.success(response, "Pharmacy registered successfully"));
    }

    @PostMapping("/reconcile")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<ReconciliationReport>> reconcile(
            @RequestParam(defaultValue = "false") boolean fix) {
        ReconciliationReport report = reconciliationService.reconcile(fix);
        return ResponseEntity.ok(ApiResponse.success(report, "Reconciliation completed"));
    }
}
