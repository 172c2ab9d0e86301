package com.RxLedger.rx_backend.controller;

import com.RxLedger.rx_backend.dto.response.ApiResponse;
import com.RxLedger.rx_backend.model.IntegrityAlert;
import com.RxLedger.rx_backend.service.IntegrityAuditService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/integrity-alerts")
@RequiredArgsConstructor
public class IntegrityAlertController {

    private final IntegrityAuditService integrityAuditService;

    @GetMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<List<IntegrityAlert>>> getRecentAlerts(
            @RequestParam(defaultValue = "50") int limit) {
        int pageSize = Math.max(1, Math.min(limit, 500));
        return ResponseEntity.ok(ApiResponse.success(integrityAuditService.getRecentAlerts(pageSize)));
    }
}
