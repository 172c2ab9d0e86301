package com.RxLedger.rx_backend.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrescriptionRequest {

    // optional; when given it must be the caller's own address
    @Pattern(regexp = "^0x[0-9a-fA-F]{40}$", message = "Doctor address must be a 0x-prefixed 20-byte hex address")
    private String doctorAddress;

    @NotBlank(message = "Patient name is required")
    @Size(max = 255, message = "Patient name must not exceed 255 characters")
    private String patientName;

    @NotBlank(message = "Patient age is required")
    @Size(max = 10, message = "Patient age must not exceed 10 characters")
    private String patientAge;

    @Size(max = 1000, message = "Diagnosis must not exceed 1000 characters")
    private String diagnosis;

    @Size(max = 1000, message = "Allergies must not exceed 1000 characters")
    private String allergies;

    @Size(max = 1000, message = "Notes must not exceed 1000 characters")
    private String notes;

    @Min(value = 1, message = "Max usage must be at least 1")
    @Max(value = 100, message = "Max usage must not exceed 100")
    private Integer maxUsage;

    @Min(value = 1, message = "Expiry must be at least 1 day")
    @Max(value = 365, message = "Expiry must not exceed 365 days")
    private Integer expiryDays;

    @NotNull(message = "Items are required")
    @Size(min = 1, message = "At least one prescription item is required")
    @Valid
    private List<PrescriptionItemRequest> items;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PrescriptionItemRequest {

        @NotBlank(message = "Medicine name is required")
        @Size(max = 255, message = "Medicine name must not exceed 255 characters")
        private String name;

        @Size(max = 100, message = "Dosage must not exceed 100 characters")
        private String dosage;

        // raw text; coerced by the canonical snapshot builder
        @Size(max = 30, message = "Quantity must not exceed 30 characters")
        private String quantity;

        @Size(max = 500, message = "Instructions must not exceed 500 characters")
        private String instructions;
    }
}
