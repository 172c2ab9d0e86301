package com.RxLedger.rx_backend.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RoleGrantRequest {

    @NotBlank(message = "Address is required")
    @Pattern(regexp = "^0x[0-9a-fA-F]{40}$", message = "Address must be a 0x-prefixed 20-byte hex address")
    private String address;
}
