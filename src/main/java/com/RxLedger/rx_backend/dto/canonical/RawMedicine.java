package com.RxLedger.rx_backend.dto.canonical;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Medicine line as held by an issuing form or the off-chain store, before
 * canonicalization. Quantity is left untyped: it is coerced by the
 * canonical builder, and only there.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawMedicine {
    private String name;
    private String dosage;
    private Object quantity;
    private String instructions;
}
