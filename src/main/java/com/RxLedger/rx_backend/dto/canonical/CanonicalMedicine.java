package com.RxLedger.rx_backend.dto.canonical;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

/**
 * Identity-bearing part of a prescribed medicine. Field order is part of the
 * commitment byte form.
 */
@Value
@JsonPropertyOrder({"name", "dosage", "quantity"})
public class CanonicalMedicine {
    String name;
    String dosage;
    long quantity;
}
