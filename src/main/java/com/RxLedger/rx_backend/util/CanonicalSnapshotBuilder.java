package com.RxLedger.rx_backend.util;

import com.RxLedger.rx_backend.dto.canonical.CanonicalMedicine;
import com.RxLedger.rx_backend.dto.canonical.CanonicalSnapshot;
import com.RxLedger.rx_backend.dto.canonical.RawMedicine;
import com.RxLedger.rx_backend.exception.CanonicalizationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the commitment hashes that bind an off-chain prescription to its ledger record.
 * <p>
 * Frozen protocol, version {@value #VERSION}. Every producer (issuance) and verifier
 * (dispense gate, reconciliation) must go through this class:
 * <ul>
 *     <li>medicine fields: {@code name}, {@code dosage}, {@code quantity}, in that order; instructions excluded</li>
 *     <li>name and dosage trimmed, quantity floored to an integer, non-numeric quantity counts as 0</li>
 *     <li>sorted by name using ordinal (UTF-16 code unit) comparison, ties broken by dosage then quantity</li>
 *     <li>compact JSON, UTF-8, keccak256</li>
 *     <li>patient identity: keccak256(UTF-8(trim(name) + trim(age)))</li>
 * </ul>
 * Hashes are rendered as 0x-prefixed lowercase hex.
 */
public final class CanonicalSnapshotBuilder {

    public static final String VERSION = "rx-canonical-v1";

    // Largest integer a JSON number keeps exactly in a JavaScript producer
    static final long MAX_SAFE_QUANTITY = 9_007_199_254_740_991L;
    private static final int MAX_QUANTITY_DIGITS = 16;

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper();

    private static final Comparator<CanonicalMedicine> CANONICAL_ORDER = Comparator
            .comparing(CanonicalMedicine::getName)
            .thenComparing(CanonicalMedicine::getDosage)
            .thenComparingLong(CanonicalMedicine::getQuantity);

    private CanonicalSnapshotBuilder() {
        // Utility class, no instantiation
    }

    public static CanonicalSnapshot build(String patientName, Object patientAge, List<RawMedicine> medicines) {
        List<CanonicalMedicine> canonical = canonicalizeMedicines(medicines);
        String json = toCanonicalJson(canonical);
        return CanonicalSnapshot.builder()
                .version(VERSION)
                .patientIdentityHash(patientIdentityHash(patientName, patientAge))
                .medicationHash(keccakHex(json))
                .medicines(canonical)
                .canonicalJson(json)
                .build();
    }

    public static String patientIdentityHash(String patientName, Object patientAge) {
        if (patientName == null || patientName.trim().isEmpty()) {
            throw new CanonicalizationException("Patient name is required for the identity commitment");
        }
        String age = ageText(patientAge);
        return keccakHex(patientName.trim() + age);
    }

    public static String medicationHash(List<RawMedicine> medicines) {
        return keccakHex(toCanonicalJson(canonicalizeMedicines(medicines)));
    }

    public static List<CanonicalMedicine> canonicalizeMedicines(List<RawMedicine> medicines) {
        if (medicines == null) {
            throw new CanonicalizationException("Medicine list is required");
        }
        List<CanonicalMedicine> canonical = new ArrayList<>(medicines.size());
        for (int i = 0; i < medicines.size(); i++) {
            canonical.add(canonicalizeMedicine(medicines.get(i), i));
        }
        canonical.sort(CANONICAL_ORDER);
        return canonical;
    }

    static CanonicalMedicine canonicalizeMedicine(RawMedicine medicine, int index) {
        if (medicine == null) {
            throw new CanonicalizationException("Medicine #" + (index + 1) + " is missing");
        }
        String name = medicine.getName() == null ? "" : medicine.getName().trim();
        if (name.isEmpty()) {
            throw new CanonicalizationException("Medicine #" + (index + 1) + " has no name");
        }
        String dosage = medicine.getDosage() == null ? "" : medicine.getDosage().trim();
        return new CanonicalMedicine(name, dosage, coerceQuantity(medicine.getQuantity(), name));
    }

    /**
     * Floor of the numeric value; missing or non-numeric values count as 0.
     * Negative, non-finite and out-of-range values are rejected.
     */
    public static long coerceQuantity(Object raw, String medicineName) {
        BigDecimal value;
        if (raw == null) {
            return 0L;
        } else if (raw instanceof BigDecimal) {
            value = (BigDecimal) raw;
        } else if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            if (Double.isNaN(d)) {
                return 0L;
            }
            if (Double.isInfinite(d)) {
                throw new CanonicalizationException("Quantity of " + medicineName + " is not finite");
            }
            value = BigDecimal.valueOf(d);
        } else if (raw instanceof Number) {
            value = new BigDecimal(raw.toString());
        } else if (raw instanceof CharSequence) {
            String text = raw.toString().trim();
            if (text.isEmpty()) {
                return 0L;
            }
            try {
                value = new BigDecimal(text);
            } catch (NumberFormatException e) {
                return 0L;
            }
        } else {
            throw new CanonicalizationException("Quantity of " + medicineName + " has unsupported type "
                    + raw.getClass().getSimpleName());
        }

        if (value.signum() < 0) {
            throw new CanonicalizationException("Quantity of " + medicineName + " is negative: " + raw);
        }
        // Magnitude from the exponent alone, before any scale change; "1e99999999" must not be expanded
        long integerDigits = (long) value.precision() - value.scale();
        if (integerDigits <= 0) {
            return 0L;
        }
        if (integerDigits > MAX_QUANTITY_DIGITS) {
            throw new CanonicalizationException("Quantity of " + medicineName + " is out of range: " + raw);
        }

        BigDecimal floored = value.setScale(0, RoundingMode.FLOOR);
        if (floored.compareTo(BigDecimal.valueOf(MAX_SAFE_QUANTITY)) > 0) {
            throw new CanonicalizationException("Quantity of " + medicineName + " is out of range: " + raw);
        }
        return floored.longValueExact();
    }

    public static String toCanonicalJson(List<CanonicalMedicine> canonical) {
        try {
            return CANONICAL_MAPPER.writeValueAsString(canonical);
        } catch (JsonProcessingException e) {
            throw new CanonicalizationException("Canonical medicine list is not serializable: " + e.getOriginalMessage());
        }
    }

    public static String keccakHex(String text) {
        return Numeric.toHexString(Hash.sha3(text.getBytes(StandardCharsets.UTF_8)));
    }

    public static boolean hashesEqual(String left, String right) {
        return left != null && right != null && left.equalsIgnoreCase(right);
    }

    private static String ageText(Object patientAge) {
        if (patientAge == null) {
            throw new CanonicalizationException("Patient age is required for the identity commitment");
        }
        String age;
        if (patientAge instanceof Number) {
            // 42.0 renders as "42", the same text a JavaScript producer sees
            try {
                age = new BigDecimal(patientAge.toString()).stripTrailingZeros().toPlainString();
            } catch (NumberFormatException e) {
                throw new CanonicalizationException("Patient age is not a finite number: " + patientAge);
            }
        } else {
            age = patientAge.toString().trim();
        }
        if (age.isEmpty()) {
            throw new CanonicalizationException("Patient age is required for the identity commitment");
        }
        return age;
    }
}
