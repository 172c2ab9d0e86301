package com.RxLedger.rx_backend.util;

import com.RxLedger.rx_backend.exception.InvalidPrescriptionIdException;
import org.web3j.utils.Numeric;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Converts between short prescription codes ("A1B2C3") and the fixed-width bytes32
 * identifiers used as ledger keys. The short code is stored as text, right-padded with
 * zero bytes, so it always decodes back to itself.
 */
public final class PrescriptionIdCodec {

    public static final int ID_BYTES = 32;
    public static final String ZERO_ID = Numeric.toHexString(new byte[ID_BYTES]);
    public static final int GENERATED_CODE_LENGTH = 6;

    private static final Pattern SHORT_CODE = Pattern.compile("^[A-Z0-9]{1,31}$");

    private PrescriptionIdCodec() {
        // Utility class, no instantiation
    }

    public static boolean isValidShortCode(String shortCode) {
        return shortCode != null && SHORT_CODE.matcher(shortCode).matches();
    }

    public static byte[] encodeBytes(String shortCode) {
        if (!isValidShortCode(shortCode)) {
            throw new InvalidPrescriptionIdException("Prescription code must be 1-31 uppercase letters or digits: " + shortCode);
        }
        byte[] text = shortCode.getBytes(StandardCharsets.US_ASCII);
        return Arrays.copyOf(text, ID_BYTES);
    }

    public static String encode(String shortCode) {
        return Numeric.toHexString(encodeBytes(shortCode));
    }

    public static String decode(String idHex) {
        byte[] bytes;
        try {
            bytes = Numeric.hexStringToByteArray(idHex);
        } catch (RuntimeException e) {
            throw new InvalidPrescriptionIdException("Prescription id is not valid hex: " + idHex);
        }
        return decode(bytes);
    }

    public static String decode(byte[] idBytes) {
        if (idBytes == null || idBytes.length != ID_BYTES) {
            throw new InvalidPrescriptionIdException("Prescription id must be exactly " + ID_BYTES + " bytes");
        }
        int length = 0;
        while (length < ID_BYTES && idBytes[length] != 0) {
            length++;
        }
        // encode() always leaves a zero terminator
        if (length == ID_BYTES) {
            throw new InvalidPrescriptionIdException("Prescription id has no zero terminator");
        }
        for (int i = length; i < ID_BYTES; i++) {
            if (idBytes[i] != 0) {
                throw new InvalidPrescriptionIdException("Prescription id has bytes after its terminator");
            }
        }
        String shortCode = new String(idBytes, 0, length, StandardCharsets.US_ASCII);
        if (!isValidShortCode(shortCode)) {
            throw new InvalidPrescriptionIdException("Prescription id does not hold a valid code: " + shortCode);
        }
        return shortCode;
    }

    public static boolean isZero(String idHex) {
        return idHex == null || ZERO_ID.equalsIgnoreCase(idHex);
    }

    /**
     * Readable code taken from keccak256("name-age-epochMillis"), six hex characters.
     */
    public static String generateShortCode(String patientName, Object patientAge, Instant issuedAt) {
        String seed = patientName + "-" + patientAge + "-" + issuedAt.toEpochMilli();
        String hash = CanonicalSnapshotBuilder.keccakHex(seed);
        return hash.substring(2, 2 + GENERATED_CODE_LENGTH).toUpperCase(Locale.ROOT);
    }
}
