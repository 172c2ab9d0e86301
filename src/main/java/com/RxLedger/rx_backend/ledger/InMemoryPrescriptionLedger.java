package com.RxLedger.rx_backend.ledger;

import com.RxLedger.rx_backend.enums.OnChainStatus;
import com.RxLedger.rx_backend.exception.LedgerException;
import com.RxLedger.rx_backend.util.CanonicalSnapshotBuilder;
import com.RxLedger.rx_backend.util.PrescriptionIdCodec;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.WalletUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * In-process implementation of the prescription registry contract. Every public
 * method is one transaction; they are serialized on this instance, so concurrent
 * dispenses of the same record are applied one after the other.
 */
@Slf4j
public class InMemoryPrescriptionLedger implements PrescriptionLedger {

    private final String owner;
    private final Clock clock;

    private final Set<String> doctors = new HashSet<>();
    private final Set<String> pharmacies = new HashSet<>();
    private final Map<String, StoredPrescription> prescriptions = new HashMap<>();
    private final List<LedgerEvent> eventLog = new ArrayList<>();
    private long blockNumber;

    public InMemoryPrescriptionLedger(String owner, Clock clock) {
        this.owner = normalizeAddress(owner);
        this.clock = clock;
    }

    @Override
    public synchronized long blockNumber() {
        return blockNumber;
    }

    @Override
    public synchronized LedgerPrescription getPrescription(String prescriptionId) {
        StoredPrescription stored = prescriptions.get(normalizeId(prescriptionId));
        return stored == null ? LedgerPrescription.empty() : stored.toRecord();
    }

    @Override
    public synchronized LedgerReceipt issuePrescription(String caller, IssueCommand command) {
        String issuer = normalizeAddress(caller);
        require(doctors.contains(issuer), LedgerException.NOT_DOCTOR);

        String id = normalizeId(command.getPrescriptionId());
        require(!PrescriptionIdCodec.isZero(id), "Invalid prescription id");
        require(!prescriptions.containsKey(id), LedgerException.ALREADY_EXISTS);
        require(command.getMaxUsage() > 0, "Max usage must be positive");
        require(command.getExpiryDate() > now(), "Expiry must be in the future");

        StoredPrescription stored = new StoredPrescription();
        stored.id = id;
        stored.issuer = issuer;
        stored.status = OnChainStatus.ACTIVE;
        stored.maxUsage = command.getMaxUsage();
        stored.quantity = command.getQuantity();
        stored.expiryDate = command.getExpiryDate();
        stored.patientHash = command.getPatientHash().toLowerCase(Locale.ROOT);
        stored.medicationHash = command.getMedicationHash().toLowerCase(Locale.ROOT);
        prescriptions.put(id, stored);

        log.debug("Ledger issue {} by {} maxUsage={} expiry={}", id, issuer, stored.maxUsage, stored.expiryDate);
        return commit("issuePrescription", id, LedgerEvent.builder()
                .type(LedgerEvent.Type.PRESCRIPTION_CREATED)
                .prescriptionId(id)
                .actor(issuer)
                .medicationHash(stored.medicationHash)
                .build());
    }

    @Override
    public synchronized LedgerReceipt dispensePrescription(String caller, String prescriptionId) {
        String pharmacy = normalizeAddress(caller);
        require(pharmacies.contains(pharmacy), LedgerException.NOT_PHARMACY);

        String id = normalizeId(prescriptionId);
        StoredPrescription stored = prescriptions.get(id);
        // an unknown id reads as the default status, which is not ACTIVE either
        require(stored != null && stored.status == OnChainStatus.ACTIVE, LedgerException.NOT_ACTIVE);

        if (stored.expiryDate <= now()) {
            stored.status = OnChainStatus.EXPIRED;
            log.debug("Ledger expire {} on dispense attempt by {}", id, pharmacy);
            return commit("dispensePrescription", id, LedgerEvent.builder()
                    .type(LedgerEvent.Type.PRESCRIPTION_EXPIRED)
                    .prescriptionId(id)
                    .build());
        }

        stored.usageCount++;
        if (stored.usageCount == stored.maxUsage) {
            stored.status = OnChainStatus.USED;
        }
        log.debug("Ledger dispense {} by {} usage={}/{}", id, pharmacy, stored.usageCount, stored.maxUsage);
        return commit("dispensePrescription", id, LedgerEvent.builder()
                .type(LedgerEvent.Type.PRESCRIPTION_DISPENSED)
                .prescriptionId(id)
                .actor(pharmacy)
                .remainingUsage(stored.maxUsage - stored.usageCount)
                .build());
    }

    @Override
    public synchronized LedgerReceipt registerDoctor(String caller, String doctor) {
        require(owner.equals(normalizeAddress(caller)), LedgerException.NOT_OWNER);
        doctors.add(normalizeAddress(doctor));
        return commit("registerDoctor", doctor, null);
    }

    @Override
    public synchronized LedgerReceipt registerPharmacy(String caller, String pharmacy) {
        require(owner.equals(normalizeAddress(caller)), LedgerException.NOT_OWNER);
        pharmacies.add(normalizeAddress(pharmacy));
        return commit("registerPharmacy", pharmacy, null);
    }

    @Override
    public synchronized boolean isDoctor(String address) {
        return doctors.contains(normalizeAddress(address));
    }

    @Override
    public synchronized boolean isPharmacy(String address) {
        return pharmacies.contains(normalizeAddress(address));
    }

    @Override
    public String adminAddress() {
        return owner;
    }

    public synchronized List<LedgerEvent> events() {
        return new ArrayList<>(eventLog);
    }

    public synchronized int doctorCount() {
        return doctors.size();
    }

    public synchronized int pharmacyCount() {
        return pharmacies.size();
    }

    private LedgerReceipt commit(String method, String subject, LedgerEvent event) {
        blockNumber++;
        LedgerReceipt.LedgerReceiptBuilder receipt = LedgerReceipt.builder()
                .transactionHash(CanonicalSnapshotBuilder.keccakHex(blockNumber + ":" + method + ":" + subject))
                .blockNumber(blockNumber);
        if (event != null) {
            eventLog.add(event);
            receipt.event(event);
        }
        return receipt.build();
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    private static void require(boolean condition, String reason) {
        if (!condition) {
            throw LedgerException.reverted(reason);
        }
    }

    private static String normalizeId(String prescriptionId) {
        if (prescriptionId == null) {
            throw LedgerException.reverted("Invalid prescription id");
        }
        return prescriptionId.toLowerCase(Locale.ROOT);
    }

    static String normalizeAddress(String address) {
        if (address == null || !WalletUtils.isValidAddress(address)) {
            throw LedgerException.reverted("Invalid address: " + address);
        }
        String lower = address.toLowerCase(Locale.ROOT);
        return lower.startsWith("0x") ? lower : "0x" + lower;
    }

    private static final class StoredPrescription {
        private String id;
        private String issuer;
        private OnChainStatus status;
        private long usageCount;
        private long maxUsage;
        private long quantity;
        private long expiryDate;
        private String patientHash;
        private String medicationHash;

        private LedgerPrescription toRecord() {
            return LedgerPrescription.builder()
                    .id(id)
                    .issuer(issuer)
                    .status(status)
                    .usageCount(usageCount)
                    .maxUsage(maxUsage)
                    .quantity(quantity)
                    .expiryDate(expiryDate)
                    .patientHash(patientHash)
                    .medicationHash(medicationHash)
                    .build();
        }
    }
}
