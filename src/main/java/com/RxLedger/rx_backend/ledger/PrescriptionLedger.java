package com.RxLedger.rx_backend.ledger;

/**
 * Query/submit view of the prescription registry contract.
 * <p>
 * Identifiers are bytes32 hex strings (see {@code PrescriptionIdCodec}); addresses are
 * 0x-prefixed hex. Submit calls either return the receipt of an accepted transaction or
 * throw {@code LedgerException} carrying the revert reason. Implementations serialize
 * state-changing calls: the ledger, not its callers, prevents double dispensing.
 */
public interface PrescriptionLedger {

    /**
     * Current block height; used as the liveness probe.
     */
    long blockNumber();

    /**
     * Returns the zero record for unknown identifiers.
     */
    LedgerPrescription getPrescription(String prescriptionId);

    LedgerReceipt issuePrescription(String caller, IssueCommand command);

    /**
     * An expired record is moved to EXPIRED and the receipt carries an expiry event
     * instead of a dispensed event; the call itself does not revert in that case.
     */
    LedgerReceipt dispensePrescription(String caller, String prescriptionId);

    LedgerReceipt registerDoctor(String caller, String doctor);

    LedgerReceipt registerPharmacy(String caller, String pharmacy);

    boolean isDoctor(String address);

    boolean isPharmacy(String address);

    /**
     * Address that administrative calls are sent from.
     */
    String adminAddress();
}
