package com.RxLedger.rx_backend.enums;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Off-chain status of a prescription record. DISPENSED means dispensed at least once
 * with usages left; USED and EXPIRED are terminal.
 */
public enum PrescriptionStatus {
    CREATED,
    ACTIVE,
    DISPENSED,
    USED,
    EXPIRED;

    public Set<PrescriptionStatus> allowedTransitions() {
        switch (this) {
            case CREATED:
                return EnumSet.of(ACTIVE);
            case ACTIVE:
            case DISPENSED:
                return EnumSet.of(DISPENSED, USED, EXPIRED);
            default:
                return Collections.emptySet();
        }
    }

    public boolean canTransitionTo(PrescriptionStatus next) {
        return allowedTransitions().contains(next);
    }

    // statuses a record may be in for a move to target
    public static Set<PrescriptionStatus> sourcesOf(PrescriptionStatus target) {
        Set<PrescriptionStatus> sources = EnumSet.noneOf(PrescriptionStatus.class);
        for (PrescriptionStatus status : values()) {
            if (status.canTransitionTo(target)) {
                sources.add(status);
            }
        }
        return sources;
    }

    public boolean isTerminal() {
        return allowedTransitions().isEmpty();
    }
}
