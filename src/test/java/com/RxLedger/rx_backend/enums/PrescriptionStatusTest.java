package com.RxLedger.rx_backend.enums;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PrescriptionStatusTest {

    @Test
    void createdOnlyMovesToActive() {
        assertThat(PrescriptionStatus.CREATED.allowedTransitions()).containsExactly(PrescriptionStatus.ACTIVE);
    }

    @Test
    void activeAndDispensedCanBeDispensedUsedOrExpired() {
        for (PrescriptionStatus status : new PrescriptionStatus[]{PrescriptionStatus.ACTIVE, PrescriptionStatus.DISPENSED}) {
            assertThat(status.canTransitionTo(PrescriptionStatus.DISPENSED)).isTrue();
            assertThat(status.canTransitionTo(PrescriptionStatus.USED)).isTrue();
            assertThat(status.canTransitionTo(PrescriptionStatus.EXPIRED)).isTrue();
            assertThat(status.canTransitionTo(PrescriptionStatus.CREATED)).isFalse();
        }
    }

    @Test
    void usedAndExpiredAreTerminal() {
        assertThat(PrescriptionStatus.USED.isTerminal()).isTrue();
        assertThat(PrescriptionStatus.EXPIRED.isTerminal()).isTrue();
        assertThat(PrescriptionStatus.USED.canTransitionTo(PrescriptionStatus.ACTIVE)).isFalse();
        assertThat(PrescriptionStatus.ACTIVE.isTerminal()).isFalse();
    }

    @Test
    void onChainStatusCodesFollowContractOrdinals() {
        assertThat(OnChainStatus.fromCode(0)).isEqualTo(OnChainStatus.CREATED);
        assertThat(OnChainStatus.fromCode(1)).isEqualTo(OnChainStatus.ACTIVE);
        assertThat(OnChainStatus.fromCode(2)).isEqualTo(OnChainStatus.USED);
        assertThat(OnChainStatus.fromCode(3)).isEqualTo(OnChainStatus.EXPIRED);
    }
}
