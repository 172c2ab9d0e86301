package com.RxLedger.rx_backend.ledger;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
@Builder
public class LedgerReceipt {
    String transactionHash;
    long blockNumber;
    @Singular
    List<LedgerEvent> events;

    public Optional<LedgerEvent> findEvent(LedgerEvent.Type type) {
        return events.stream()
                .filter(event -> event.getType() == type)
                .findFirst();
    }
}
