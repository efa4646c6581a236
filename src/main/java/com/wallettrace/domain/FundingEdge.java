package com.wallettrace.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * All transfers between one counterparty and the analysed address, in one direction.
 */
public record FundingEdge(
        String counterparty,
        BigDecimal totalAmount,
        int transferCount,
        Instant firstSeen,
        Instant lastSeen,
        List<Transfer> transfers
) {

    public FundingEdge {
        transfers = List.copyOf(transfers);
    }
}
