package com.wallettrace.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * An address the target paid. {@code member} is null when membership was not checked or could not be resolved.
 */
public record FundedAccount(
        String address,
        BigDecimal totalSent,
        int transferCount,
        Instant firstSeen,
        List<Transfer> transfers,
        Boolean member
) {

    public FundedAccount {
        transfers = List.copyOf(transfers);
    }

    public static FundedAccount of(FundingEdge edge, Boolean member) {
        return new FundedAccount(edge.counterparty(), edge.totalAmount(), edge.transferCount(), edge.firstSeen(),
                edge.transfers(), member);
    }

    @JsonIgnore
    public boolean isMember() {
        return Boolean.TRUE.equals(member);
    }
}
