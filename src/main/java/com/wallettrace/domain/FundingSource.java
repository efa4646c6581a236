package com.wallettrace.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Typed summary of one incoming funding edge of the target.
 * {@code sourceType} is the registry category, refined to FRESH_WALLET for young unknown wallets.
 */
public record FundingSource(
        String address,
        BigDecimal totalAmount,
        int transferCount,
        Instant firstSeen,
        List<Transfer> transfers,
        String label,
        AddressCategory sourceType,
        WalletHistory walletHistory
) {

    public FundingSource {
        transfers = List.copyOf(transfers);
    }

    public static FundingSource of(FundingEdge edge, AddressInfo info, AddressCategory sourceType,
                                   WalletHistory walletHistory) {
        return new FundingSource(edge.counterparty(), edge.totalAmount(), edge.transferCount(), edge.firstSeen(),
                edge.transfers(), info.label(), sourceType, walletHistory);
    }

    @JsonIgnore
    public boolean isBridge() {
        return sourceType == AddressCategory.BRIDGE;
    }

    @JsonIgnore
    public boolean isProtocol() {
        return sourceType == AddressCategory.PROTOCOL;
    }

    @JsonIgnore
    public boolean isFreshWallet() {
        return sourceType == AddressCategory.FRESH_WALLET;
    }

    /** Non-terminal sources are worth following upstream. */
    @JsonIgnore
    public boolean isTraceable() {
        return !sourceType.isTerminal();
    }
}
