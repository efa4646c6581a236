package com.wallettrace.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Prior on-chain history of an address, used to spot freshly created funder wallets.
 */
public record WalletHistory(String address, Instant firstSeen, long transactionCount) {

    /**
     * True when the wallet has no history at all or its first activity is younger than {@code maxAge}.
     */
    public boolean isFresh(Instant now, Duration maxAge) {
        if (firstSeen == null || transactionCount == 0) {
            return true;
        }
        return Duration.between(firstSeen, now).compareTo(maxAge) < 0;
    }
}
