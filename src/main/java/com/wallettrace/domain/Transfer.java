package com.wallettrace.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * One token transfer as delivered by the ledger provider. Addresses are lower-case and the amount is already
 * scaled by the token's declared decimals (USDC: 6).
 */
public record Transfer(
        String txHash,
        String from,
        String to,
        BigDecimal amount,
        String tokenSymbol,
        Instant timestamp,
        long blockNumber
) {

    public Transfer {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(amount, "amount must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }
}
