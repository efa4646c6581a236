package com.wallettrace.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One step of an origin chain: {@code from} funded {@code to} with {@code amount} in total,
 * first seen at {@code timestamp} in {@code txHash}.
 */
public record FundingHop(
        String from,
        String to,
        BigDecimal amount,
        Instant timestamp,
        String txHash,
        AddressCategory fromCategory,
        String fromLabel
) {
}
