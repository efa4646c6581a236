package com.wallettrace.domain;

import java.time.Instant;

/**
 * Summary of the target's platform activity. {@code accountAgeDays} counts whole days since the first trade
 * and is null when no record carried a timestamp.
 */
public record TradingBehavior(
        int totalTrades,
        int marketsTraded,
        int uniqueOutcomes,
        Instant firstTradeAt,
        Instant lastTradeAt,
        Long accountAgeDays
) {
}
