package com.wallettrace.domain;

import java.math.BigDecimal;

/**
 * Portfolio snapshot of the target on the platform. {@code winRate} is a percentage (0-100).
 */
public record PortfolioSummary(
        BigDecimal totalValue,
        BigDecimal unrealizedPnl,
        BigDecimal realizedPnl,
        BigDecimal winRate,
        int positionsCount,
        int totalTrades
) {
}
