package com.wallettrace.domain;

import java.math.BigDecimal;

/**
 * One open position of an account on the platform. Prices are per share; {@code value} is the position's
 * current value in token units.
 */
public record Position(
        String market,
        String outcome,
        BigDecimal size,
        BigDecimal avgPrice,
        BigDecimal currentPrice,
        BigDecimal value,
        BigDecimal unrealizedPnl
) {
}
