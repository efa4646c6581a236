package com.wallettrace.classification;

import com.wallettrace.domain.ClassificationKind;
import com.wallettrace.domain.TraceResult;
import com.wallettrace.domain.TradingBehavior;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Ordered decision list over a trace result: the first matching rule wins. Rules run from most to least
 * severe, so a coordinated account with bridge funding is still reported as coordinated.
 */
@Component
public class TraceClassifier {

    static final int COORDINATED_MIN_LINKED = 3;
    static final int CONCENTRATED_MAX_MARKETS = 3;
    static final BigDecimal SOPHISTICATED_MIN_FUNDING = new BigDecimal("10000");
    static final long FRESH_ACCOUNT_MAX_DAYS = 14;
    static final BigDecimal FRESH_MIN_FUNDING = new BigDecimal("5000");
    static final int SINGLE_BET_MAX_TRADES = 10;
    static final BigDecimal SINGLE_BET_MIN_FUNDING = new BigDecimal("2000");
    static final int DIVERSIFIED_MIN_MARKETS = 5;

    public ClassificationKind classify(TraceResult result) {
        int siblings = result.getSiblingCount();
        int fundedMembers = result.getFundedMemberCount();
        boolean bridgeFunded = result.hasBridgeFunding();
        BigDecimal total = result.getTotalFunded();
        TradingBehavior trading = result.getTrading();

        if (siblings + fundedMembers >= COORDINATED_MIN_LINKED) {
            return ClassificationKind.COORDINATED;
        }

        if (bridgeFunded) {
            if (trading != null && trading.marketsTraded() <= CONCENTRATED_MAX_MARKETS
                    && total.compareTo(SOPHISTICATED_MIN_FUNDING) >= 0) {
                return ClassificationKind.SOPHISTICATED_CONCENTRATED;
            }
            return ClassificationKind.CROSS_CHAIN_REVIEW;
        }

        if (trading != null && trading.accountAgeDays() != null
                && trading.accountAgeDays() < FRESH_ACCOUNT_MAX_DAYS
                && total.compareTo(FRESH_MIN_FUNDING) >= 0) {
            return ClassificationKind.FRESH_LARGE_FUNDING;
        }

        if (trading != null && trading.totalTrades() < SINGLE_BET_MAX_TRADES
                && trading.marketsTraded() == 1
                && total.compareTo(SINGLE_BET_MIN_FUNDING) >= 0) {
            return ClassificationKind.SINGLE_BET;
        }

        if (fundedMembers > 0) {
            return ClassificationKind.FUNDS_MEMBERS;
        }

        if (siblings == 1 || siblings == 2) {
            return ClassificationKind.SOME_LINKED;
        }

        if (siblings == 0) {
            if (trading != null && trading.marketsTraded() >= DIVERSIFIED_MIN_MARKETS) {
                return ClassificationKind.RETAIL_DIVERSIFIED;
            }
            return ClassificationKind.RETAIL;
        }

        return ClassificationKind.INCONCLUSIVE;
    }
}
