package com.wallettrace.classification;

import com.wallettrace.domain.AddressCategory;
import com.wallettrace.domain.FundingSource;
import com.wallettrace.domain.PortfolioSummary;
import com.wallettrace.domain.TraceResult;
import com.wallettrace.domain.TradingBehavior;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Fixed, ordered battery of independent checks over a trace result. Each check adds at most one signal.
 * Pure: no I/O, no clock.
 */
@Component
public class SignalGenerator {

    static final int VERY_FRESH_ACCOUNT_DAYS = 7;
    static final int NEW_ACCOUNT_DAYS = 30;
    static final int HIGH_SIBLING_COUNT = 5;
    static final int MEDIUM_SIBLING_COUNT = 2;
    static final int CONCENTRATED_MAX_MARKETS = 3;
    static final int HIGH_ACTIVITY_TRADES = 100;
    static final int LOW_ACTIVITY_TRADES = 10;
    static final BigDecimal LARGE_PORTFOLIO = new BigDecimal("50000");
    static final BigDecimal HIGH_WIN_RATE = new BigDecimal("70");
    static final BigDecimal LOW_WIN_RATE = new BigDecimal("30");
    static final int LOW_WIN_RATE_MIN_TRADES = 10;
    static final BigDecimal WHALE_FUNDING = new BigDecimal("100000");
    static final BigDecimal LARGE_FUNDING = new BigDecimal("50000");
    static final BigDecimal SIGNIFICANT_FUNDING = new BigDecimal("10000");
    static final int MULTIPLE_FUNDERS = 3;

    /** Sources that are not wallets of a person: they do not count as distinct funders. */
    private static final Set<AddressCategory> NON_WALLET_SOURCES =
            EnumSet.of(AddressCategory.BRIDGE, AddressCategory.PROTOCOL, AddressCategory.SWAP);

    public List<String> generateSignals(TraceResult result) {
        List<String> signals = new ArrayList<>();
        TradingBehavior trading = result.getTrading();

        if (trading != null && trading.accountAgeDays() != null) {
            long age = trading.accountAgeDays();
            if (age < VERY_FRESH_ACCOUNT_DAYS) {
                signals.add("Very fresh account (" + age + " days old)");
            } else if (age < NEW_ACCOUNT_DAYS) {
                signals.add("New account (" + age + " days old)");
            }
        }

        if (result.hasBridgeFunding()) {
            BigDecimal bridgeAmount = result.getBridgeAmount();
            signals.add("Bridge funding: " + usd(bridgeAmount) + " (" + percentOf(bridgeAmount, result.getTotalFunded()) + "%)");
            int decoded = result.getBridgeFundings().size();
            if (decoded > 0) {
                signals.add("Decoded " + decoded + " cross-chain origin(s)");
            }
        }

        BigDecimal exchangeFunding = result.getExchangeFunding();
        if (exchangeFunding.signum() > 0) {
            signals.add("Exchange funding: " + usd(exchangeFunding));
        } else if (result.hasExchangeOrigin()) {
            signals.add("Origin traced to exchange");
        }

        int siblings = result.getSiblingCount();
        if (siblings >= HIGH_SIBLING_COUNT) {
            signals.add("HIGH: " + siblings + " other platform accounts from same funder");
        } else if (siblings >= MEDIUM_SIBLING_COUNT) {
            signals.add("MEDIUM: " + siblings + " other platform accounts from same funder");
        } else if (siblings == 1) {
            signals.add("1 other platform account from same funder");
        }

        int fundedMembers = result.getFundedMemberCount();
        if (fundedMembers > 0) {
            signals.add("Funded " + fundedMembers + " other platform account(s)");
        }

        if (trading != null) {
            if (trading.marketsTraded() == 1) {
                signals.add("Single market focus");
            } else if (trading.marketsTraded() > 1 && trading.marketsTraded() <= CONCENTRATED_MAX_MARKETS) {
                signals.add("Concentrated: " + trading.marketsTraded() + " markets");
            }
            if (trading.totalTrades() >= HIGH_ACTIVITY_TRADES) {
                signals.add("High activity: " + trading.totalTrades() + "+ trades");
            } else if (trading.totalTrades() < LOW_ACTIVITY_TRADES) {
                signals.add("Low activity: " + trading.totalTrades() + " trades");
            }
        }

        PortfolioSummary portfolio = result.getPortfolio();
        if (portfolio != null) {
            if (portfolio.totalValue() != null && portfolio.totalValue().compareTo(LARGE_PORTFOLIO) >= 0) {
                signals.add("Large portfolio: " + usd(portfolio.totalValue()));
            }
            BigDecimal winRate = portfolio.winRate();
            if (winRate != null) {
                if (winRate.compareTo(HIGH_WIN_RATE) >= 0) {
                    signals.add("High win rate: " + wholePercent(winRate) + "%");
                } else if (winRate.compareTo(LOW_WIN_RATE) <= 0 && portfolio.totalTrades() >= LOW_WIN_RATE_MIN_TRADES) {
                    signals.add("Low win rate: " + wholePercent(winRate) + "%");
                }
            }
        }

        BigDecimal total = result.getTotalFunded();
        if (total.compareTo(WHALE_FUNDING) >= 0) {
            signals.add("Whale funding: " + usd(total));
        } else if (total.compareTo(LARGE_FUNDING) >= 0) {
            signals.add("Large funding: " + usd(total));
        } else if (total.compareTo(SIGNIFICANT_FUNDING) >= 0) {
            signals.add("Significant funding: " + usd(total));
        }

        long walletFunders = result.getFundingSources().stream()
                .filter(s -> !NON_WALLET_SOURCES.contains(s.sourceType()))
                .count();
        if (walletFunders >= MULTIPLE_FUNDERS) {
            signals.add("Multiple funding sources: " + walletFunders + " wallets");
        }

        long freshFunders = result.getFundingSources().stream().filter(FundingSource::isFreshWallet).count();
        if (freshFunders > 0) {
            signals.add("Funded by " + freshFunders + " fresh wallet(s)");
        }

        return signals;
    }

    static String usd(BigDecimal amount) {
        return String.format(Locale.US, "$%,.0f", amount);
    }

    private static String percentOf(BigDecimal part, BigDecimal total) {
        if (total == null || total.signum() <= 0) {
            return "0";
        }
        return part.multiply(BigDecimal.valueOf(100)).divide(total, 0, RoundingMode.HALF_UP).toPlainString();
    }

    private static String wholePercent(BigDecimal value) {
        return value.setScale(0, RoundingMode.HALF_UP).toPlainString();
    }
}
