package com.wallettrace.tracing.activity;

import com.wallettrace.domain.PlatformActivity;
import com.wallettrace.domain.TradingBehavior;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Summarizes platform trading records: trade count, distinct markets and outcomes, first/last trade and
 * account age in whole days.
 */
@Component
public class TradingBehaviorAnalyzer {

    /**
     * @return null when there is no activity at all
     */
    public TradingBehavior summarize(List<PlatformActivity> activity, Instant now) {
        if (activity == null || activity.isEmpty()) {
            return null;
        }
        Set<String> markets = new HashSet<>();
        Set<String> outcomes = new HashSet<>();
        Instant first = null;
        Instant last = null;
        for (PlatformActivity a : activity) {
            if (a.marketId() != null && !a.marketId().isBlank()) {
                markets.add(a.marketId());
            }
            if (a.outcome() != null && !a.outcome().isBlank()) {
                outcomes.add(a.outcome());
            }
            Instant ts = a.timestamp();
            if (ts == null) {
                continue;
            }
            if (first == null || ts.isBefore(first)) {
                first = ts;
            }
            if (last == null || ts.isAfter(last)) {
                last = ts;
            }
        }
        Long ageDays = first == null ? null : Math.max(0L, Duration.between(first, Objects.requireNonNull(now)).toDays());
        return new TradingBehavior(activity.size(), markets.size(), outcomes.size(), first, last, ageDays);
    }
}
