package com.wallettrace.provider;

import com.wallettrace.domain.AccountProfile;
import com.wallettrace.domain.PlatformActivity;
import com.wallettrace.domain.PortfolioSummary;
import com.wallettrace.domain.Position;

import java.util.List;
import java.util.Optional;

/**
 * Platform-side view of an account: recent trading records, open positions, portfolio summary and profile.
 */
public interface PlatformActivityProvider {

    /** Most recent trading records, newest first or in any order. */
    List<PlatformActivity> activity(String address);

    Optional<PortfolioSummary> portfolio(String address);

    /** Open positions. Empty when the provider does not expose them. */
    default List<Position> positions(String address) {
        return List.of();
    }

    default Optional<AccountProfile> profile(String address) {
        return Optional.empty();
    }
}
