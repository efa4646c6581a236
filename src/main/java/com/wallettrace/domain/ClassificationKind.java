package com.wallettrace.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of account classifications, in rule priority order.
 */
public enum ClassificationKind {
    COORDINATED,
    SOPHISTICATED_CONCENTRATED,
    CROSS_CHAIN_REVIEW,
    FRESH_LARGE_FUNDING,
    SINGLE_BET,
    FUNDS_MEMBERS,
    SOME_LINKED,
    RETAIL_DIVERSIFIED,
    RETAIL,
    INCONCLUSIVE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
