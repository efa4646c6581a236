package com.wallettrace.report;

import com.wallettrace.domain.ClassificationKind;
import com.wallettrace.domain.TraceResult;

/**
 * Human-readable rendering of {@link ClassificationKind}: severity icon plus prose.
 */
public final class ClassificationLabels {

    private ClassificationLabels() {
    }

    public static String display(ClassificationKind kind) {
        return switch (kind) {
            case COORDINATED -> "🚨 Likely Coordinated (Multi-Account)";
            case SOPHISTICATED_CONCENTRATED -> "⚠️ Likely Sophisticated/Concentrated Bet";
            case CROSS_CHAIN_REVIEW -> "⚠️ Cross-chain Funder - Review Needed";
            case FRESH_LARGE_FUNDING -> "⚠️ Fresh + Large Funding - Worth Investigating";
            case SINGLE_BET -> "⚠️ Single Bet Account - Check Market";
            case FUNDS_MEMBERS -> "⚠️ Funds Other Platform Accounts - Check for Coordination";
            case SOME_LINKED -> "ℹ️ Some Linked Accounts - Manual Review";
            case RETAIL_DIVERSIFIED -> "✅ Likely Retail (Diversified)";
            case RETAIL -> "✅ Likely Retail";
            case INCONCLUSIVE -> "❓ Inconclusive - Manual Review Needed";
        };
    }

    /**
     * Label with the counts the classification is based on, where it has any.
     */
    public static String display(TraceResult result) {
        ClassificationKind kind = result.getClassification();
        return switch (kind) {
            case COORDINATED -> display(kind) + " - "
                    + (result.getSiblingCount() + result.getFundedMemberCount()) + " linked accounts";
            case FUNDS_MEMBERS -> "⚠️ Funds " + result.getFundedMemberCount()
                    + " Other Platform Account(s) - Check for Coordination";
            default -> display(kind);
        };
    }
}
