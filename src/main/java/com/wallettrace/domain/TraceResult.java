package com.wallettrace.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate of one trace invocation. Created per request and never shared between traces.
 * Each phase's output lands in its own section after all phases have joined; signals and classification
 * are derived last.
 */
@NoArgsConstructor
@Getter
@Setter
public class TraceResult {

    private String address;
    private boolean member;
    private AccountProfile profile;

    // funding
    private List<FundingSource> fundingSources = new ArrayList<>();
    private BigDecimal totalFunded = BigDecimal.ZERO;
    private Instant firstFundingAt;
    private List<BridgeFunding> bridgeFundings = new ArrayList<>();

    // origin tracing
    private List<FundingChain> originChains = new ArrayList<>();
    private List<String> ultimateOrigins = new ArrayList<>();

    // siblings (platform members only) and how many candidates were checked
    private List<SiblingCandidate> siblings = new ArrayList<>();
    private int siblingCandidatesChecked;

    // outbound
    private List<FundedAccount> fundedAccounts = new ArrayList<>();
    private BigDecimal totalSentToOthers = BigDecimal.ZERO;

    // platform activity
    private TradingBehavior trading;
    private PortfolioSummary portfolio;
    private List<Position> positions = new ArrayList<>();

    private List<String> signals = new ArrayList<>();
    private ClassificationKind classification = ClassificationKind.INCONCLUSIVE;

    public TraceResult(String address) {
        this.address = address;
    }

    /** Number of platform members sharing a funder with the target. */
    public int getSiblingCount() {
        return (int) siblings.stream().filter(SiblingCandidate::isMember).count();
    }

    public List<FundedAccount> getFundedMemberAccounts() {
        return fundedAccounts.stream().filter(FundedAccount::isMember).toList();
    }

    public int getFundedMemberCount() {
        return getFundedMemberAccounts().size();
    }

    @JsonIgnore
    public boolean hasBridgeFunding() {
        return fundingSources.stream().anyMatch(FundingSource::isBridge);
    }

    public BigDecimal getBridgeAmount() {
        return sumWhere(AddressCategory.BRIDGE);
    }

    public BigDecimal getExchangeFunding() {
        return sumWhere(AddressCategory.EXCHANGE);
    }

    /** True when any traced origin chain starts at an exchange. */
    @JsonIgnore
    public boolean hasExchangeOrigin() {
        return originChains.stream()
                .map(FundingChain::origin)
                .anyMatch(o -> o != null && o.fromCategory() == AddressCategory.EXCHANGE);
    }

    private BigDecimal sumWhere(AddressCategory category) {
        return fundingSources.stream()
                .filter(s -> s.sourceType() == category)
                .map(FundingSource::totalAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
