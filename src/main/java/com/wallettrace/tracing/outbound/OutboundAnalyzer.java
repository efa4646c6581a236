package com.wallettrace.tracing.outbound;

import com.wallettrace.config.TraceEngineConfig;
import com.wallettrace.domain.FundedAccount;
import com.wallettrace.domain.FundingEdge;
import com.wallettrace.domain.Transfer;
import com.wallettrace.provider.LedgerProvider;
import com.wallettrace.provider.MembershipOracle;
import com.wallettrace.tracing.graph.FundingGraphBuilder;
import com.wallettrace.tracing.lookup.BoundedLookupExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Who did the target pay? Reports every recipient above the dust threshold, members and non-members alike.
 */
@Component
@Slf4j
public class OutboundAnalyzer {

    static final Comparator<FundingEdge> LARGEST_SENT_FIRST = Comparator
            .comparing(FundingEdge::totalAmount, Comparator.reverseOrder())
            .thenComparing(FundingEdge::firstSeen)
            .thenComparing(FundingEdge::counterparty);

    private final LedgerProvider ledgerProvider;
    private final MembershipOracle membershipOracle;
    private final FundingGraphBuilder fundingGraphBuilder;
    private final BoundedLookupExecutor membershipLookup;

    public OutboundAnalyzer(LedgerProvider ledgerProvider,
                            MembershipOracle membershipOracle,
                            FundingGraphBuilder fundingGraphBuilder,
                            @Qualifier(TraceEngineConfig.MEMBERSHIP_LOOKUP) BoundedLookupExecutor membershipLookup) {
        this.ledgerProvider = ledgerProvider;
        this.membershipOracle = membershipOracle;
        this.fundingGraphBuilder = fundingGraphBuilder;
        this.membershipLookup = membershipLookup;
    }

    /**
     * Recipients of {@code target}, largest total first. Membership is resolved for the first {@code cap}
     * of them; the rest carry {@code member == null}.
     */
    public List<FundedAccount> findFunded(String target, BigDecimal minAmount, int cap) {
        List<Transfer> outgoing;
        try {
            outgoing = ledgerProvider.outgoingTransfers(target);
        } catch (RuntimeException e) {
            log.warn("Outgoing lookup failed for {}: {}", target, e.getMessage());
            return List.of();
        }

        List<FundingEdge> edges = fundingGraphBuilder.buildOutgoing(target, outgoing, minAmount).stream()
                .sorted(LARGEST_SENT_FIRST)
                .toList();
        List<String> toCheck = edges.stream()
                .limit(Math.max(0, cap))
                .map(FundingEdge::counterparty)
                .toList();
        Map<String, Boolean> membership = membershipLookup.lookupAll(toCheck, membershipOracle::isMember);

        List<FundedAccount> funded = edges.stream()
                .map(e -> FundedAccount.of(e, membership.get(e.counterparty())))
                .toList();
        log.info("Outbound check for {}: {} recipient(s), {} member(s)",
                target, funded.size(), funded.stream().filter(FundedAccount::isMember).count());
        return funded;
    }
}
