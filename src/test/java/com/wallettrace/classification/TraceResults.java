package com.wallettrace.classification;

import com.wallettrace.domain.AddressCategory;
import com.wallettrace.domain.FundedAccount;
import com.wallettrace.domain.FundingSource;
import com.wallettrace.domain.SiblingCandidate;
import com.wallettrace.domain.TraceResult;
import com.wallettrace.domain.TradingBehavior;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static com.wallettrace.TransferFixtures.T0;
import static com.wallettrace.TransferFixtures.addr;

/**
 * Hand-built trace results for the classification tests.
 */
final class TraceResults {

    private TraceResults() {
    }

    static TraceResult result(String total) {
        TraceResult result = new TraceResult(addr('a'));
        result.setTotalFunded(new BigDecimal(total));
        return result;
    }

    static void addSource(TraceResult result, AddressCategory type, String amount) {
        List<FundingSource> sources = new ArrayList<>(result.getFundingSources());
        sources.add(new FundingSource(addr(sources.size() + 100), new BigDecimal(amount), 1, T0, List.of(),
                null, type, null));
        result.setFundingSources(sources);
    }

    static void addSiblings(TraceResult result, int count) {
        List<SiblingCandidate> siblings = new ArrayList<>(result.getSiblings());
        for (int i = 0; i < count; i++) {
            SiblingCandidate sibling = new SiblingCandidate(addr(siblings.size() + 200));
            sibling.setMember(true);
            siblings.add(sibling);
        }
        result.setSiblings(siblings);
    }

    static void addFundedMembers(TraceResult result, int count) {
        List<FundedAccount> funded = new ArrayList<>(result.getFundedAccounts());
        for (int i = 0; i < count; i++) {
            funded.add(new FundedAccount(addr(funded.size() + 300), new BigDecimal("100"), 1, T0, List.of(), true));
        }
        result.setFundedAccounts(funded);
    }

    static TradingBehavior trading(int trades, int markets, Long ageDays) {
        return new TradingBehavior(trades, markets, markets, T0, T0, ageDays);
    }
}
