package com.wallettrace.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.wallettrace.domain.AccountProfile;
import com.wallettrace.domain.BridgeFunding;
import com.wallettrace.domain.FundedAccount;
import com.wallettrace.domain.FundingChain;
import com.wallettrace.domain.FundingHop;
import com.wallettrace.domain.FundingSource;
import com.wallettrace.domain.PortfolioSummary;
import com.wallettrace.domain.Position;
import com.wallettrace.domain.SiblingCandidate;
import com.wallettrace.domain.TraceResult;
import com.wallettrace.domain.TradingBehavior;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Renders a {@link TraceResult} into its exported JSON shape. Amounts are written as plain decimals, instants
 * as ISO-8601 strings.
 */
@Component
public class TraceReportExporter {

    private final ObjectMapper objectMapper;

    public TraceReportExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Autowired
    public TraceReportExporter(ObjectProvider<ObjectMapper> objectMapper) {
        this(objectMapper.getIfAvailable(TraceReportExporter::defaultMapper));
    }

    public ObjectNode export(TraceResult result) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("address", result.getAddress());
        root.put("is_member", result.isMember());
        AccountProfile profile = result.getProfile();
        if (profile == null) {
            root.putNull("profile");
        } else {
            ObjectNode p = root.putObject("profile");
            p.put("username", profile.username());
            p.put("name", profile.name());
            p.put("display_name", profile.displayName());
        }
        root.put("classification", result.getClassification().code());
        root.put("classification_label", ClassificationLabels.display(result));
        ArrayNode signals = root.putArray("signals");
        result.getSignals().forEach(signals::add);

        ObjectNode funding = root.putObject("funding");
        funding.put("total_funded", result.getTotalFunded());
        putInstant(funding, "first_funding_date", result.getFirstFundingAt());
        ArrayNode sources = funding.putArray("sources");
        for (FundingSource source : result.getFundingSources()) {
            ObjectNode s = sources.addObject();
            s.put("address", source.address());
            s.put("amount", source.totalAmount());
            s.put("transfer_count", source.transferCount());
            s.put("type", source.sourceType().code());
            s.put("label", source.label());
            s.put("is_bridge", source.isBridge());
            ArrayNode origins = s.putArray("bridge_origins");
            for (BridgeFunding bridgeFunding : bridgeFundingsOf(result.getBridgeFundings(), source.address())) {
                ObjectNode o = origins.addObject();
                o.put("chain", bridgeFunding.origin().originChain());
                o.put("chain_id", bridgeFunding.origin().originChainId());
                o.put("address", bridgeFunding.origin().originAddress());
                o.put("amount", bridgeFunding.origin().amount());
                o.put("tx_hash", bridgeFunding.origin().destinationTxHash());
            }
        }

        ObjectNode siblings = root.putObject("siblings");
        siblings.put("count", result.getSiblingCount());
        siblings.put("candidates_checked", result.getSiblingCandidatesChecked());
        ArrayNode siblingAccounts = siblings.putArray("accounts");
        for (SiblingCandidate sibling : result.getSiblings()) {
            if (!sibling.isMember()) {
                continue;
            }
            ObjectNode s = siblingAccounts.addObject();
            s.put("address", sibling.getAddress());
            s.put("funded", sibling.getTotalReceived());
            ArrayNode shared = s.putArray("shared_funders");
            sibling.getSharedFunders().forEach(shared::add);
        }

        ObjectNode funded = root.putObject("funded_accounts");
        funded.put("count", result.getFundedMemberCount());
        funded.put("total_sent", result.getTotalSentToOthers());
        ArrayNode memberAccounts = funded.putArray("member_accounts");
        for (FundedAccount account : result.getFundedMemberAccounts()) {
            ObjectNode a = memberAccounts.addObject();
            a.put("address", account.address());
            a.put("sent", account.totalSent());
        }

        TradingBehavior trading = result.getTrading();
        if (trading == null) {
            root.putNull("trading");
        } else {
            ObjectNode t = root.putObject("trading");
            t.put("total_trades", trading.totalTrades());
            t.put("markets_traded", trading.marketsTraded());
            t.put("unique_outcomes", trading.uniqueOutcomes());
            putInstant(t, "first_trade", trading.firstTradeAt());
            putInstant(t, "last_trade", trading.lastTradeAt());
            t.put("account_age_days", trading.accountAgeDays());
        }

        PortfolioSummary portfolio = result.getPortfolio();
        if (portfolio == null) {
            root.putNull("portfolio");
        } else {
            ObjectNode p = root.putObject("portfolio");
            p.put("total_value", portfolio.totalValue());
            p.put("unrealized_pnl", portfolio.unrealizedPnl());
            p.put("realized_pnl", portfolio.realizedPnl());
            p.put("win_rate", portfolio.winRate());
            p.put("positions_count", portfolio.positionsCount());
        }

        ArrayNode positions = root.putArray("positions");
        for (Position position : result.getPositions()) {
            ObjectNode p = positions.addObject();
            p.put("market", position.market());
            p.put("outcome", position.outcome());
            p.put("size", position.size());
            p.put("avg_price", position.avgPrice());
            p.put("current_price", position.currentPrice());
            p.put("value", position.value());
            p.put("unrealized_pnl", position.unrealizedPnl());
        }

        ObjectNode originTracing = root.putObject("origin_tracing");
        ArrayNode ultimate = originTracing.putArray("ultimate_origins");
        result.getUltimateOrigins().forEach(ultimate::add);
        ArrayNode chains = originTracing.putArray("chains");
        for (FundingChain chain : result.getOriginChains()) {
            ObjectNode c = chains.addObject();
            c.put("traced_address", chain.tracedAddress());
            c.put("depth", chain.depth());
            c.put("stop_reason", chain.stopReason().name().toLowerCase(Locale.ROOT));
            FundingHop origin = chain.origin();
            if (origin == null) {
                c.putNull("origin");
            } else {
                ObjectNode o = c.putObject("origin");
                o.put("address", origin.from());
                o.put("type", origin.fromCategory().code());
                o.put("label", origin.fromLabel());
            }
        }
        return root;
    }

    public String toJson(TraceResult result) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(export(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize trace of " + result.getAddress(), e);
        }
    }

    private static List<BridgeFunding> bridgeFundingsOf(List<BridgeFunding> fundings, String source) {
        return fundings.stream().filter(f -> source.equals(f.fundingSource())).toList();
    }

    private static void putInstant(ObjectNode node, String field, Instant value) {
        if (value == null) {
            node.putNull(field);
        } else {
            node.put(field, value.toString());
        }
    }

    private static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
