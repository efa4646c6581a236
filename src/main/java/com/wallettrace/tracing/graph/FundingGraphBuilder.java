package com.wallettrace.tracing.graph;

import com.wallettrace.config.TraceProperties;
import com.wallettrace.domain.AddressCategory;
import com.wallettrace.domain.AddressInfo;
import com.wallettrace.domain.FundingEdge;
import com.wallettrace.domain.FundingSource;
import com.wallettrace.domain.Transfer;
import com.wallettrace.domain.WalletHistory;
import com.wallettrace.provider.LedgerProvider;
import com.wallettrace.registry.AddressRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Aggregates raw transfers into one edge per counterparty. Every transfer lands in exactly one edge, so the
 * edge totals add up to the input total.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FundingGraphBuilder {

    private final AddressRegistry addressRegistry;
    private final LedgerProvider ledgerProvider;
    private final TraceProperties traceProperties;
    private final Clock clock;

    /**
     * Groups transfers by {@code counterparty}, in order of first appearance.
     */
    public List<FundingEdge> aggregate(List<Transfer> transfers, Function<Transfer, String> counterparty) {
        Map<String, EdgeAccumulator> byCounterparty = new LinkedHashMap<>();
        for (Transfer t : transfers) {
            byCounterparty.computeIfAbsent(counterparty.apply(t), EdgeAccumulator::new).add(t);
        }
        List<FundingEdge> edges = new ArrayList<>(byCounterparty.size());
        for (EdgeAccumulator acc : byCounterparty.values()) {
            edges.add(acc.toEdge());
        }
        return edges;
    }

    /**
     * One funding source per sender of {@code target}. Protocol contracts are kept but marked PROTOCOL;
     * unknown senders with little history become FRESH_WALLET.
     */
    public List<FundingSource> buildIncoming(String target, List<Transfer> transfers) {
        List<Transfer> incoming = transfers.stream()
                .filter(t -> target.equals(t.to()))
                .toList();
        List<FundingSource> sources = new ArrayList<>();
        for (FundingEdge edge : aggregate(incoming, Transfer::from)) {
            AddressInfo info = addressRegistry.classify(edge.counterparty());
            AddressCategory sourceType = info.category();
            WalletHistory history = null;
            if (sourceType == AddressCategory.UNKNOWN) {
                history = fetchWalletHistory(edge.counterparty());
                if (history != null && history.isFresh(clock.instant(), freshWalletMaxAge())) {
                    sourceType = AddressCategory.FRESH_WALLET;
                }
            }
            sources.add(FundingSource.of(edge, info, sourceType, history));
        }
        log.debug("Built {} funding source(s) for {} from {} transfer(s)", sources.size(), target, incoming.size());
        return sources;
    }

    /**
     * One edge per recipient of {@code source}, excluding protocol contracts and edges whose total is below
     * {@code minAmount}.
     */
    public List<FundingEdge> buildOutgoing(String source, List<Transfer> transfers, BigDecimal minAmount) {
        List<Transfer> outgoing = transfers.stream()
                .filter(t -> source.equals(t.from()))
                .filter(t -> !addressRegistry.isProtocolContract(t.to()))
                .toList();
        return aggregate(outgoing, Transfer::to).stream()
                .filter(e -> minAmount == null || e.totalAmount().compareTo(minAmount) >= 0)
                .toList();
    }

    private WalletHistory fetchWalletHistory(String address) {
        try {
            return ledgerProvider.walletHistory(address).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Wallet history lookup failed for {}: {}", address, e.getMessage());
            return null;
        }
    }

    private Duration freshWalletMaxAge() {
        return Duration.ofDays(Math.max(0, traceProperties.getFreshWalletMaxAgeDays()));
    }

    private static final class EdgeAccumulator {

        private final String counterparty;
        private final List<Transfer> transfers = new ArrayList<>();
        private BigDecimal total = BigDecimal.ZERO;
        private Instant firstSeen;
        private Instant lastSeen;

        private EdgeAccumulator(String counterparty) {
            this.counterparty = counterparty;
        }

        private void add(Transfer t) {
            transfers.add(t);
            total = total.add(t.amount());
            if (firstSeen == null || t.timestamp().isBefore(firstSeen)) {
                firstSeen = t.timestamp();
            }
            if (lastSeen == null || t.timestamp().isAfter(lastSeen)) {
                lastSeen = t.timestamp();
            }
        }

        private FundingEdge toEdge() {
            return new FundingEdge(counterparty, total, transfers.size(), firstSeen, lastSeen, transfers);
        }
    }
}
