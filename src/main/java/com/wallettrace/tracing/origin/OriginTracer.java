package com.wallettrace.tracing.origin;

import com.wallettrace.domain.AddressCategory;
import com.wallettrace.domain.AddressInfo;
import com.wallettrace.domain.ChainStopReason;
import com.wallettrace.domain.FundingChain;
import com.wallettrace.domain.FundingEdge;
import com.wallettrace.domain.FundingHop;
import com.wallettrace.domain.Transfer;
import com.wallettrace.provider.LedgerProvider;
import com.wallettrace.registry.AddressRegistry;
import com.wallettrace.tracing.graph.FundingGraphBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Walks funding upstream from an address, one hop per step, always following the largest funder.
 * Iterative with an explicit hop budget, so cycles in the funding graph cannot keep it running.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OriginTracer {

    /** Larger total first, then earlier first transfer, then lower address. */
    static final Comparator<FundingEdge> LARGEST_FUNDER_FIRST = Comparator
            .comparing(FundingEdge::totalAmount, Comparator.reverseOrder())
            .thenComparing(FundingEdge::firstSeen)
            .thenComparing(FundingEdge::counterparty);

    private final LedgerProvider ledgerProvider;
    private final AddressRegistry addressRegistry;
    private final FundingGraphBuilder fundingGraphBuilder;

    /**
     * Traces the funding origin of {@code address}.
     *
     * @param maxHops   hop budget; the returned chain never has more hops
     * @param minAmount transfers below this amount are ignored at every step
     * @return chain ordered origin first; empty when {@code address} itself is terminal or unfunded
     */
    public FundingChain traceOrigin(String address, int maxHops, BigDecimal minAmount) {
        if (maxHops < 0) {
            throw new IllegalArgumentException("maxHops must not be negative");
        }
        Deque<FundingHop> hops = new ArrayDeque<>();
        String current = address;
        int remaining = maxHops;
        ChainStopReason stopReason;

        while (true) {
            AddressInfo currentInfo = addressRegistry.classify(current);
            if (currentInfo.category() == AddressCategory.PROTOCOL) {
                stopReason = ChainStopReason.PROTOCOL_CONTRACT;
                break;
            }
            if (remaining == 0) {
                stopReason = ChainStopReason.HOP_LIMIT;
                break;
            }
            if (currentInfo.isTerminal()) {
                stopReason = ChainStopReason.TERMINAL_CATEGORY;
                break;
            }

            List<Transfer> incoming;
            try {
                incoming = ledgerProvider.incomingTransfers(current);
            } catch (RuntimeException e) {
                log.warn("Origin trace from {} stopped at {}: incoming lookup failed: {}",
                        address, current, e.getMessage());
                stopReason = ChainStopReason.LOOKUP_FAILED;
                break;
            }

            Optional<FundingEdge> largest = largestFunder(current, incoming, minAmount);
            if (largest.isEmpty()) {
                stopReason = ChainStopReason.NO_QUALIFYING_FUNDER;
                break;
            }
            FundingEdge funder = largest.get();
            AddressInfo funderInfo = addressRegistry.classify(funder.counterparty());
            if (funderInfo.category() == AddressCategory.PROTOCOL) {
                stopReason = ChainStopReason.PROTOCOL_CONTRACT;
                break;
            }

            Transfer first = funder.transfers().get(0);
            hops.addFirst(new FundingHop(
                    funder.counterparty(),
                    current,
                    funder.totalAmount(),
                    funder.firstSeen(),
                    first.txHash(),
                    funderInfo.category(),
                    funderInfo.label()));
            current = funder.counterparty();
            remaining--;
        }

        log.debug("Origin trace from {}: depth {}, stopped on {}", address, hops.size(), stopReason);
        return new FundingChain(address, List.copyOf(hops), stopReason);
    }

    private Optional<FundingEdge> largestFunder(String current, List<Transfer> incoming, BigDecimal minAmount) {
        List<Transfer> qualifying = incoming.stream()
                .filter(t -> current.equals(t.to()))
                .filter(t -> !current.equals(t.from()))
                .filter(t -> minAmount == null || t.amount().compareTo(minAmount) >= 0)
                .sorted(Comparator.comparing(Transfer::timestamp))
                .toList();
        return fundingGraphBuilder.aggregate(qualifying, Transfer::from).stream()
                .min(LARGEST_FUNDER_FIRST);
    }
}
