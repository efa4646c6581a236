package com.wallettrace.tracing;

import com.wallettrace.classification.SignalGenerator;
import com.wallettrace.classification.TraceClassifier;
import com.wallettrace.config.AsyncConfig;
import com.wallettrace.config.TraceProperties;
import com.wallettrace.domain.AccountProfile;
import com.wallettrace.domain.BridgeFunding;
import com.wallettrace.domain.FundedAccount;
import com.wallettrace.domain.FundingChain;
import com.wallettrace.domain.FundingSource;
import com.wallettrace.domain.PortfolioSummary;
import com.wallettrace.domain.Position;
import com.wallettrace.domain.TraceResult;
import com.wallettrace.domain.TradingBehavior;
import com.wallettrace.domain.Transfer;
import com.wallettrace.provider.LedgerProvider;
import com.wallettrace.provider.MembershipOracle;
import com.wallettrace.provider.PlatformActivityProvider;
import com.wallettrace.tracing.activity.TradingBehaviorAnalyzer;
import com.wallettrace.tracing.bridge.BridgeOriginResolver;
import com.wallettrace.tracing.graph.FundingGraphBuilder;
import com.wallettrace.tracing.origin.OriginTracer;
import com.wallettrace.tracing.outbound.OutboundAnalyzer;
import com.wallettrace.tracing.sibling.SiblingDetector;
import com.wallettrace.tracing.sibling.SiblingSearch;
import com.wallettrace.validation.AddressValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Entry point of the engine: one call traces one wallet.
 * <p>
 * Incoming funding is aggregated first; origin chains (one per qualifying source), sibling detection,
 * outbound analysis, bridge decoding and platform activity then run in parallel on the trace executor. The
 * profile lookup starts before the membership check and overlaps it. Each phase returns its own value and
 * only the calling thread writes them into the result, after all phases have joined. A failing phase leaves
 * its section empty; an interrupted trace cancels the phases that have not started yet.
 */
@Service
@Slf4j
public class TraceService {

    private final AddressValidator addressValidator;
    private final LedgerProvider ledgerProvider;
    private final MembershipOracle membershipOracle;
    private final Optional<PlatformActivityProvider> platformActivityProvider;
    private final FundingGraphBuilder fundingGraphBuilder;
    private final OriginTracer originTracer;
    private final SiblingDetector siblingDetector;
    private final OutboundAnalyzer outboundAnalyzer;
    private final BridgeOriginResolver bridgeOriginResolver;
    private final TradingBehaviorAnalyzer tradingBehaviorAnalyzer;
    private final SignalGenerator signalGenerator;
    private final TraceClassifier traceClassifier;
    private final TraceProperties traceProperties;
    private final Clock clock;
    private final Executor traceExecutor;

    public TraceService(AddressValidator addressValidator,
                        LedgerProvider ledgerProvider,
                        MembershipOracle membershipOracle,
                        Optional<PlatformActivityProvider> platformActivityProvider,
                        FundingGraphBuilder fundingGraphBuilder,
                        OriginTracer originTracer,
                        SiblingDetector siblingDetector,
                        OutboundAnalyzer outboundAnalyzer,
                        BridgeOriginResolver bridgeOriginResolver,
                        TradingBehaviorAnalyzer tradingBehaviorAnalyzer,
                        SignalGenerator signalGenerator,
                        TraceClassifier traceClassifier,
                        TraceProperties traceProperties,
                        Clock clock,
                        @Qualifier(AsyncConfig.TRACE_EXECUTOR) Executor traceExecutor) {
        this.addressValidator = addressValidator;
        this.ledgerProvider = ledgerProvider;
        this.membershipOracle = membershipOracle;
        this.platformActivityProvider = platformActivityProvider;
        this.fundingGraphBuilder = fundingGraphBuilder;
        this.originTracer = originTracer;
        this.siblingDetector = siblingDetector;
        this.outboundAnalyzer = outboundAnalyzer;
        this.bridgeOriginResolver = bridgeOriginResolver;
        this.tradingBehaviorAnalyzer = tradingBehaviorAnalyzer;
        this.signalGenerator = signalGenerator;
        this.traceClassifier = traceClassifier;
        this.traceProperties = traceProperties;
        this.clock = clock;
        this.traceExecutor = traceExecutor;
    }

    /**
     * Traces {@code targetAddress} with the configured default options.
     */
    public TraceResult trace(String targetAddress) {
        return trace(targetAddress, TraceOptions.defaults(traceProperties));
    }

    /**
     * Traces {@code targetAddress}.
     *
     * @throws com.wallettrace.validation.InvalidAddressException when the address is malformed; no collaborator
     *                                                           is called in that case
     * @throws TraceInterruptedException                         when the calling thread is interrupted
     */
    public TraceResult trace(String targetAddress, TraceOptions options) {
        String target = addressValidator.requireValid(targetAddress);
        Objects.requireNonNull(options, "options must not be null");
        log.info("Trace started for {}", target);

        List<CompletableFuture<?>> submitted = new ArrayList<>();
        boolean activityEnabled = options.includeActivity() && platformActivityProvider.isPresent();
        CompletableFuture<AccountProfile> profilePhase = activityEnabled
                ? phase("profile lookup", target, () -> fetchProfile(target), null, submitted)
                : CompletableFuture.completedFuture(null);

        TraceResult result = new TraceResult(target);
        result.setMember(checkMembership(target));

        List<FundingSource> sources = fundingGraphBuilder.buildIncoming(target, fetchIncoming(target));
        result.setFundingSources(sources);
        result.setTotalFunded(sources.stream().map(FundingSource::totalAmount).reduce(BigDecimal.ZERO, BigDecimal::add));
        result.setFirstFundingAt(sources.stream().map(FundingSource::firstSeen).min(Comparator.naturalOrder()).orElse(null));

        List<CompletableFuture<FundingChain>> originPhases = new ArrayList<>();
        if (options.traceOrigin()) {
            for (FundingSource source : sources) {
                if (qualifiesForOriginTrace(source)) {
                    originPhases.add(phase("origin trace " + source.address(), target,
                            () -> originTracer.traceOrigin(source.address(), options.maxOriginHops(), options.minTraceAmount()),
                            null, submitted));
                }
            }
        }

        List<String> funders = sources.stream()
                .filter(s -> !s.isProtocol())
                .map(FundingSource::address)
                .toList();
        CompletableFuture<SiblingSearch> siblingPhase = options.deep() && options.maxSiblings() > 0 && !funders.isEmpty()
                ? phase("sibling detection", target,
                        () -> siblingDetector.findSiblings(funders, target, options.maxSiblings()), SiblingSearch.EMPTY,
                        submitted)
                : CompletableFuture.completedFuture(SiblingSearch.EMPTY);

        CompletableFuture<List<FundedAccount>> outboundPhase = options.checkOutbound()
                ? phase("outbound analysis", target,
                        () -> outboundAnalyzer.findFunded(target, options.outboundMinAmount(), options.maxSiblings()), List.of(),
                        submitted)
                : CompletableFuture.completedFuture(List.of());

        CompletableFuture<List<BridgeFunding>> bridgePhase = options.decodeBridges() && bridgeOriginResolver.isAvailable()
                ? phase("bridge decoding", target,
                        () -> bridgeOriginResolver.resolve(sources, traceProperties.getMaxBridgeDecodes()), List.of(),
                        submitted)
                : CompletableFuture.completedFuture(List.of());

        boolean member = result.isMember();
        CompletableFuture<ActivitySnapshot> activityPhase = activityEnabled
                ? phase("platform activity", target, () -> fetchActivity(target, member), ActivitySnapshot.EMPTY,
                        submitted)
                : CompletableFuture.completedFuture(ActivitySnapshot.EMPTY);

        List<CompletableFuture<?>> all = new ArrayList<>(originPhases);
        all.add(siblingPhase);
        all.add(outboundPhase);
        all.add(bridgePhase);
        all.add(activityPhase);
        all.add(profilePhase);
        awaitAll(target, all, submitted);

        List<FundingChain> chains = originPhases.stream()
                .map(CompletableFuture::join)
                .filter(Objects::nonNull)
                .toList();
        result.setOriginChains(new ArrayList<>(chains));
        result.setUltimateOrigins(ultimateOrigins(chains));

        SiblingSearch siblingSearch = siblingPhase.join();
        result.setSiblings(new ArrayList<>(siblingSearch.siblings()));
        result.setSiblingCandidatesChecked(siblingSearch.candidatesChecked());

        List<FundedAccount> funded = outboundPhase.join();
        result.setFundedAccounts(new ArrayList<>(funded));
        result.setTotalSentToOthers(funded.stream().map(FundedAccount::totalSent).reduce(BigDecimal.ZERO, BigDecimal::add));

        result.setBridgeFundings(new ArrayList<>(bridgePhase.join()));

        ActivitySnapshot activity = activityPhase.join();
        result.setTrading(activity.trading());
        result.setPortfolio(activity.portfolio());
        result.setPositions(new ArrayList<>(activity.positions()));
        result.setProfile(profilePhase.join());

        result.setSignals(signalGenerator.generateSignals(result));
        result.setClassification(traceClassifier.classify(result));

        log.info("Trace finished for {}: {} source(s), total funded {}, {} origin chain(s), {} sibling(s), "
                        + "{} funded account(s), classification {}",
                target, sources.size(), result.getTotalFunded().toPlainString(), chains.size(),
                result.getSiblingCount(), funded.size(), result.getClassification());
        return result;
    }

    private boolean qualifiesForOriginTrace(FundingSource source) {
        return source.isTraceable()
                && source.totalAmount().compareTo(traceProperties.getOriginSourceMinAmount()) >= 0;
    }

    private boolean checkMembership(String target) {
        try {
            return membershipOracle.isMember(target);
        } catch (RuntimeException e) {
            log.warn("Membership check failed for {}: {}", target, e.getMessage());
            return false;
        }
    }

    private List<Transfer> fetchIncoming(String target) {
        try {
            return ledgerProvider.incomingTransfers(target);
        } catch (RuntimeException e) {
            log.warn("Incoming lookup failed for {}: {}", target, e.getMessage());
            return List.of();
        }
    }

    private ActivitySnapshot fetchActivity(String target, boolean member) {
        PlatformActivityProvider provider = platformActivityProvider.orElseThrow();
        TradingBehavior trading = tradingBehaviorAnalyzer.summarize(provider.activity(target), clock.instant());
        if (!member) {
            return new ActivitySnapshot(trading, null, List.of());
        }
        PortfolioSummary portfolio = provider.portfolio(target).orElse(null);
        List<Position> positions = provider.positions(target);
        return new ActivitySnapshot(trading, portfolio, positions == null ? List.of() : positions);
    }

    private AccountProfile fetchProfile(String target) {
        return platformActivityProvider.orElseThrow().profile(target).orElse(null);
    }

    private static List<String> ultimateOrigins(List<FundingChain> chains) {
        Set<String> origins = new LinkedHashSet<>();
        for (FundingChain chain : chains) {
            if (chain.origin() != null) {
                origins.add(chain.origin().from());
            }
        }
        return new ArrayList<>(origins);
    }

    private <T> CompletableFuture<T> phase(String name, String target, Supplier<T> work, T fallback,
                                           List<CompletableFuture<?>> submitted) {
        CompletableFuture<T> task = CompletableFuture.supplyAsync(work, traceExecutor);
        submitted.add(task);
        return task.exceptionally(e -> {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof CancellationException) {
                log.debug("{} cancelled for {}", name, target);
                return fallback;
            }
            log.warn("{} failed for {}: {}", name, target, cause.getMessage(), cause);
            return fallback;
        });
    }

    private static void awaitAll(String target, List<CompletableFuture<?>> phases,
                                 List<CompletableFuture<?>> submitted) {
        try {
            CompletableFuture.allOf(phases.toArray(new CompletableFuture[0])).get();
        } catch (InterruptedException e) {
            // queued phases never start; running ones finish but their results are dropped
            submitted.forEach(task -> task.cancel(true));
            Thread.currentThread().interrupt();
            log.info("Trace interrupted for {}: {} phase(s) cancelled", target, submitted.size());
            throw new TraceInterruptedException(target, e);
        } catch (ExecutionException e) {
            // every phase recovers to its fallback, so this only happens on a bug in the recovery itself
            throw new IllegalStateException("Trace phase failed for " + target, e.getCause());
        }
    }

    private record ActivitySnapshot(TradingBehavior trading, PortfolioSummary portfolio, List<Position> positions) {
        private static final ActivitySnapshot EMPTY = new ActivitySnapshot(null, null, List.of());
    }
}
