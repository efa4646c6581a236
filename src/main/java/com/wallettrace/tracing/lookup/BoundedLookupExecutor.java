package com.wallettrace.tracing.lookup;

import com.wallettrace.config.LookupProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.function.Function;

/**
 * Fans independent third-party lookups out over a shared executor with at most {@code concurrency} units in
 * flight per call, spaced by a rate limiter that releases {@code concurrency} permits per delay period.
 * <p>
 * Results are keyed by input. A unit that throws, returns null or cannot get a permit in time is left out of
 * the map: callers read absence as "unresolved". No retries.
 */
@Slf4j
public class BoundedLookupExecutor {

    private final String name;
    private final Executor executor;
    private final int concurrency;
    private final RateLimiter rateLimiter;

    public BoundedLookupExecutor(String name, Executor executor, int concurrency, RateLimiter rateLimiter) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive");
        }
        this.name = name;
        this.executor = executor;
        this.concurrency = concurrency;
        this.rateLimiter = rateLimiter;
    }

    public static BoundedLookupExecutor create(String name, Executor executor, LookupProperties.Pool pool) {
        int concurrency = Math.max(1, pool.getConcurrency());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(concurrency)
                .limitRefreshPeriod(Duration.ofMillis(Math.max(1L, pool.getDelayMs())))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, pool.getPermitTimeoutMs())))
                .build();
        return new BoundedLookupExecutor(name, executor, concurrency, RateLimiter.of(name, config));
    }

    /**
     * Runs {@code lookup} once per distinct key and waits for all units to finish.
     *
     * @return resolved values in key order; unresolved keys are absent
     */
    public <K, V> Map<K, V> lookupAll(Collection<K> keys, Function<K, V> lookup) {
        if (keys == null || keys.isEmpty()) {
            return Map.of();
        }
        List<K> distinct = new ArrayList<>(new LinkedHashSet<>(keys));
        Semaphore semaphore = new Semaphore(Math.min(concurrency, distinct.size()));
        Map<K, V> resolved = new ConcurrentHashMap<>();

        List<CompletableFuture<Void>> futures = new ArrayList<>(distinct.size());
        for (K key : distinct) {
            // the slot is taken before submission so waiting units never hold a pool thread
            try {
                semaphore.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("{} lookups interrupted after {} of {} submitted", name, futures.size(), distinct.size());
                break;
            }
            try {
                futures.add(CompletableFuture.runAsync(() -> runOne(key, lookup, semaphore, resolved), executor));
            } catch (RuntimeException e) {
                semaphore.release();
                log.warn("{} lookup for {} not submitted: {}", name, key, e.getMessage());
            }
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        Map<K, V> ordered = new LinkedHashMap<>();
        for (K key : distinct) {
            V value = resolved.get(key);
            if (value != null) {
                ordered.put(key, value);
            }
        }
        log.debug("{} lookups: {} requested, {} resolved", name, distinct.size(), ordered.size());
        return ordered;
    }

    private <K, V> void runOne(K key, Function<K, V> lookup, Semaphore semaphore, Map<K, V> resolved) {
        try {
            if (!rateLimiter.acquirePermission()) {
                log.warn("{} lookup for {} dropped: no rate limiter permit in time", name, key);
                return;
            }
            V value = lookup.apply(key);
            if (value != null) {
                resolved.put(key, value);
            }
        } catch (RuntimeException e) {
            log.warn("{} lookup failed for {}: {}", name, key, e.getMessage());
        } finally {
            semaphore.release();
        }
    }

    public String getName() {
        return name;
    }

    public int getConcurrency() {
        return concurrency;
    }
}
