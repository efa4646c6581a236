package com.wallettrace.tracing.lookup;

import com.wallettrace.config.LookupProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class BoundedLookupExecutorTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(8);

    @AfterEach
    void tearDown() throws InterruptedException {
        pool.shutdownNow();
        pool.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("results are keyed by input, in input order, duplicates looked up once")
    void resultsKeyedByInput() {
        BoundedLookupExecutor executor = BoundedLookupExecutor.create("test", pool, new LookupProperties.Pool(3, 1));
        AtomicInteger calls = new AtomicInteger();

        Map<String, Integer> result = executor.lookupAll(List.of("ccc", "a", "bb", "a"), key -> {
            calls.incrementAndGet();
            return key.length();
        });

        assertThat(result).containsExactly(Map.entry("ccc", 3), Map.entry("a", 1), Map.entry("bb", 2));
        assertThat(calls).hasValue(3);
    }

    @Test
    @DisplayName("failed and null units are absent, the rest still resolve")
    void failuresAreAbsent() {
        BoundedLookupExecutor executor = BoundedLookupExecutor.create("test", pool, new LookupProperties.Pool(2, 1));

        Map<String, Boolean> result = executor.lookupAll(List.of("ok", "boom", "none"), key -> {
            if (key.equals("boom")) {
                throw new IllegalStateException("HTTP 500");
            }
            return key.equals("none") ? null : Boolean.TRUE;
        });

        assertThat(result).containsOnlyKeys("ok");
    }

    @Test
    @DisplayName("never more than the configured number of units in flight")
    void concurrencyBounded() {
        BoundedLookupExecutor executor = BoundedLookupExecutor.create("test", pool, new LookupProperties.Pool(2, 1));
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();

        Map<Integer, Integer> result = executor.lookupAll(List.of(1, 2, 3, 4, 5, 6, 7, 8), key -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.decrementAndGet();
            }
            return key * 10;
        });

        assertThat(result).hasSize(8);
        assertThat(maxInFlight.get()).isBetween(1, 2);
    }

    @Test
    @DisplayName("units waiting for a slot are not handed to the executor")
    void waitingUnitsNotSubmitted() throws Exception {
        BlockingQueue<Runnable> submitted = new LinkedBlockingQueue<>();
        BoundedLookupExecutor executor = new BoundedLookupExecutor("test", submitted::add, 1,
                RateLimiter.ofDefaults("test"));

        CompletableFuture<Map<String, Integer>> call = CompletableFuture.supplyAsync(
                () -> executor.lookupAll(List.of("a", "bb", "ccc"), String::length), pool);

        Runnable first = submitted.poll(5, TimeUnit.SECONDS);
        assertThat(first).isNotNull();
        assertThat(submitted.poll(200, TimeUnit.MILLISECONDS)).isNull();
        first.run();
        Runnable second = submitted.poll(5, TimeUnit.SECONDS);
        assertThat(second).isNotNull();
        assertThat(submitted).isEmpty();
        second.run();
        submitted.poll(5, TimeUnit.SECONDS).run();

        assertThat(call.get(5, TimeUnit.SECONDS))
                .containsExactly(Map.entry("a", 1), Map.entry("bb", 2), Map.entry("ccc", 3));
    }

    @Test
    @DisplayName("rejected submission frees its slot and the remaining keys still resolve")
    void rejectedSubmission() {
        AtomicInteger submissions = new AtomicInteger();
        BoundedLookupExecutor executor = new BoundedLookupExecutor("test", task -> {
            if (submissions.incrementAndGet() == 1) {
                throw new RejectedExecutionException("queue full");
            }
            task.run();
        }, 1, RateLimiter.ofDefaults("test"));

        Map<String, String> result = executor.lookupAll(List.of("first", "second"), key -> key);

        assertThat(result).containsOnlyKeys("second");
    }

    @Test
    @DisplayName("unit that cannot get a rate-limiter permit in time is dropped")
    void permitTimeoutDrops() {
        RateLimiter limiter = RateLimiter.of("strict", RateLimiterConfig.custom()
                .limitForPeriod(1)
                .limitRefreshPeriod(Duration.ofSeconds(30))
                .timeoutDuration(Duration.ZERO)
                .build());
        BoundedLookupExecutor executor = new BoundedLookupExecutor("strict", Runnable::run, 1, limiter);

        Map<String, String> result = executor.lookupAll(List.of("first", "second"), key -> key);

        assertThat(result).containsOnlyKeys("first");
    }

    @Test
    @DisplayName("empty input returns an empty map without touching the executor")
    void emptyInput() {
        BoundedLookupExecutor executor = new BoundedLookupExecutor("test", r -> {
            throw new AssertionError("should not run");
        }, 1, RateLimiter.ofDefaults("test"));

        assertThat(executor.lookupAll(List.<String>of(), key -> key)).isEmpty();
        assertThat(executor.getConcurrency()).isEqualTo(1);
    }
}
