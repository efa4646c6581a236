package com.wallettrace.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Bounded fan-out for third-party lookups: membership checks and bridge decodes.
 * See application.yml wallettrace.lookup.
 */
@ConfigurationProperties(prefix = "wallettrace.lookup")
@NoArgsConstructor
@Getter
@Setter
public class LookupProperties {

    private Pool membership = new Pool(5, 100);

    private Pool bridge = new Pool(3, 200);

    /** Threads of the shared lookup executor. Should cover the largest pool concurrency. */
    private int executorThreads = 8;

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Pool {

        /** Max units in flight. */
        private int concurrency = 5;

        /** Spacing per unit of work, in ms. */
        private long delayMs = 100;

        /** How long a unit waits for a rate-limiter permit before it is dropped. */
        private long permitTimeoutMs = 10_000;

        public Pool(int concurrency, long delayMs) {
            this.concurrency = concurrency;
            this.delayMs = delayMs;
        }
    }
}
