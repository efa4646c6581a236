package com.wallettrace.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: trace-executor runs the phases of a trace, lookup-executor runs the individual
 * third-party lookups fanned out by those phases. Phases block on their lookups, so the two never share a pool.
 */
@Configuration
public class AsyncConfig {

    public static final String TRACE_EXECUTOR = "trace-executor";
    public static final String LOOKUP_EXECUTOR = "lookup-executor";

    @Bean(name = TRACE_EXECUTOR)
    public Executor traceExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(16);
        e.setThreadNamePrefix("trace-");
        e.initialize();
        return e;
    }

    @Bean(name = LOOKUP_EXECUTOR)
    public Executor lookupExecutor(LookupProperties lookupProperties) {
        int threads = Math.max(1, lookupProperties.getExecutorThreads());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(threads);
        e.setMaxPoolSize(threads);
        e.setThreadNamePrefix("lookup-");
        e.initialize();
        return e;
    }
}
