package com.wallettrace.config;

import com.wallettrace.tracing.lookup.BoundedLookupExecutor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the trace engine. The host application supplies a {@link com.wallettrace.provider.LedgerProvider} and a
 * {@link com.wallettrace.provider.MembershipOracle}; a bridge decoder and an activity provider are optional.
 */
@Configuration
@ComponentScan(basePackages = "com.wallettrace")
@Import(AsyncConfig.class)
@EnableConfigurationProperties({ TraceProperties.class, LookupProperties.class, AddressRegistryProperties.class })
public class TraceEngineConfig {

    public static final String MEMBERSHIP_LOOKUP = "membershipLookup";
    public static final String BRIDGE_LOOKUP = "bridgeLookup";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = MEMBERSHIP_LOOKUP)
    public BoundedLookupExecutor membershipLookup(LookupProperties lookupProperties,
                                                  @Qualifier(AsyncConfig.LOOKUP_EXECUTOR) Executor lookupExecutor) {
        return BoundedLookupExecutor.create("membership", lookupExecutor, lookupProperties.getMembership());
    }

    @Bean(name = BRIDGE_LOOKUP)
    public BoundedLookupExecutor bridgeLookup(LookupProperties lookupProperties,
                                              @Qualifier(AsyncConfig.LOOKUP_EXECUTOR) Executor lookupExecutor) {
        return BoundedLookupExecutor.create("bridge", lookupExecutor, lookupProperties.getBridge());
    }
}
