package com.wallettrace.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Defaults for a trace invocation and the thresholds the engine applies to funding data.
 * See application.yml wallettrace.trace.
 */
@ConfigurationProperties(prefix = "wallettrace.trace")
@NoArgsConstructor
@Getter
@Setter
public class TraceProperties {

    /** Run sibling detection by default. */
    private boolean deep = true;

    /** Max sibling candidates sent to the membership oracle. Default 20. */
    private int maxSiblings = 20;

    private boolean traceOrigin = true;

    /** Max hops followed upstream per origin chain. Default 3. */
    private int maxOriginHops = 3;

    /** Per-transfer threshold while walking upstream. Default 50 token units. */
    private BigDecimal minTraceAmount = new BigDecimal("50");

    /** A funding source is traced only when it sent at least this much in total. Default 100. */
    private BigDecimal originSourceMinAmount = new BigDecimal("100");

    private boolean checkOutbound = true;

    /** Dust filter for outgoing edges. Default 10 token units. */
    private BigDecimal outboundMinAmount = new BigDecimal("10");

    /** Fetch platform activity and portfolio for the classification battery. */
    private boolean includeActivity = true;

    private boolean decodeBridges = true;

    /** Max bridge transactions decoded per trace. Default 10. */
    private int maxBridgeDecodes = 10;

    /** Unknown funders younger than this are flagged as fresh wallets. Default 7 days. */
    private int freshWalletMaxAgeDays = 7;
}
