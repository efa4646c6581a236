package com.wallettrace.tracing;

import com.wallettrace.config.TraceProperties;
import lombok.Builder;

import java.math.BigDecimal;

/**
 * Per-call switches and limits for {@link TraceService#trace(String, TraceOptions)}.
 * <p>
 * The generated builder carries no defaults and the thresholds must be set; start from
 * {@link #builder(TraceProperties)} to override only some of the configured values.
 *
 * @param deep              run sibling detection
 * @param maxSiblings       cap on sibling candidates (and outbound recipients) sent to the membership oracle
 * @param traceOrigin       trace funding origins upstream
 * @param maxOriginHops     hop budget per origin chain
 * @param minTraceAmount    per-transfer threshold while tracing upstream
 * @param checkOutbound     analyse who the target paid
 * @param outboundMinAmount dust filter for outbound edges
 * @param includeActivity   fetch platform activity and portfolio
 * @param decodeBridges     decode bridge transfers into cross-chain origins
 */
@Builder(toBuilder = true)
public record TraceOptions(
        boolean deep,
        int maxSiblings,
        boolean traceOrigin,
        int maxOriginHops,
        BigDecimal minTraceAmount,
        boolean checkOutbound,
        BigDecimal outboundMinAmount,
        boolean includeActivity,
        boolean decodeBridges
) {

    public TraceOptions {
        if (maxSiblings < 0) {
            throw new IllegalArgumentException("maxSiblings must not be negative");
        }
        if (maxOriginHops < 0) {
            throw new IllegalArgumentException("maxOriginHops must not be negative");
        }
        if (minTraceAmount == null || minTraceAmount.signum() < 0) {
            throw new IllegalArgumentException("minTraceAmount must be zero or positive");
        }
        if (outboundMinAmount == null || outboundMinAmount.signum() < 0) {
            throw new IllegalArgumentException("outboundMinAmount must be zero or positive");
        }
    }

    /** Bare builder; declared explicitly because Lombok skips it when another {@code builder} overload exists. */
    public static TraceOptionsBuilder builder() {
        return new TraceOptionsBuilder();
    }

    /** Builder pre-filled with the configured defaults. */
    public static TraceOptionsBuilder builder(TraceProperties properties) {
        return defaults(properties).toBuilder();
    }

    public static TraceOptions defaults(TraceProperties properties) {
        return TraceOptions.builder()
                .deep(properties.isDeep())
                .maxSiblings(properties.getMaxSiblings())
                .traceOrigin(properties.isTraceOrigin())
                .maxOriginHops(properties.getMaxOriginHops())
                .minTraceAmount(properties.getMinTraceAmount())
                .checkOutbound(properties.isCheckOutbound())
                .outboundMinAmount(properties.getOutboundMinAmount())
                .includeActivity(properties.isIncludeActivity())
                .decodeBridges(properties.isDecodeBridges())
                .build();
    }
}
