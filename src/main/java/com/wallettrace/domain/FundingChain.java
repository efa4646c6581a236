package com.wallettrace.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Funding path ending at {@code tracedAddress}. Hops are ordered origin first, so {@code hops[i].to}
 * equals {@code hops[i + 1].from} and the last hop pays the traced address.
 */
public record FundingChain(String tracedAddress, List<FundingHop> hops, ChainStopReason stopReason) {

    public FundingChain {
        hops = List.copyOf(hops);
    }

    @JsonProperty("depth")
    public int depth() {
        return hops.size();
    }

    /** Earliest hop, or null for an empty chain. */
    @JsonIgnore
    public FundingHop origin() {
        return hops.isEmpty() ? null : hops.get(0);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return hops.isEmpty();
    }
}
