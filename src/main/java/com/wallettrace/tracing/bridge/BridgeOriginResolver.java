package com.wallettrace.tracing.bridge;

import com.wallettrace.config.TraceEngineConfig;
import com.wallettrace.domain.BridgeFunding;
import com.wallettrace.domain.BridgeOrigin;
import com.wallettrace.domain.FundingSource;
import com.wallettrace.domain.Transfer;
import com.wallettrace.provider.BridgeDecoder;
import com.wallettrace.tracing.lookup.BoundedLookupExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decodes the cross-chain origin of transfers received from bridge sources. Works only when a
 * {@link BridgeDecoder} is available; otherwise every call returns nothing.
 */
@Component
@Slf4j
public class BridgeOriginResolver {

    private final Optional<BridgeDecoder> bridgeDecoder;
    private final BoundedLookupExecutor bridgeLookup;

    public BridgeOriginResolver(Optional<BridgeDecoder> bridgeDecoder,
                                @Qualifier(TraceEngineConfig.BRIDGE_LOOKUP) BoundedLookupExecutor bridgeLookup) {
        this.bridgeDecoder = bridgeDecoder;
        this.bridgeLookup = bridgeLookup;
    }

    public boolean isAvailable() {
        return bridgeDecoder.isPresent();
    }

    /**
     * Decodes up to {@code maxDecodes} bridge transfers, taken in source order then transfer order.
     * Undecodable or failed hashes are skipped.
     */
    public List<BridgeFunding> resolve(List<FundingSource> sources, int maxDecodes) {
        if (bridgeDecoder.isEmpty() || maxDecodes <= 0) {
            return List.of();
        }
        Map<String, String> sourceByHash = new LinkedHashMap<>();
        for (FundingSource source : sources) {
            if (!source.isBridge()) {
                continue;
            }
            for (Transfer t : source.transfers()) {
                if (sourceByHash.size() >= maxDecodes) {
                    break;
                }
                if (t.txHash() != null && !t.txHash().isBlank()) {
                    sourceByHash.putIfAbsent(t.txHash(), source.address());
                }
            }
        }
        if (sourceByHash.isEmpty()) {
            return List.of();
        }

        BridgeDecoder decoder = bridgeDecoder.get();
        Map<String, BridgeOrigin> decoded = bridgeLookup.lookupAll(sourceByHash.keySet(),
                hash -> decoder.decode(hash).orElse(null));

        List<BridgeFunding> fundings = new ArrayList<>();
        decoded.forEach((hash, origin) -> fundings.add(new BridgeFunding(sourceByHash.get(hash), origin)));
        log.debug("Decoded {} of {} bridge transfer(s)", fundings.size(), sourceByHash.size());
        return fundings;
    }
}
