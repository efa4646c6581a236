package com.wallettrace.domain;

import java.math.BigDecimal;

/**
 * Cross-chain origin of a bridge transfer, as decoded from the bridge's request record.
 * {@code destinationTxHash} is the hash on this chain that was decoded.
 */
public record BridgeOrigin(
        int originChainId,
        String originChain,
        String originAddress,
        String originTxHash,
        BigDecimal amount,
        String destinationTxHash
) {
}
