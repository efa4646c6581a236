package com.wallettrace.provider;

import com.wallettrace.domain.BridgeOrigin;

import java.util.Optional;

/**
 * Decodes a bridge transaction on this chain into its cross-chain origin.
 * Empty means the transaction could not be decoded; that is not an error.
 */
public interface BridgeDecoder {

    Optional<BridgeOrigin> decode(String txHash);
}
