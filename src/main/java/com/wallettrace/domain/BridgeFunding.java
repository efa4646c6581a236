package com.wallettrace.domain;

/**
 * Decoded origin attached to the bridge funding source whose transfer it explains.
 */
public record BridgeFunding(String fundingSource, BridgeOrigin origin) {
}
