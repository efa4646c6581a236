package com.wallettrace.registry;

import com.wallettrace.domain.AddressCategory;
import com.wallettrace.domain.AddressInfo;

/**
 * Static classification of addresses (exchange, bridge, swap venue, known entity, protocol contract).
 * Lookups are case-insensitive and never touch the network.
 */
public interface AddressRegistry {

    /**
     * Classify the given address. Total: unknown or blank input yields {@link AddressCategory#UNKNOWN}.
     */
    AddressInfo classify(String address);

    default boolean isProtocolContract(String address) {
        return classify(address).category() == AddressCategory.PROTOCOL;
    }

    default boolean isTerminal(String address) {
        return classify(address).isTerminal();
    }
}
