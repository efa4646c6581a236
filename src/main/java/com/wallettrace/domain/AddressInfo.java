package com.wallettrace.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Registry view of one address. Label is null when the address is not in the registry.
 */
public record AddressInfo(String address, String label, AddressCategory category) {

    public static AddressInfo unknown(String address) {
        return new AddressInfo(address, null, AddressCategory.UNKNOWN);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return category.isTerminal();
    }
}
