package com.wallettrace.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Classification of a counterparty address. EXCHANGE, BRIDGE, SWAP and PROTOCOL are terminal: backward
 * tracing stops there because the source is already explained.
 */
public enum AddressCategory {
    EXCHANGE,
    BRIDGE,
    SWAP,
    ENTITY,
    PROTOCOL,
    FRESH_WALLET,
    UNKNOWN;

    public boolean isTerminal() {
        return this == EXCHANGE || this == BRIDGE || this == SWAP || this == PROTOCOL;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
