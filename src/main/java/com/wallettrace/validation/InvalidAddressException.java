package com.wallettrace.validation;

/**
 * Thrown when a trace is requested for something that is not an EVM address.
 */
public class InvalidAddressException extends IllegalArgumentException {

    private final String address;

    public InvalidAddressException(String address) {
        super("Invalid wallet address: '" + address + "' (expected 0x followed by 40 hex characters)");
        this.address = address;
    }

    public String getAddress() {
        return address;
    }
}
