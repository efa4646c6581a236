package com.wallettrace.validation;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validates and normalizes EVM wallet addresses at the trace entry point.
 */
@Component
public class AddressValidator {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    public boolean isValidAddress(String address) {
        if (address == null || address.isBlank()) return false;
        return EVM_ADDRESS.matcher(address.strip()).matches();
    }

    /**
     * @return the address stripped and lower-cased
     * @throws InvalidAddressException when the input is not 0x followed by 40 hex characters
     */
    public String requireValid(String address) {
        if (!isValidAddress(address)) {
            throw new InvalidAddressException(address);
        }
        return address.strip().toLowerCase(Locale.ROOT);
    }
}
