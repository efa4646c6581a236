package com.wallettrace.provider;

/**
 * Thrown by collaborator implementations when a lookup fails (HTTP error, malformed response, rate limit).
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
