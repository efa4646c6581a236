package com.wallettrace.tracing;

/**
 * Thrown when the thread running a trace is interrupted while waiting for its phases. The partial result is
 * discarded.
 */
public class TraceInterruptedException extends RuntimeException {

    public TraceInterruptedException(String address, Throwable cause) {
        super("Trace of " + address + " interrupted", cause);
    }
}
