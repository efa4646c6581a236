package com.wallettrace.domain;

/**
 * Why backward tracing stopped. None of these is an error.
 */
public enum ChainStopReason {
    HOP_LIMIT,
    TERMINAL_CATEGORY,
    PROTOCOL_CONTRACT,
    NO_QUALIFYING_FUNDER,
    LOOKUP_FAILED
}
