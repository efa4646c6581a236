package com.wallettrace.domain;

import java.time.Instant;

/**
 * One trading record of an account on the platform. Any field may be null when the platform omits it.
 */
public record PlatformActivity(String marketId, String outcome, Instant timestamp) {
}
