package com.wallettrace.domain;

/**
 * Public profile of a platform account. Either field may be null.
 */
public record AccountProfile(String username, String name) {

    /** Username when set, otherwise the display name; null when the profile has neither. */
    public String displayName() {
        if (username != null && !username.isBlank()) {
            return username;
        }
        return name != null && !name.isBlank() ? name : null;
    }
}
