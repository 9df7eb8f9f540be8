package com.bastion.security.claims;

import java.util.Locale;
import java.util.Optional;

/**
 * Coarse access level carried by a token ({@code level} / {@code l}).
 */
public enum AccessLevel {

    NONE("none"),
    READ("read"),
    WRITE("write"),
    ADMIN("admin");

    private final String value;

    AccessLevel(String value) {
        this.value = value;
    }

    /** The wire value (e.g. "read"). */
    public String value() {
        return value;
    }

    /** True if this level grants at least {@code other}. */
    public boolean includes(AccessLevel other) {
        return compareTo(other) >= 0;
    }

    /**
     * Looks up a level by its wire value, case-insensitively.
     *
     * @param value the string to match
     * @return the matching level, or empty if unknown
     */
    public static Optional<AccessLevel> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (AccessLevel level : values()) {
            if (level.value.equals(normalized)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
