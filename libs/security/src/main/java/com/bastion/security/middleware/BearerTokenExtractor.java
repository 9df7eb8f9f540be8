package com.bastion.security.middleware;

import java.util.Locale;
import java.util.Optional;

/**
 * Extracts bearer tokens from Authorization header values.
 */
public final class BearerTokenExtractor {

    private static final String SCHEME = "bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Extracts the token from {@code "Bearer <token>"}. The scheme is case-insensitive and must
     * be followed by whitespace.
     *
     * @param authorizationHeader the full Authorization header value (may be null)
     * @return the token, or empty if the header is missing, uses another scheme, or has no token
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (trimmed.length() <= SCHEME.length()
                || !trimmed.substring(0, SCHEME.length()).toLowerCase(Locale.ROOT).equals(SCHEME)
                || !Character.isWhitespace(trimmed.charAt(SCHEME.length()))) {
            return Optional.empty();
        }
        String token = trimmed.substring(SCHEME.length()).strip();
        if (token.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(token);
    }
}
