package com.bastion.security.middleware;

/**
 * Names of the headers the middleware reads.
 *
 * @param authorization header carrying {@code Bearer <token>}
 * @param sessionId     header carrying the client session id
 * @param role          header requesting a role assumption
 */
public record AuthHeaders(String authorization, String sessionId, String role) {

    public static final String DEFAULT_AUTHORIZATION = "Authorization";
    public static final String DEFAULT_SESSION_ID = "Mcp-Session-Id";
    public static final String DEFAULT_ROLE = "X-Bastion-Role";

    public AuthHeaders {
        authorization = orDefault(authorization, DEFAULT_AUTHORIZATION);
        sessionId = orDefault(sessionId, DEFAULT_SESSION_ID);
        role = orDefault(role, DEFAULT_ROLE);
    }

    public static AuthHeaders defaults() {
        return new AuthHeaders(null, null, null);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
