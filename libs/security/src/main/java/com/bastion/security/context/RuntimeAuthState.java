package com.bastion.security.context;

import com.bastion.security.claims.ClaimSet;
import com.bastion.security.exchange.ScopedCredentials;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Identity of one in-flight request. Immutable; lives only as long as the request.
 *
 * @param scheme      how the identity was established
 * @param claims      the caller's claims (null for NONE)
 * @param credentials credentials obtained by role assumption (nullable)
 * @param sessionId   the client session the request belongs to (nullable)
 * @param extras      free-form request attributes (e.g. the requested role)
 */
public record RuntimeAuthState(
        AuthScheme scheme,
        ClaimSet claims,
        ScopedCredentials credentials,
        String sessionId,
        Map<String, String> extras
) {

    private static final RuntimeAuthState NONE = new RuntimeAuthState(AuthScheme.NONE, null, null, null, Map.of());

    public RuntimeAuthState {
        Objects.requireNonNull(scheme, "scheme");
        if (scheme != AuthScheme.NONE && claims == null) {
            throw new IllegalArgumentException("scheme " + scheme + " requires claims");
        }
        extras = extras == null ? Map.of() : Map.copyOf(extras);
    }

    public static RuntimeAuthState none() {
        return NONE;
    }

    public static RuntimeAuthState none(String sessionId) {
        return new RuntimeAuthState(AuthScheme.NONE, null, null, sessionId, Map.of());
    }

    public static RuntimeAuthState token(ClaimSet claims, String sessionId) {
        return new RuntimeAuthState(AuthScheme.TOKEN, claims, null, sessionId, Map.of());
    }

    public static RuntimeAuthState ambient(ClaimSet claims, String sessionId) {
        return new RuntimeAuthState(AuthScheme.AMBIENT, claims, null, sessionId, Map.of());
    }

    /** This state with role credentials merged in; the scheme becomes ASSUMED_ROLE. */
    public RuntimeAuthState withAssumedRole(ScopedCredentials roleCredentials) {
        return new RuntimeAuthState(AuthScheme.ASSUMED_ROLE, claims, roleCredentials, sessionId, extras);
    }

    /** This state with {@code key} set to {@code value}, or removed when {@code value} is null. */
    public RuntimeAuthState withExtra(String key, String value) {
        Map<String, String> merged = new LinkedHashMap<>(extras);
        if (value == null) {
            merged.remove(key);
        } else {
            merged.put(key, value);
        }
        return new RuntimeAuthState(scheme, claims, credentials, sessionId, merged);
    }

    public boolean isAuthenticated() {
        return scheme.isAuthenticated();
    }

    public String subjectId() {
        return claims == null ? null : claims.subjectId();
    }

    /**
     * Credentials to act with: assumed-role credentials first, then credentials embedded in the
     * token. Null if neither exists.
     */
    public ScopedCredentials effectiveCredentials() {
        if (credentials != null) {
            return credentials;
        }
        return claims == null ? null : claims.embeddedCredentials();
    }
}
