package com.bastion.security.claims;

import com.bastion.security.exchange.ScopedCredentials;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Canonical, fully expanded claims of a validated token.
 * <p>
 * Immutable and thread-safe: a single instance may be shared between the session cache and
 * every request of that session. Collections are copied and unmodifiable.
 *
 * @param subjectId           subject identifier ({@code sub})
 * @param expiresAt           expiry ({@code exp})
 * @param issuedAt            issue time ({@code iat}, nullable)
 * @param issuer              issuer ({@code iss}, nullable)
 * @param audience            audience values ({@code aud}, possibly empty)
 * @param tokenId             token id ({@code jti}, nullable)
 * @param scope               scope string ({@code scope} / {@code s})
 * @param level               access level ({@code level} / {@code l})
 * @param permissions         canonical permission codes (e.g. "s3:GetObject")
 * @param resources           accessible buckets; entries containing {@code *} are glob patterns
 * @param roles               role identifiers, in token order
 * @param roleArn             target role carried by the token (nullable)
 * @param embeddedCredentials short-lived credentials carried by the token (nullable)
 */
public record ClaimSet(
        String subjectId,
        Instant expiresAt,
        Instant issuedAt,
        String issuer,
        List<String> audience,
        String tokenId,
        String scope,
        AccessLevel level,
        Set<String> permissions,
        Set<String> resources,
        List<String> roles,
        String roleArn,
        ScopedCredentials embeddedCredentials
) {

    public ClaimSet {
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(expiresAt, "expiresAt");
        audience = audience == null ? List.of() : List.copyOf(audience);
        scope = scope == null ? "" : scope;
        level = level == null ? AccessLevel.READ : level;
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
        resources = resources == null ? Set.of() : Set.copyOf(resources);
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    /** True once {@code now} has reached {@link #expiresAt()}. */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean hasPermission(String permission) {
        return permissions.contains(permission);
    }

    public boolean hasEmbeddedCredentials() {
        return embeddedCredentials != null;
    }

    @Override
    public String toString() {
        return "ClaimSet[subjectId=" + subjectId
                + ", expiresAt=" + expiresAt
                + ", issuer=" + issuer
                + ", level=" + level.value()
                + ", permissions=" + permissions.size()
                + ", resources=" + resources.size()
                + ", roles=" + roles
                + ", embeddedCredentials=" + (embeddedCredentials != null) + "]";
    }
}
