package com.bastion.security.session;

import com.bastion.security.claims.ClaimSet;
import com.bastion.security.exchange.ScopedCredentials;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Validated identity cached for one logical client session.
 *
 * @param sessionId        the client-chosen session identifier
 * @param claims           the claims of the token that opened the session
 * @param credentials      credentials obtained by role assumption (nullable)
 * @param createdAt        when the identity was validated; never moved forward
 * @param subjectId        subject the session belongs to
 * @param tokenFingerprint fingerprint of the token that opened the session (nullable)
 */
public record SessionRecord(
        String sessionId,
        ClaimSet claims,
        ScopedCredentials credentials,
        Instant createdAt,
        String subjectId,
        String tokenFingerprint
) {

    public SessionRecord {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(claims, "claims");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(subjectId, "subjectId");
    }

    /**
     * True if {@code other} is this record or a copy of it with different credentials: the same
     * validation of the same token for the same subject.
     */
    public boolean sameOpeningAs(SessionRecord other) {
        return sessionId.equals(other.sessionId)
                && subjectId.equals(other.subjectId)
                && createdAt.equals(other.createdAt)
                && Objects.equals(tokenFingerprint, other.tokenFingerprint);
    }

    /** Live while {@code now - createdAt < ttl}. */
    public boolean isLive(Instant now, Duration ttl) {
        return Duration.between(createdAt, now).compareTo(ttl) < 0;
    }

    public SessionRecord withCredentials(ScopedCredentials newCredentials) {
        return new SessionRecord(sessionId, claims, newCredentials, createdAt, subjectId, tokenFingerprint);
    }

    /** True if the record was opened by a token with the given fingerprint. */
    public boolean openedBy(String fingerprint) {
        return tokenFingerprint != null && tokenFingerprint.equals(fingerprint);
    }
}
