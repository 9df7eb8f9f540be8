package com.bastion.security.session;

import com.bastion.security.claims.ClaimSet;
import com.bastion.security.exchange.ScopedCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-session cache of validated identity.
 * <p>
 * Backed by a {@link ConcurrentHashMap}: reads are lock-free and writes lock a single bin, so
 * sessions never contend on a global lock. Records expire {@code ttl} after they were stored
 * and are never refreshed by reads. A stale record found on lookup is removed with a
 * conditional remove, so a fresh record stored concurrently is kept. Concurrent stores for the
 * same session are last-write-wins.
 */
public final class SessionCache {

    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    private static final Logger log = LoggerFactory.getLogger(SessionCache.class);

    private final ConcurrentMap<String, SessionRecord> records = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public SessionCache() {
        this(DEFAULT_TTL, Clock.systemUTC());
    }

    public SessionCache(Duration ttl, Clock clock) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.ttl = ttl;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Looks up a session. A record older than the TTL is removed and reported as EXPIRED.
     */
    public SessionLookup lookup(String sessionId) {
        if (sessionId == null) {
            return SessionLookup.miss();
        }
        SessionRecord record = records.get(sessionId);
        if (record == null) {
            return SessionLookup.miss();
        }
        if (record.isLive(clock.instant(), ttl)) {
            return SessionLookup.hit(record);
        }
        records.remove(sessionId, record);
        log.debug("Session {} expired", sessionId);
        return SessionLookup.expired();
    }

    public SessionRecord store(String sessionId, ClaimSet claims, String subjectId) {
        return store(sessionId, claims, subjectId, null);
    }

    /**
     * Stores a freshly validated identity, replacing any existing record for the session.
     */
    public SessionRecord store(String sessionId, ClaimSet claims, String subjectId, String tokenFingerprint) {
        Objects.requireNonNull(sessionId, "sessionId");
        SessionRecord record = new SessionRecord(sessionId, claims, null, clock.instant(), subjectId,
                tokenFingerprint);
        records.put(sessionId, record);
        return record;
    }

    /**
     * Attaches role credentials to the session opened by {@code expected}. Nothing is attached
     * when the session has since been replaced by another validation, or has expired. The record
     * keeps its creation time.
     *
     * @param expected the record the caller stored or adopted
     * @return true if a record was updated
     */
    public boolean attachCredentials(SessionRecord expected, ScopedCredentials credentials) {
        Objects.requireNonNull(expected, "expected");
        Instant now = clock.instant();
        SessionRecord updated = records.computeIfPresent(expected.sessionId(), (id, existing) ->
                existing.isLive(now, ttl) && existing.sameOpeningAs(expected)
                        ? existing.withCredentials(credentials)
                        : existing);
        boolean attached = updated != null && updated.credentials() == credentials;
        if (!attached) {
            log.debug("Session {} changed or expired; credentials not attached", expected.sessionId());
        }
        return attached;
    }

    public void invalidate(String sessionId) {
        if (sessionId != null && records.remove(sessionId) != null) {
            log.debug("Session {} invalidated", sessionId);
        }
    }

    /**
     * Removes every expired record.
     *
     * @return the number of records removed
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, SessionRecord> entry : records.entrySet()) {
            if (!entry.getValue().isLive(now, ttl) && records.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Evicted {} expired sessions", removed);
        }
        return removed;
    }

    public int size() {
        return records.size();
    }

    public Duration ttl() {
        return ttl;
    }
}
