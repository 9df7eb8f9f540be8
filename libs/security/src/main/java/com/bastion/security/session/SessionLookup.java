package com.bastion.security.session;

import java.util.Optional;

/**
 * Outcome of {@link SessionCache#lookup(String)}.
 *
 * @param status HIT, MISS or EXPIRED
 * @param record the live record on a HIT, otherwise null
 */
public record SessionLookup(Status status, SessionRecord record) {

    public enum Status {
        HIT, MISS, EXPIRED
    }

    private static final SessionLookup MISS = new SessionLookup(Status.MISS, null);
    private static final SessionLookup EXPIRED = new SessionLookup(Status.EXPIRED, null);

    public static SessionLookup hit(SessionRecord record) {
        return new SessionLookup(Status.HIT, record);
    }

    public static SessionLookup miss() {
        return MISS;
    }

    public static SessionLookup expired() {
        return EXPIRED;
    }

    public boolean isHit() {
        return status == Status.HIT;
    }

    public Optional<SessionRecord> recordIfHit() {
        return Optional.ofNullable(record);
    }
}
