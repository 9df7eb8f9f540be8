package com.bastion.security.middleware;

import com.bastion.security.claims.AccessLevel;
import com.bastion.security.claims.ClaimSet;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Statically configured identity used in {@link AuthMode#OPTIONAL} mode for requests that send
 * no token.
 *
 * @param subjectId   subject reported for ambient requests
 * @param permissions permissions granted to ambient requests
 * @param resources   buckets (or globs) ambient requests may access
 * @param level       access level
 */
public record AmbientIdentity(String subjectId, Set<String> permissions, Set<String> resources, AccessLevel level) {

    public static final String DEFAULT_SUBJECT = "ambient";

    /** Ambient claims never expire on their own. */
    private static final Instant NEVER = Instant.parse("9999-12-31T23:59:59Z");

    public AmbientIdentity {
        subjectId = subjectId == null || subjectId.isBlank() ? DEFAULT_SUBJECT : subjectId;
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
        resources = resources == null ? Set.of() : Set.copyOf(resources);
        level = level == null ? AccessLevel.READ : level;
    }

    /** An ambient identity with no permissions. */
    public static AmbientIdentity anonymous() {
        return new AmbientIdentity(DEFAULT_SUBJECT, Set.of(), Set.of(), AccessLevel.NONE);
    }

    public ClaimSet toClaims() {
        return new ClaimSet(subjectId, NEVER, null, null, List.of(), null, "", level,
                permissions, resources, List.of(), null, null);
    }
}
