package com.bastion.security.exchange;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Short-lived, role-scoped credentials issued by the trust provider or embedded in a token.
 * <p>
 * {@link #toString()} never prints the secret key or session token.
 *
 * @param accessKeyId     access key id
 * @param secretAccessKey secret access key
 * @param sessionToken    session token (null for long-lived keys)
 * @param region          region the credentials are meant for
 * @param expiration      expiry instant (null when unknown)
 * @param roleId          role the credentials were issued for (null when unknown)
 */
public record ScopedCredentials(
        String accessKeyId,
        String secretAccessKey,
        String sessionToken,
        String region,
        Instant expiration,
        String roleId
) {

    public static final String DEFAULT_REGION = "us-east-1";

    public ScopedCredentials {
        Objects.requireNonNull(accessKeyId, "accessKeyId");
        Objects.requireNonNull(secretAccessKey, "secretAccessKey");
        if (region == null || region.isBlank()) {
            region = DEFAULT_REGION;
        }
    }

    /** True once {@code now} has reached the expiration. Unknown expiration never expires. */
    public boolean isExpired(Instant now) {
        return expiration != null && !now.isBefore(expiration);
    }

    /** True if the credentials expire within {@code margin} of {@code now}. */
    public boolean expiresWithin(Duration margin, Instant now) {
        return expiration != null && !now.plus(margin).isBefore(expiration);
    }

    /** These credentials labelled with {@code requestedRoleId} when they carry no role of their own. */
    public ScopedCredentials withRoleIfMissing(String requestedRoleId) {
        if (roleId != null || requestedRoleId == null) {
            return this;
        }
        return new ScopedCredentials(accessKeyId, secretAccessKey, sessionToken, region, expiration, requestedRoleId);
    }

    /** True if these credentials were issued for {@code otherRoleId}. */
    public boolean isForRole(String otherRoleId) {
        return roleId != null && roleId.equals(otherRoleId);
    }

    @Override
    public String toString() {
        return "ScopedCredentials[accessKeyId=" + accessKeyId
                + ", region=" + region
                + ", expiration=" + expiration
                + ", roleId=" + roleId + "]";
    }
}
