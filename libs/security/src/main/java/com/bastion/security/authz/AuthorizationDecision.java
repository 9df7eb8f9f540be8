package com.bastion.security.authz;

import com.bastion.security.exchange.ScopedCredentials;

import java.util.List;
import java.util.Objects;

/**
 * Result of one authorization check. Computed per call and never cached.
 *
 * @param allowed            whether the operation may proceed
 * @param reason             human-readable explanation, safe to return to the caller
 * @param denialReason       machine-readable reason for a denial, null when allowed
 * @param missingPermissions permissions the caller lacks (empty unless MISSING_PERMISSION)
 * @param credentials        credentials to perform the operation with, attached by {@link AccessGuard}
 */
public record AuthorizationDecision(
        boolean allowed,
        String reason,
        DenialReason denialReason,
        List<String> missingPermissions,
        ScopedCredentials credentials
) {

    public AuthorizationDecision {
        Objects.requireNonNull(reason, "reason");
        missingPermissions = missingPermissions == null ? List.of() : List.copyOf(missingPermissions);
        if (allowed && denialReason != null) {
            throw new IllegalArgumentException("an allowed decision has no denial reason");
        }
        if (!allowed && denialReason == null) {
            throw new IllegalArgumentException("a denial needs a reason");
        }
    }

    public static AuthorizationDecision allow(String reason) {
        return new AuthorizationDecision(true, reason, null, List.of(), null);
    }

    public static AuthorizationDecision deny(DenialReason denialReason, String reason) {
        return new AuthorizationDecision(false, reason, denialReason, List.of(), null);
    }

    public static AuthorizationDecision missing(List<String> missingPermissions) {
        return new AuthorizationDecision(false,
                "missing permissions: " + String.join(", ", missingPermissions),
                DenialReason.MISSING_PERMISSION, missingPermissions, null);
    }

    public AuthorizationDecision withCredentials(ScopedCredentials newCredentials) {
        return new AuthorizationDecision(allowed, reason, denialReason, missingPermissions, newCredentials);
    }
}
