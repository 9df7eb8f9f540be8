package com.bastion.security.authz;

import com.bastion.security.claims.ClaimSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Decides whether a set of claims permits an operation on a resource.
 * <p>
 * Pure: the decision depends only on the arguments and the immutable permission table, so the
 * same inputs always produce the same decision. Checks run in a fixed order and the first
 * failing one determines the reason: authentication, operation, permissions, resource.
 * <p>
 * A held permission of {@code *} grants everything and {@code service:*} grants every action
 * of that service. A granted resource of {@code *} covers every bucket; other granted resources
 * may be globs.
 */
public final class AuthorizationEngine {

    private static final String ALL_PERMISSIONS = "*";

    private final PermissionRequirements requirements;

    public AuthorizationEngine() {
        this(PermissionRequirements.standard());
    }

    public AuthorizationEngine(PermissionRequirements requirements) {
        this.requirements = Objects.requireNonNull(requirements, "requirements");
    }

    /**
     * @param operation operation name (e.g. "bucket_objects_list")
     * @param resource  target bucket, or null for operations that are not bucket-scoped
     * @param claims    the caller's claims, or null if unauthenticated
     */
    public AuthorizationDecision decide(String operation, String resource, ClaimSet claims) {
        if (claims == null) {
            return AuthorizationDecision.deny(DenialReason.NOT_AUTHENTICATED, "not authenticated");
        }
        PermissionRequirement requirement = requirements.find(operation).orElse(null);
        if (requirement == null) {
            return AuthorizationDecision.deny(DenialReason.UNKNOWN_OPERATION, "operation not recognized");
        }

        List<String> missing = missingPermissions(requirement.permissions(), claims.permissions());
        if (!missing.isEmpty()) {
            return AuthorizationDecision.missing(missing);
        }

        boolean hasResource = resource != null && !resource.isBlank();
        if (requirement.bucketScoped() && !hasResource) {
            return AuthorizationDecision.deny(DenialReason.RESOURCE_REQUIRED,
                    "operation '" + operation + "' requires a bucket");
        }
        if (hasResource && !ResourcePatterns.anyMatches(claims.resources(), resource)) {
            return AuthorizationDecision.deny(DenialReason.RESOURCE_NOT_AUTHORIZED,
                    "bucket '" + resource + "' is not authorized");
        }
        return AuthorizationDecision.allow("operation '" + operation + "' allowed");
    }

    public PermissionRequirements requirements() {
        return requirements;
    }

    static List<String> missingPermissions(List<String> required, Set<String> held) {
        if (held.contains(ALL_PERMISSIONS)) {
            return List.of();
        }
        List<String> missing = new ArrayList<>();
        for (String permission : required) {
            if (!held.contains(permission) && !held.contains(serviceWildcard(permission))) {
                missing.add(permission);
            }
        }
        return missing;
    }

    private static String serviceWildcard(String permission) {
        int colon = permission.indexOf(':');
        return colon < 0 ? ALL_PERMISSIONS : permission.substring(0, colon + 1) + ALL_PERMISSIONS;
    }
}
