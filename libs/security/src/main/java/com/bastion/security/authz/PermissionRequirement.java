package com.bastion.security.authz;

import java.util.List;
import java.util.Objects;

/**
 * Permissions an operation needs, and whether it acts on a single bucket.
 *
 * @param operation    the operation name as callers send it
 * @param permissions  every permission the caller must hold
 * @param bucketScoped true if the operation requires a bucket to be named
 */
public record PermissionRequirement(String operation, List<String> permissions, boolean bucketScoped) {

    public PermissionRequirement {
        Objects.requireNonNull(operation, "operation");
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }
}
