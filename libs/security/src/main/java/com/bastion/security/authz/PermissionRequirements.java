package com.bastion.security.authz;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Immutable index of operation name to {@link PermissionRequirement}, validated on construction.
 * <p>
 * Construction fails on duplicate operation names, blank names, operations without permissions
 * and permission codes that are not of the form {@code service:Action}.
 */
public final class PermissionRequirements {

    private static final Pattern PERMISSION_CODE = Pattern.compile("[a-z0-9-]+:[A-Za-z0-9*]+");

    private final Map<String, PermissionRequirement> byOperation;

    public PermissionRequirements(Collection<PermissionRequirement> requirements) {
        Map<String, PermissionRequirement> index = new LinkedHashMap<>();
        for (PermissionRequirement requirement : requirements) {
            validate(requirement);
            if (index.putIfAbsent(requirement.operation(), requirement) != null) {
                throw new IllegalStateException("Duplicate operation in permission table: "
                        + requirement.operation());
            }
        }
        this.byOperation = Collections.unmodifiableMap(index);
    }

    /** The table built from {@link Operation}. */
    public static PermissionRequirements standard() {
        return new PermissionRequirements(Arrays.stream(Operation.values())
                .map(Operation::requirement)
                .toList());
    }

    public Optional<PermissionRequirement> find(String operation) {
        return Optional.ofNullable(operation).map(byOperation::get);
    }

    public int size() {
        return byOperation.size();
    }

    public Collection<PermissionRequirement> all() {
        return byOperation.values();
    }

    private static void validate(PermissionRequirement requirement) {
        if (requirement.operation().isBlank()) {
            throw new IllegalStateException("Permission table contains a blank operation name");
        }
        if (requirement.permissions().isEmpty()) {
            throw new IllegalStateException("Operation " + requirement.operation() + " requires no permissions");
        }
        for (String permission : requirement.permissions()) {
            if (permission == null || !PERMISSION_CODE.matcher(permission).matches()) {
                throw new IllegalStateException("Operation " + requirement.operation()
                        + " has an invalid permission code: " + permission);
            }
        }
    }
}
