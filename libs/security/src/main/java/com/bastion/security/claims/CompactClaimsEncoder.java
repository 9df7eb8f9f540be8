package com.bastion.security.claims;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Produces the abbreviated claim form that {@link ClaimsCodec} decodes.
 * <p>
 * Used by tooling that mints compact tokens and by tests. Permissions without a code in
 * {@link PermissionCodes} cannot be abbreviated and are rejected.
 */
public final class CompactClaimsEncoder {

    private CompactClaimsEncoder() {
        // utility class
    }

    /**
     * Encodes a resource set as a {@code groups} tagged object. Each name is split at its first
     * {@code '-'} into prefix and suffix.
     *
     * @param resources resource names, each containing at least one '-'
     * @return {@code {"_type": "groups", "_data": {prefix: [suffix, ...]}}}
     * @throws IllegalArgumentException if a name has no '-' separator
     */
    public static Map<String, Object> groups(Iterable<String> resources) {
        Map<String, List<String>> grouped = new LinkedHashMap<>();
        for (String name : resources) {
            int dash = name.indexOf('-');
            if (dash <= 0 || dash == name.length() - 1) {
                throw new IllegalArgumentException("Resource name cannot be grouped: " + name);
            }
            grouped.computeIfAbsent(name.substring(0, dash), key -> new ArrayList<>())
                    .add(name.substring(dash + 1));
        }
        Map<String, Object> encoded = new LinkedHashMap<>();
        encoded.put(ResourceEncoding.TYPE_KEY, ResourceEncoding.Groups.TYPE);
        encoded.put(ResourceEncoding.DATA_KEY, grouped);
        return encoded;
    }

    /**
     * Abbreviates canonical permissions to their table codes.
     *
     * @throws IllegalArgumentException if a permission has no code
     */
    public static List<String> permissionCodes(Iterable<String> permissions) {
        List<String> codes = new ArrayList<>();
        for (String permission : permissions) {
            codes.add(PermissionCodes.abbreviate(permission).orElseThrow(() ->
                    new IllegalArgumentException("No abbreviated code for permission: " + permission)));
        }
        return codes;
    }

    /**
     * Builds the compact claim entries ({@code s}, {@code p}, {@code r}, {@code b}, {@code l}) for
     * the given logical values. Registered claims ({@code sub}, {@code exp}, ...) are left to the
     * caller.
     */
    public static Map<String, Object> compactClaims(String scope, Set<String> permissions, List<String> roles,
                                                    Set<String> resources, AccessLevel level) {
        Map<String, Object> claims = new LinkedHashMap<>();
        if (scope != null && !scope.isBlank()) {
            claims.put(ClaimsCodec.SCOPE_COMPACT, scope);
        }
        if (permissions != null && !permissions.isEmpty()) {
            claims.put(ClaimsCodec.PERMISSIONS_COMPACT, permissionCodes(permissions));
        }
        if (roles != null && !roles.isEmpty()) {
            claims.put(ClaimsCodec.ROLES_COMPACT, List.copyOf(roles));
        }
        if (resources != null && !resources.isEmpty()) {
            claims.put(ClaimsCodec.BUCKETS_COMPACT, groups(resources));
        }
        if (level != null) {
            claims.put(ClaimsCodec.LEVEL_COMPACT, level.value());
        }
        return claims;
    }
}
