package com.bastion.security.authz;

import java.util.Collection;

/**
 * Matching of bucket names against granted resources.
 * <p>
 * A grant is either an exact name, the wildcard {@code *}, or a glob where {@code *} matches any
 * run of characters (including none) and {@code ?} matches exactly one.
 */
public final class ResourcePatterns {

    public static final String ANY = "*";

    private ResourcePatterns() {
        // utility class
    }

    /** True if any grant in {@code grants} covers {@code resource}. */
    public static boolean anyMatches(Collection<String> grants, String resource) {
        if (resource == null) {
            return false;
        }
        if (grants.contains(resource) || grants.contains(ANY)) {
            return true;
        }
        for (String grant : grants) {
            if (isPattern(grant) && matches(grant, resource)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isPattern(String grant) {
        return grant.indexOf('*') >= 0 || grant.indexOf('?') >= 0;
    }

    /**
     * Glob match with backtracking over the last {@code *} seen; linear in practice.
     */
    public static boolean matches(String pattern, String name) {
        int p = 0;
        int n = 0;
        int starP = -1;
        int starN = 0;
        while (n < name.length()) {
            if (p < pattern.length() && (pattern.charAt(p) == '?' || pattern.charAt(p) == name.charAt(n))) {
                p++;
                n++;
            } else if (p < pattern.length() && pattern.charAt(p) == '*') {
                starP = p++;
                starN = n;
            } else if (starP >= 0) {
                p = starP + 1;
                n = ++starN;
            } else {
                return false;
            }
        }
        while (p < pattern.length() && pattern.charAt(p) == '*') {
            p++;
        }
        return p == pattern.length();
    }
}
