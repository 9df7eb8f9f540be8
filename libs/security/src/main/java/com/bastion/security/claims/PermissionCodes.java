package com.bastion.security.claims;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed lookup table between abbreviated permission codes ({@code p} claim) and canonical
 * permission strings.
 * <p>
 * The table is part of the wire contract with the token issuer: adding a code is backwards
 * compatible, changing or removing one is not.
 */
public final class PermissionCodes {

    private static final Map<String, String> BY_CODE = Map.ofEntries(
            Map.entry("g", "s3:GetObject"),
            Map.entry("p", "s3:PutObject"),
            Map.entry("d", "s3:DeleteObject"),
            Map.entry("l", "s3:ListBucket"),
            Map.entry("la", "s3:ListAllMyBuckets"),
            Map.entry("gv", "s3:GetObjectVersion"),
            Map.entry("pa", "s3:PutObjectAcl"),
            Map.entry("amu", "s3:AbortMultipartUpload"),
            Map.entry("gm", "s3:GetObjectMetadata"),
            Map.entry("pm", "s3:PutObjectMetadata"),
            Map.entry("dm", "s3:DeleteObjectMetadata"),
            Map.entry("gl", "s3:GetObjectLockConfiguration"),
            Map.entry("pl", "s3:PutObjectLockConfiguration"),
            Map.entry("dl", "s3:DeleteObjectLockConfiguration"),
            Map.entry("gt", "s3:GetObjectTagging"),
            Map.entry("pt", "s3:PutObjectTagging"),
            Map.entry("dt", "s3:DeleteObjectTagging"),
            Map.entry("gr", "s3:GetObjectRetention"),
            Map.entry("pr", "s3:PutObjectRetention"),
            Map.entry("dr", "s3:DeleteObjectRetention"),
            Map.entry("gc", "s3:GetObjectLegalHold"),
            Map.entry("pc", "s3:PutObjectLegalHold"),
            Map.entry("dc", "s3:DeleteObjectLegalHold"),
            Map.entry("gb", "s3:GetBucketLocation"),
            Map.entry("pb", "s3:PutBucketLocation"),
            Map.entry("db", "s3:DeleteBucketLocation"),
            Map.entry("gbl", "s3:GetBucketLifecycle"),
            Map.entry("pbl", "s3:PutBucketLifecycle"),
            Map.entry("dbl", "s3:DeleteBucketLifecycle"),
            Map.entry("gbt", "s3:GetBucketTagging"),
            Map.entry("pbt", "s3:PutBucketTagging"),
            Map.entry("dbt", "s3:DeleteBucketTagging"),
            Map.entry("gba", "s3:GetBucketAcl"),
            Map.entry("pba", "s3:PutBucketAcl"),
            Map.entry("dba", "s3:DeleteBucketAcl"),
            Map.entry("gbp", "s3:GetBucketPolicy"),
            Map.entry("pbp", "s3:PutBucketPolicy"),
            Map.entry("dbp", "s3:DeleteBucketPolicy"));

    private static final Map<String, String> BY_PERMISSION = invert(BY_CODE);

    private PermissionCodes() {
        // utility class
    }

    /**
     * Expands an abbreviated code to its canonical permission.
     *
     * @param code the abbreviated code (e.g. "g")
     * @return the canonical permission, or empty if the code is not in the table
     */
    public static Optional<String> expand(String code) {
        return Optional.ofNullable(code).map(BY_CODE::get);
    }

    /** Reverse lookup, used when minting compact tokens. */
    public static Optional<String> abbreviate(String permission) {
        return Optional.ofNullable(permission).map(BY_PERMISSION::get);
    }

    /** The full table, code to canonical permission. */
    public static Map<String, String> table() {
        return BY_CODE;
    }

    private static Map<String, String> invert(Map<String, String> source) {
        Map<String, String> inverted = new HashMap<>();
        source.forEach((code, permission) -> {
            if (inverted.put(permission, code) != null) {
                throw new IllegalStateException("Duplicate permission in code table: " + permission);
            }
        });
        return Collections.unmodifiableMap(inverted);
    }
}
