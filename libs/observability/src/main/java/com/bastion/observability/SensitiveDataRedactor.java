package com.bastion.observability;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keeps bearer tokens, signing secrets and credentials out of logs.
 * <p>
 * Field-based redaction replaces the value of any key matching a sensitive pattern
 * (case-insensitive). Tokens that need to be correlated across log lines or compared later are
 * reduced to a {@link #fingerprint(String) fingerprint} instead.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final int FINGERPRINT_HEX_CHARS = 16;

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "password", "token", "secret", "authorization", "apikey", "credential",
            "accesskey", "cookie"
    );

    private final Set<String> sensitivePatterns;
    private final Pattern compiledPattern;

    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * @param patterns field name fragments to treat as sensitive
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        this.sensitivePatterns = Set.copyOf(patterns);
        String regex = String.join("|", sensitivePatterns.stream()
                .map(Pattern::quote)
                .toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a copy of {@code data} with sensitive values replaced by {@value #REDACTED}.
     * Null input returns an empty map.
     */
    public Map<String, Object> redact(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        data.forEach((key, value) -> result.put(key, isSensitive(key) ? REDACTED : value));
        return result;
    }

    /**
     * Header variant of {@link #redact(Map)}, for request logging.
     */
    public Map<String, String> redactHeaders(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return Map.of();
        }
        Map<String, String> result = new LinkedHashMap<>(headers.size());
        headers.forEach((name, value) -> result.put(name, isSensitive(name) ? REDACTED : value));
        return result;
    }

    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        return compiledPattern.matcher(fieldName).find();
    }

    public Set<String> sensitivePatterns() {
        return sensitivePatterns;
    }

    /**
     * Stable, non-reversible identifier for a token: the first 16 hex characters of its SHA-256.
     * Safe to log and to store next to cached identities.
     *
     * @param token the raw token (may be null)
     * @return the fingerprint, or null for a null token
     */
    public static String fingerprint(String token) {
        if (token == null) {
            return null;
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(token.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, FINGERPRINT_HEX_CHARS);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
