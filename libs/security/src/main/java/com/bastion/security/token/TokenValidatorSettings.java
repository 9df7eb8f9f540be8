package com.bastion.security.token;

import java.time.Duration;

/**
 * Optional checks applied by {@link TokenValidator} on top of signature and expiry.
 *
 * @param keyId     expected {@code kid} header; a token carrying a different one is rejected
 * @param issuer    expected {@code iss}; null disables the check
 * @param audience  value that {@code aud} must contain; null disables the check
 * @param clockSkew tolerance applied to {@code exp} and {@code nbf}
 */
public record TokenValidatorSettings(String keyId, String issuer, String audience, Duration clockSkew) {

    public TokenValidatorSettings {
        keyId = blankToNull(keyId);
        issuer = blankToNull(issuer);
        audience = blankToNull(audience);
        if (clockSkew == null) {
            clockSkew = Duration.ZERO;
        }
        if (clockSkew.isNegative()) {
            throw new IllegalArgumentException("clockSkew must not be negative");
        }
    }

    public static TokenValidatorSettings defaults() {
        return new TokenValidatorSettings(null, null, null, Duration.ZERO);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
