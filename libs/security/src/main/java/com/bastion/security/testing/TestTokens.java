package com.bastion.security.testing;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;

import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mints signed tokens for tests.
 * <p>
 * In src/main so that the gateway module can use it from its test scope through the regular
 * module dependency. Package {@code testing}: not for production code.
 */
public final class TestTokens {

    /** Shared secret used by tests; 36 bytes, enough for HS256. */
    public static final String SECRET = "bastion-test-signing-secret-0123456789";

    /** Another valid secret, for rotation and wrong-key tests. */
    public static final String OTHER_SECRET = "bastion-other-signing-secret-abcdefghij";

    private TestTokens() {
        // utility class
    }

    /**
     * Registered claims for {@code subject} expiring at {@code expiresAt}. The returned map is
     * mutable so tests can add or remove claims.
     */
    public static Map<String, Object> claims(String subject, Instant expiresAt) {
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("sub", subject);
        claims.put("iat", expiresAt.minusSeconds(3600).getEpochSecond());
        claims.put("exp", expiresAt.getEpochSecond());
        return claims;
    }

    public static String sign(Map<String, Object> claims) {
        return sign(claims, SECRET);
    }

    public static String sign(Map<String, Object> claims, String secret) {
        return sign(claims, secret, JWSAlgorithm.HS256, null);
    }

    /**
     * Signs {@code claims} with an HMAC algorithm. Numeric {@code exp}, {@code iat} and
     * {@code nbf} values are epoch seconds.
     */
    public static String sign(Map<String, Object> claims, String secret, JWSAlgorithm algorithm, String keyId) {
        try {
            JWSHeader header = new JWSHeader.Builder(algorithm)
                    .type(JOSEObjectType.JWT)
                    .keyID(keyId)
                    .build();
            SignedJWT jwt = new SignedJWT(header, JWTClaimsSet.parse(claims));
            jwt.sign(new MACSigner(secret.getBytes(StandardCharsets.UTF_8)));
            return jwt.serialize();
        } catch (ParseException | JOSEException e) {
            throw new IllegalStateException("Could not mint test token", e);
        }
    }
}
