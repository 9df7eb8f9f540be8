package com.bastion.security.token;

import com.bastion.security.AuthErrorCode;
import com.bastion.security.AuthException;
import com.bastion.security.claims.ClaimSet;
import com.bastion.security.claims.ClaimsCodec;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Validates HS256-signed bearer tokens and decodes their claims.
 * <p>
 * Checks, in order: structure (three dot-separated parts, parsable header and payload),
 * algorithm (HS256 only), key id, signature, required claims ({@code sub}, {@code exp}),
 * expiry, not-before, issuer and audience. A signature that does not verify with the current
 * secret is retried with the provider's previous secret and then with a force-refreshed one,
 * so a rotation in the secret store does not reject tokens signed with either key.
 * <p>
 * Stateless apart from the secret provider; safe for concurrent use. Never touches the session
 * cache. Exception messages never contain the token.
 */
public final class TokenValidator {

    private static final Logger log = LoggerFactory.getLogger(TokenValidator.class);

    private final SecretProvider secrets;
    private final ClaimsCodec codec;
    private final TokenValidatorSettings settings;
    private final Clock clock;

    public TokenValidator(SecretProvider secrets, ClaimsCodec codec) {
        this(secrets, codec, TokenValidatorSettings.defaults(), Clock.systemUTC());
    }

    /**
     * @throws IllegalArgumentException if the current secret is shorter than 256 bits
     */
    public TokenValidator(SecretProvider secrets, ClaimsCodec codec, TokenValidatorSettings settings, Clock clock) {
        this.secrets = Objects.requireNonNull(secrets, "secrets");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");

        SigningSecret initial = secrets.current();
        if (!initial.isStrongEnough()) {
            throw new IllegalArgumentException("Signing secret from " + initial.source()
                    + " is shorter than " + SigningSecret.MIN_LENGTH_BYTES + " bytes");
        }
    }

    /**
     * Validates a raw token and returns its canonical claims.
     *
     * @param rawToken the compact JWS, without the "Bearer " prefix
     * @return the decoded claims
     * @throws AuthException with MALFORMED_TOKEN, SIGNATURE_INVALID, EXPIRED,
     *                       MISSING_REQUIRED_CLAIM or DECOMPRESSION_ERROR
     */
    public ClaimSet validate(String rawToken) {
        SignedJWT jwt = parse(rawToken);
        checkHeader(jwt.getHeader());
        verifySignature(jwt);

        JWTClaimsSet claimsSet;
        try {
            claimsSet = jwt.getJWTClaimsSet();
        } catch (ParseException e) {
            throw AuthException.malformed("Token payload is not a valid claims set");
        }
        checkRegisteredClaims(claimsSet);

        ClaimSet claims = codec.decode(claimsSet.toJSONObject());
        log.debug("Validated token for subject {}", claims.subjectId());
        return claims;
    }

    private static SignedJWT parse(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            throw AuthException.malformed("Token is empty");
        }
        if (rawToken.split("\\.", -1).length != 3) {
            throw AuthException.malformed("Token must have three dot-separated parts");
        }
        try {
            return SignedJWT.parse(rawToken);
        } catch (ParseException e) {
            throw AuthException.malformed("Token could not be parsed");
        }
    }

    private void checkHeader(JWSHeader header) {
        if (!JWSAlgorithm.HS256.equals(header.getAlgorithm())) {
            throw AuthException.malformed("Unsupported token algorithm: " + header.getAlgorithm());
        }
        String keyId = header.getKeyID();
        if (settings.keyId() != null && keyId != null && !settings.keyId().equals(keyId)) {
            throw AuthException.malformed("Token key id does not match the configured key");
        }
    }

    private void verifySignature(SignedJWT jwt) {
        SigningSecret current = secrets.current();
        if (verifies(jwt, current)) {
            return;
        }

        Optional<SigningSecret> previous = secrets.previous();
        if (previous.isPresent() && !previous.get().sameKeyAs(current) && verifies(jwt, previous.get())) {
            log.debug("Token verified with the previous signing secret from {}", previous.get().source());
            return;
        }

        SigningSecret refreshed = secrets.refresh();
        if (!refreshed.sameKeyAs(current) && verifies(jwt, refreshed)) {
            log.info("Token verified after refreshing the signing secret from {}", refreshed.source());
            return;
        }
        throw new AuthException(AuthErrorCode.SIGNATURE_INVALID, "Token signature verification failed");
    }

    private static boolean verifies(SignedJWT jwt, SigningSecret secret) {
        try {
            return jwt.verify(new MACVerifier(secret.bytes()));
        } catch (JOSEException e) {
            log.warn("Signing secret from {} cannot verify HS256 tokens: {}", secret.source(), e.getMessage());
            return false;
        }
    }

    private void checkRegisteredClaims(JWTClaimsSet claimsSet) {
        String subject = claimsSet.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new AuthException(AuthErrorCode.MISSING_REQUIRED_CLAIM, "Token is missing the 'sub' claim");
        }
        Date expiration = claimsSet.getExpirationTime();
        if (expiration == null) {
            throw new AuthException(AuthErrorCode.MISSING_REQUIRED_CLAIM, "Token is missing the 'exp' claim");
        }

        Instant now = clock.instant();
        if (!now.isBefore(expiration.toInstant().plus(settings.clockSkew()))) {
            throw new AuthException(AuthErrorCode.EXPIRED, "Token expired at " + expiration.toInstant());
        }
        Date notBefore = claimsSet.getNotBeforeTime();
        if (notBefore != null && now.isBefore(notBefore.toInstant().minus(settings.clockSkew()))) {
            throw AuthException.malformed("Token is not valid before " + notBefore.toInstant());
        }
        if (settings.issuer() != null && !settings.issuer().equals(claimsSet.getIssuer())) {
            throw AuthException.malformed("Token issuer is not accepted");
        }
        if (settings.audience() != null) {
            List<String> audience = claimsSet.getAudience();
            if (audience == null || !audience.contains(settings.audience())) {
                throw AuthException.malformed("Token audience is not accepted");
            }
        }
    }
}
