package com.bastion.gateway.config;

import com.bastion.security.claims.AccessLevel;
import com.bastion.security.claims.ClaimPrecedence;
import com.bastion.security.claims.ClaimsCodec;
import com.bastion.security.exchange.ExchangeSettings;
import com.bastion.security.exchange.ScopedCredentials;
import com.bastion.security.middleware.AmbientIdentity;
import com.bastion.security.middleware.AuthHeaders;
import com.bastion.security.middleware.AuthMode;
import com.bastion.security.middleware.AuthenticatorSettings;
import com.bastion.security.session.SessionCache;
import com.bastion.security.token.TokenValidatorSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Set;

/**
 * Type-safe configuration of the auth core, bound from {@code bastion.auth.*}.
 *
 * <pre>
 * bastion:
 *   auth:
 *     mode: strict
 *     secret:
 *       parameter: /bastion/jwt-secret
 *       region: eu-west-1
 *       key-id: bastion-2026-01
 *     session-ttl: 1h
 *     exchange:
 *       timeout: 10s
 * </pre>
 *
 * <p>The compact constructors apply defaults before Bean Validation runs. Secret material is
 * mandatory: either an inline value or a parameter reference.
 *
 * @param mode              strict (token required) or optional (ambient identity fallback)
 * @param secret            where the HS256 signing secret comes from
 * @param issuer            expected {@code iss}, unchecked when blank
 * @param audience          expected {@code aud}, unchecked when blank
 * @param clockSkew         tolerance applied to {@code exp}
 * @param maxResources      upper bound on the resources a token may grant
 * @param claimPrecedence   how conflicting compact and expanded claims are resolved
 * @param sessionTtl        lifetime of a cached session identity
 * @param evictionInterval  period of the expired-session sweep
 * @param assumeClaimedRole assume the role named in the token when no role header is sent
 * @param headers           header names
 * @param ambient           identity for token-less requests in optional mode
 * @param exchange          role assumption tuning
 */
@ConfigurationProperties(prefix = "bastion.auth")
@Validated
public record BastionAuthProperties(
        AuthMode mode,
        @Valid Secret secret,
        String issuer,
        String audience,
        Duration clockSkew,
        @Positive int maxResources,
        ClaimPrecedence claimPrecedence,
        Duration sessionTtl,
        Duration evictionInterval,
        boolean assumeClaimedRole,
        Headers headers,
        Ambient ambient,
        @Valid Exchange exchange) {

    public BastionAuthProperties {
        if (mode == null) {
            mode = AuthMode.STRICT;
        }
        if (secret == null) {
            secret = new Secret(null, null, null, null);
        }
        if (clockSkew == null || clockSkew.isNegative()) {
            clockSkew = Duration.ZERO;
        }
        if (maxResources <= 0) {
            maxResources = ClaimsCodec.DEFAULT_MAX_RESOURCES;
        }
        if (claimPrecedence == null) {
            claimPrecedence = ClaimPrecedence.EXPANDED_WINS;
        }
        if (sessionTtl == null || sessionTtl.isZero() || sessionTtl.isNegative()) {
            sessionTtl = SessionCache.DEFAULT_TTL;
        }
        if (evictionInterval == null || evictionInterval.isZero() || evictionInterval.isNegative()) {
            evictionInterval = Duration.ofMinutes(5);
        }
        if (headers == null) {
            headers = new Headers(null, null, null);
        }
        if (ambient == null) {
            ambient = new Ambient(null, null, null, null);
        }
        if (exchange == null) {
            exchange = new Exchange(null, null, null, null, null, 0, 0);
        }
    }

    @AssertTrue(message = "bastion.auth.secret.value or bastion.auth.secret.parameter must be set")
    public boolean isSecretConfigured() {
        return secret.isConfigured();
    }

    public TokenValidatorSettings validatorSettings() {
        return new TokenValidatorSettings(secret.keyId(), issuer, audience, clockSkew);
    }

    public AuthenticatorSettings authenticatorSettings() {
        return new AuthenticatorSettings(mode,
                new AuthHeaders(headers.authorization(), headers.sessionId(), headers.role()),
                new AmbientIdentity(ambient.subjectId(), ambient.permissions(), ambient.resources(), ambient.level()),
                assumeClaimedRole);
    }

    /**
     * Signing secret source. Exactly one of {@code value} and {@code parameter} is used; the
     * inline value wins when both are set.
     *
     * @param value     inline secret
     * @param parameter SSM parameter name holding the secret
     * @param region    region of the parameter
     * @param keyId     expected {@code kid} header, unchecked when blank
     */
    public record Secret(String value, String parameter, String region, String keyId) {

        public Secret {
            if (region == null || region.isBlank()) {
                region = ScopedCredentials.DEFAULT_REGION;
            }
        }

        public boolean isInline() {
            return value != null && !value.isBlank();
        }

        public boolean isParameter() {
            return !isInline() && parameter != null && !parameter.isBlank();
        }

        public boolean isConfigured() {
            return isInline() || isParameter();
        }

        @Override
        public String toString() {
            return "Secret[value=" + (isInline() ? "[REDACTED]" : "null")
                    + ", parameter=" + parameter + ", region=" + region + ", keyId=" + keyId + "]";
        }
    }

    /** Header names; blanks fall back to the defaults of {@link AuthHeaders}. */
    public record Headers(String authorization, String sessionId, String role) {
    }

    /** Ambient identity; see {@link AmbientIdentity}. */
    public record Ambient(String subjectId, Set<String> permissions, Set<String> resources, AccessLevel level) {
    }

    /**
     * Role assumption tuning; zero or missing values take the defaults of {@link ExchangeSettings}.
     *
     * @param region trust provider region
     */
    public record Exchange(String region, Duration timeout, Duration negativeTtl, Duration refreshMargin,
                           Duration sessionDuration, long maximumSize, int maxConcurrent) {

        public Exchange {
            if (region == null || region.isBlank()) {
                region = ScopedCredentials.DEFAULT_REGION;
            }
        }

        public ExchangeSettings settings() {
            return new ExchangeSettings(timeout, negativeTtl, refreshMargin, sessionDuration, maximumSize,
                    maxConcurrent);
        }
    }
}
