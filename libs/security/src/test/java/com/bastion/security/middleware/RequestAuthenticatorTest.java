package com.bastion.security.middleware;

import com.bastion.observability.SpanHelper;
import com.bastion.security.AuthErrorCode;
import com.bastion.security.AuthException;
import com.bastion.security.AuthMetrics;
import com.bastion.security.claims.AccessLevel;
import com.bastion.security.claims.ClaimsCodec;
import com.bastion.security.context.AuthScheme;
import com.bastion.security.context.RuntimeAuthState;
import com.bastion.security.exchange.CredentialExchangeManager;
import com.bastion.security.exchange.ExchangeSettings;
import com.bastion.security.exchange.ScopedCredentials;
import com.bastion.security.exchange.TrustProvider;
import com.bastion.security.session.SessionCache;
import com.bastion.security.session.SessionLookup;
import com.bastion.security.testing.MutableClock;
import com.bastion.security.testing.TestClaims;
import com.bastion.security.testing.TestTokens;
import com.bastion.security.token.StaticSecretProvider;
import com.bastion.security.token.TokenValidator;
import com.bastion.security.token.TokenValidatorSettings;
import io.micrometer.core.instrument.Counter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("RequestAuthenticator")
class RequestAuthenticatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String ROLE = "arn:aws:iam::123456789012:role/Reader";

    private MutableClock clock;
    private SessionCache sessions;
    private TrustProvider trustProvider;
    private CredentialExchangeManager exchange;
    private AuthMetrics metrics;
    private TokenValidator validator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        sessions = new SessionCache(Duration.ofHours(1), clock);
        trustProvider = mock(TrustProvider.class);
        metrics = AuthMetrics.inMemory();
        exchange = new CredentialExchangeManager(trustProvider, ExchangeSettings.defaults(), clock, clock::nanos,
                SpanHelper.noop(), metrics);
        validator = new TokenValidator(new StaticSecretProvider(TestTokens.SECRET), new ClaimsCodec(),
                TokenValidatorSettings.defaults(), clock);
    }

    @AfterEach
    void tearDown() {
        exchange.close();
    }

    private RequestAuthenticator authenticator(AuthenticatorSettings settings) {
        return new RequestAuthenticator(validator, sessions, exchange, settings, metrics, clock);
    }

    private static String token(String subject, Instant expiresAt) {
        Map<String, Object> claims = TestTokens.claims(subject, expiresAt);
        claims.put("permissions", List.of("s3:ListBucket", "s3:GetBucketLocation"));
        claims.put("buckets", List.of("data-raw"));
        return TestTokens.sign(claims);
    }

    private static RequestHeaders headers(String token, String sessionId, String role) {
        Map<String, String> values = new HashMap<>();
        if (token != null) {
            values.put("authorization", "Bearer " + token);
        }
        if (sessionId != null) {
            values.put("mcp-session-id", sessionId);
        }
        if (role != null) {
            values.put("x-bastion-role", role);
        }
        return RequestHeaders.of(values);
    }

    private double sessionLookups(SessionLookup.Status status) {
        Counter counter = metrics.factory().registry().find(AuthMetrics.SESSION)
                .tag(AuthMetrics.TAG_OUTCOME, status.name().toLowerCase(Locale.ROOT))
                .counter();
        return counter == null ? 0 : counter.count();
    }

    private static AuthErrorCode codeOf(Runnable call) {
        try {
            call.run();
        } catch (AuthException e) {
            return e.code();
        }
        throw new AssertionError("expected an AuthException");
    }

    @Nested
    @DisplayName("strict mode")
    class Strict {

        private RequestAuthenticator authenticator;

        @BeforeEach
        void setUp() {
            authenticator = authenticator(AuthenticatorSettings.strict());
        }

        @Test
        @DisplayName("a valid token establishes a TOKEN identity and opens the session")
        void validToken() {
            RuntimeAuthState state = authenticator.authenticate(
                    headers(token("alice", NOW.plusSeconds(3600)), "s-1", null));

            assertThat(state.scheme()).isEqualTo(AuthScheme.TOKEN);
            assertThat(state.subjectId()).isEqualTo("alice");
            assertThat(state.sessionId()).isEqualTo("s-1");
            assertThat(state.claims().permissions()).contains("s3:ListBucket");
            assertThat(sessions.lookup("s-1").isHit()).isTrue();
        }

        @Test
        @DisplayName("later requests of the session are served from the cache without a token")
        void sessionReuse() {
            authenticator.authenticate(headers(token("alice", NOW.plusSeconds(3600)), "s-1", null));
            clock.advance(Duration.ofMinutes(10));

            RuntimeAuthState state = authenticator.authenticate(headers(null, "s-1", null));

            assertThat(state.scheme()).isEqualTo(AuthScheme.TOKEN);
            assertThat(state.subjectId()).isEqualTo("alice");
            assertThat(sessionLookups(SessionLookup.Status.HIT)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("sessions do not leak into each other")
        void sessionIsolation() {
            authenticator.authenticate(headers(token("alice", NOW.plusSeconds(3600)), "s-alice", null));
            authenticator.authenticate(headers(token("bob", NOW.plusSeconds(3600)), "s-bob", null));

            assertThat(authenticator.authenticate(headers(null, "s-alice", null)).subjectId()).isEqualTo("alice");
            assertThat(authenticator.authenticate(headers(null, "s-bob", null)).subjectId()).isEqualTo("bob");
        }

        @Test
        @DisplayName("a different token on an open session is validated instead of the cached identity")
        void differentToken() {
            authenticator.authenticate(headers(token("alice", NOW.plusSeconds(3600)), "s-1", null));

            RuntimeAuthState state = authenticator.authenticate(
                    headers(token("bob", NOW.plusSeconds(3600)), "s-1", null));

            assertThat(state.subjectId()).isEqualTo("bob");
            assertThat(sessions.lookup("s-1").record().subjectId()).isEqualTo("bob");
        }

        @Test
        @DisplayName("an invalid token fails and evicts the session")
        void invalidTokenEvictsSession() {
            authenticator.authenticate(headers(token("alice", NOW.plusSeconds(3600)), "s-1", null));
            String forged = TestTokens.sign(TestTokens.claims("mallory", NOW.plusSeconds(3600)),
                    TestTokens.OTHER_SECRET);

            assertThat(codeOf(() -> authenticator.authenticate(headers(forged, "s-1", null))))
                    .isEqualTo(AuthErrorCode.SIGNATURE_INVALID);
            assertThat(sessions.lookup("s-1").status()).isEqualTo(SessionLookup.Status.MISS);
        }

        @Test
        @DisplayName("without token or session the request is rejected")
        void tokenRequired() {
            assertThat(codeOf(() -> authenticator.authenticate(RequestHeaders.empty())))
                    .isEqualTo(AuthErrorCode.TOKEN_REQUIRED);
            assertThat(codeOf(() -> authenticator.authenticate(headers(null, "unknown", null))))
                    .isEqualTo(AuthErrorCode.TOKEN_REQUIRED);
        }

        @Test
        @DisplayName("a session past its TTL reports SESSION_EXPIRED")
        void sessionExpired() {
            authenticator.authenticate(headers(token("alice", NOW.plusSeconds(7200)), "s-1", null));
            clock.advance(Duration.ofMinutes(61));

            assertThat(codeOf(() -> authenticator.authenticate(headers(null, "s-1", null))))
                    .isEqualTo(AuthErrorCode.SESSION_EXPIRED);
        }

        @Test
        @DisplayName("a session whose token has expired is dropped")
        void claimsExpiredInSession() {
            authenticator.authenticate(headers(token("alice", NOW.plusSeconds(600)), "s-1", null));
            clock.advance(Duration.ofMinutes(11));

            assertThat(codeOf(() -> authenticator.authenticate(headers(null, "s-1", null))))
                    .isEqualTo(AuthErrorCode.SESSION_EXPIRED);
            assertThat(sessions.size()).isZero();
        }

        @Test
        @DisplayName("an expired token is rejected")
        void expiredToken() {
            assertThat(codeOf(() -> authenticator.authenticate(
                    headers(token("alice", NOW.minusSeconds(1)), null, null))))
                    .isEqualTo(AuthErrorCode.EXPIRED);
        }
    }

    @Nested
    @DisplayName("role assumption")
    class RoleAssumption {

        private ScopedCredentials issued;

        @BeforeEach
        void setUp() {
            issued = TestClaims.credentials(ROLE, NOW.plusSeconds(3600));
            when(trustProvider.assumeRole(any())).thenReturn(issued);
        }

        @Test
        @DisplayName("a requested role is assumed once and reused by the session")
        void assumedOncePerSession() {
            RequestAuthenticator authenticator = authenticator(AuthenticatorSettings.strict());

            RuntimeAuthState first = authenticator.authenticate(
                    headers(token("alice", NOW.plusSeconds(3600)), "s-1", ROLE));
            RuntimeAuthState second = authenticator.authenticate(headers(null, "s-1", ROLE));

            assertThat(first.scheme()).isEqualTo(AuthScheme.ASSUMED_ROLE);
            assertThat(first.effectiveCredentials()).isSameAs(issued);
            assertThat(first.extras()).containsEntry(RequestAuthenticator.EXTRA_ROLE, ROLE);
            assertThat(second.effectiveCredentials()).isSameAs(issued);
            assertThat(sessions.lookup("s-1").record().credentials()).isSameAs(issued);
            verify(trustProvider, times(1)).assumeRole(any());
        }

        @Test
        @DisplayName("credentials without a role id are labelled with the requested role")
        void providerOmitsRoleId() {
            ScopedCredentials unlabelled = new ScopedCredentials("ASIANOROLE", "secret", "session-token",
                    "us-east-1", NOW.plusSeconds(3600), null);
            when(trustProvider.assumeRole(any())).thenReturn(unlabelled);
            RequestAuthenticator authenticator = authenticator(AuthenticatorSettings.strict());

            RuntimeAuthState first = authenticator.authenticate(
                    headers(token("alice", NOW.plusSeconds(3600)), "s-1", ROLE));
            RuntimeAuthState tokenless = authenticator.authenticate(headers(null, "s-1", null));
            RuntimeAuthState sameRole = authenticator.authenticate(headers(null, "s-1", ROLE));

            assertThat(first.effectiveCredentials().roleId()).isEqualTo(ROLE);
            assertThat(first.effectiveCredentials().accessKeyId()).isEqualTo("ASIANOROLE");
            assertThat(tokenless.scheme()).isEqualTo(AuthScheme.ASSUMED_ROLE);
            assertThat(tokenless.extras()).containsEntry(RequestAuthenticator.EXTRA_ROLE, ROLE);
            assertThat(sameRole.effectiveCredentials().accessKeyId()).isEqualTo("ASIANOROLE");
            verify(trustProvider, times(1)).assumeRole(any());
        }

        @Test
        @DisplayName("credentials are not attached to a session another identity took over meanwhile")
        void sessionReplacedDuringExchange() {
            when(trustProvider.assumeRole(any())).thenAnswer(invocation -> {
                sessions.store("s-1", TestClaims.create("bob", Set.of("s3:GetObject"), Set.of("bob-data")),
                        "bob", "fp-bob");
                return issued;
            });
            RequestAuthenticator authenticator = authenticator(AuthenticatorSettings.strict());

            RuntimeAuthState alice = authenticator.authenticate(
                    headers(token("alice", NOW.plusSeconds(3600)), "s-1", ROLE));
            RuntimeAuthState next = authenticator.authenticate(headers(null, "s-1", null));

            assertThat(alice.effectiveCredentials()).isSameAs(issued);
            assertThat(next.subjectId()).isEqualTo("bob");
            assertThat(next.scheme()).isEqualTo(AuthScheme.TOKEN);
            assertThat(next.effectiveCredentials()).isNull();
        }

        @Test
        @DisplayName("the token's role claim is assumed only when enabled")
        void claimedRole() {
            Map<String, Object> claims = TestTokens.claims("alice", NOW.plusSeconds(3600));
            claims.put("roles", List.of(ROLE));
            String withRole = TestTokens.sign(claims);

            RuntimeAuthState plain = authenticator(AuthenticatorSettings.strict())
                    .authenticate(headers(withRole, null, null));
            assertThat(plain.scheme()).isEqualTo(AuthScheme.TOKEN);
            verify(trustProvider, never()).assumeRole(any());

            RuntimeAuthState assumed = authenticator(new AuthenticatorSettings(AuthMode.STRICT, null, null, true))
                    .authenticate(headers(withRole, null, null));
            assertThat(assumed.scheme()).isEqualTo(AuthScheme.ASSUMED_ROLE);
        }

        @Test
        @DisplayName("a refused role assumption fails the request")
        void refused() {
            when(trustProvider.assumeRole(any())).thenThrow(new IllegalStateException("AccessDenied"));
            RequestAuthenticator authenticator = authenticator(AuthenticatorSettings.strict());

            assertThat(codeOf(() -> authenticator.authenticate(
                    headers(token("alice", NOW.plusSeconds(3600)), "s-1", ROLE))))
                    .isEqualTo(AuthErrorCode.ROLE_ASSUMPTION_FAILED);
        }

        @Test
        @DisplayName("unauthenticated requests never reach the trust provider")
        void unauthenticated() {
            RequestAuthenticator authenticator = authenticator(
                    new AuthenticatorSettings(AuthMode.OPTIONAL, null, null, false));
            String forged = TestTokens.sign(TestTokens.claims("mallory", NOW.plusSeconds(3600)),
                    TestTokens.OTHER_SECRET);

            RuntimeAuthState state = authenticator.authenticate(headers(forged, null, ROLE));

            assertThat(state.scheme()).isEqualTo(AuthScheme.NONE);
            verify(trustProvider, never()).assumeRole(any());
        }
    }

    @Nested
    @DisplayName("optional mode")
    class OptionalMode {

        private RequestAuthenticator authenticator;

        @BeforeEach
        void setUp() {
            AmbientIdentity ambient = new AmbientIdentity("local", Set.of("s3:ListBucket"), Set.of("public-*"),
                    AccessLevel.READ);
            authenticator = authenticator(new AuthenticatorSettings(AuthMode.OPTIONAL, null, ambient, false));
        }

        @Test
        @DisplayName("a request without a token runs as the ambient identity")
        void ambient() {
            RuntimeAuthState state = authenticator.authenticate(headers(null, "s-1", null));

            assertThat(state.scheme()).isEqualTo(AuthScheme.AMBIENT);
            assertThat(state.subjectId()).isEqualTo("local");
            assertThat(state.claims().resources()).containsExactly("public-*");
            assertThat(state.sessionId()).isEqualTo("s-1");
        }

        @Test
        @DisplayName("an invalid token runs unauthenticated rather than failing")
        void invalidToken() {
            RuntimeAuthState state = authenticator.authenticate(headers("not-a-jwt", "s-1", null));

            assertThat(state.scheme()).isEqualTo(AuthScheme.NONE);
            assertThat(state.sessionId()).isEqualTo("s-1");
        }

        @Test
        @DisplayName("a valid token still wins over the ambient identity")
        void validToken() {
            RuntimeAuthState state = authenticator.authenticate(
                    headers(token("alice", NOW.plusSeconds(3600)), null, null));

            assertThat(state.scheme()).isEqualTo(AuthScheme.TOKEN);
            assertThat(state.subjectId()).isEqualTo("alice");
        }
    }

    @Test
    @DisplayName("header names are configurable")
    void customHeaders() {
        AuthHeaders names = new AuthHeaders("X-Auth", "X-Session", null);
        RequestAuthenticator authenticator = authenticator(
                new AuthenticatorSettings(AuthMode.STRICT, names, null, false));

        RuntimeAuthState state = authenticator.authenticate(RequestHeaders.of(Map.of(
                "X-Auth", "Bearer " + token("alice", NOW.plusSeconds(3600)),
                "X-Session", "s-7")));

        assertThat(state.sessionId()).isEqualTo("s-7");
        assertThat(state.subjectId()).isEqualTo("alice");
    }
}
