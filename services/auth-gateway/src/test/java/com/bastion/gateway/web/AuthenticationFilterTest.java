package com.bastion.gateway.web;

import com.bastion.observability.LogContextKeys;
import com.bastion.observability.SpanHelper;
import com.bastion.security.AuthMetrics;
import com.bastion.security.claims.ClaimsCodec;
import com.bastion.security.context.AuthContextHolder;
import com.bastion.security.context.AuthScheme;
import com.bastion.security.exchange.CredentialExchangeManager;
import com.bastion.security.exchange.ExchangeSettings;
import com.bastion.security.exchange.TrustProvider;
import com.bastion.security.middleware.AuthenticatorSettings;
import com.bastion.security.middleware.RequestAuthenticator;
import com.bastion.security.session.SessionCache;
import com.bastion.security.testing.TestTokens;
import com.bastion.security.token.StaticSecretProvider;
import com.bastion.security.token.TokenValidator;
import com.bastion.security.token.TokenValidatorSettings;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

/**
 * Servlet mock tests: no Spring context, real auth core behind the filter.
 */
@DisplayName("AuthenticationFilter")
class AuthenticationFilterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private CredentialExchangeManager exchange;
    private AuthenticationFilter filter;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.systemUTC();
        AuthMetrics metrics = AuthMetrics.inMemory();
        TokenValidator validator = new TokenValidator(new StaticSecretProvider(TestTokens.SECRET), new ClaimsCodec(),
                TokenValidatorSettings.defaults(), clock);
        exchange = new CredentialExchangeManager(mock(TrustProvider.class), ExchangeSettings.defaults(), clock,
                Ticker.systemTicker(), SpanHelper.noop(), metrics);
        RequestAuthenticator authenticator = new RequestAuthenticator(validator, new SessionCache(), exchange,
                AuthenticatorSettings.strict(), metrics, clock);
        filter = new AuthenticationFilter(authenticator, objectMapper);
    }

    @AfterEach
    void cleanup() {
        exchange.close();
        MDC.clear();
    }

    private static String tokenFor(String subject) {
        Map<String, Object> claims = TestTokens.claims(subject, Instant.now().plusSeconds(3600));
        claims.put("buckets", List.of("data-raw"));
        return TestTokens.sign(claims);
    }

    private static MockHttpServletRequest requestWith(String token) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/auth/status");
        if (token != null) {
            request.addHeader("Authorization", "Bearer " + token);
        }
        return request;
    }

    @Nested
    @DisplayName("rejections")
    class Rejections {

        @Test
        @DisplayName("answers 401 token_required without calling the chain")
        void tokenRequired() throws Exception {
            MockHttpServletResponse response = new MockHttpServletResponse();
            AtomicReference<Boolean> called = new AtomicReference<>(false);

            filter.doFilter(requestWith(null), response, (req, resp) -> called.set(true));

            assertThat(called.get()).isFalse();
            assertThat(response.getStatus()).isEqualTo(401);
            assertThat(response.getContentType()).startsWith("application/problem+json");
            assertThat(response.getHeader("WWW-Authenticate")).isEqualTo("Bearer");
            JsonNode body = objectMapper.readTree(response.getContentAsString());
            assertThat(body.get("error").asText()).isEqualTo("token_required");
            assertThat(body.get("remediation").asText()).contains("Authorization: Bearer");
            assertThat(body.get("requestId").asText()).isEqualTo(response.getHeader("X-Request-ID"));
        }

        @Test
        @DisplayName("answers 401 with the specific code and never echoes the token")
        void invalidToken() throws Exception {
            String forged = TestTokens.sign(TestTokens.claims("mallory", Instant.now().plusSeconds(3600)),
                    TestTokens.OTHER_SECRET);
            MockHttpServletResponse response = new MockHttpServletResponse();

            filter.doFilter(requestWith(forged), response, (req, resp) -> { });

            assertThat(response.getStatus()).isEqualTo(401);
            assertThat(response.getHeader("WWW-Authenticate")).contains("invalid_token");
            String content = response.getContentAsString();
            assertThat(objectMapper.readTree(content).get("error").asText()).isEqualTo("signature_invalid");
            assertThat(content).doesNotContain(forged);
        }
    }

    @Nested
    @DisplayName("authenticated requests")
    class Authenticated {

        @Test
        @DisplayName("installs the identity while the chain runs and removes it afterwards")
        void scopedToRequest() throws Exception {
            AtomicReference<String> subject = new AtomicReference<>();
            AtomicReference<AuthScheme> scheme = new AtomicReference<>();
            FilterChain chain = (req, resp) -> {
                subject.set(AuthContextHolder.current().subjectId());
                scheme.set(AuthContextHolder.current().scheme());
            };

            filter.doFilter(requestWith(tokenFor("alice")), new MockHttpServletResponse(), chain);

            assertThat(subject.get()).isEqualTo("alice");
            assertThat(scheme.get()).isEqualTo(AuthScheme.TOKEN);
            assertThat(AuthContextHolder.depth()).isZero();
            assertThat(MDC.get(LogContextKeys.REQUEST_ID)).isNull();
            assertThat(MDC.get(LogContextKeys.SUBJECT_ID)).isNull();
        }

        @Test
        @DisplayName("propagates the caller's request id into the MDC and the response")
        void requestId() throws Exception {
            MockHttpServletRequest request = requestWith(tokenFor("alice"));
            request.addHeader("X-Request-ID", "req-42");
            MockHttpServletResponse response = new MockHttpServletResponse();
            AtomicReference<String> seen = new AtomicReference<>();

            filter.doFilter(request, response, (req, resp) -> seen.set(MDC.get(LogContextKeys.REQUEST_ID)));

            assertThat(seen.get()).isEqualTo("req-42");
            assertThat(response.getHeader("X-Request-ID")).isEqualTo("req-42");
        }

        @Test
        @DisplayName("clears the identity when the chain fails")
        void clearedOnFailure() {
            FilterChain failing = (req, resp) -> {
                throw new ServletException("downstream failure");
            };

            assertThatThrownBy(() -> filter.doFilter(requestWith(tokenFor("alice")),
                    new MockHttpServletResponse(), failing))
                    .isInstanceOf(ServletException.class);
            assertThat(AuthContextHolder.current().scheme()).isEqualTo(AuthScheme.NONE);
        }

        @Test
        @DisplayName("parallel requests each see only their own identity")
        void isolationUnderLoad() throws Exception {
            int clients = 16;
            int requestsPerClient = 25;
            ExecutorService pool = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Integer>> results = new ArrayList<>();
            for (int c = 0; c < clients; c++) {
                String subject = "user-" + c;
                String token = tokenFor(subject);
                results.add(pool.submit(() -> {
                    start.await();
                    int mismatches = 0;
                    for (int r = 0; r < requestsPerClient; r++) {
                        AtomicReference<String> seen = new AtomicReference<>();
                        filter.doFilter(requestWith(token), new MockHttpServletResponse(), (req, resp) -> {
                            Thread.yield();
                            seen.set(AuthContextHolder.current().subjectId());
                        });
                        if (!subject.equals(seen.get()) || AuthContextHolder.depth() != 0) {
                            mismatches++;
                        }
                    }
                    return mismatches;
                }));
            }
            start.countDown();

            for (Future<Integer> result : results) {
                assertThat(result.get(60, TimeUnit.SECONDS)).isZero();
            }
            pool.shutdown();
        }
    }
}
