package com.bastion.gateway.config;

import com.bastion.gateway.web.AuthenticationFilter;
import com.bastion.observability.MetricFactory;
import com.bastion.observability.SpanHelper;
import com.bastion.security.AuthMetrics;
import com.bastion.security.authz.AccessGuard;
import com.bastion.security.authz.AuthorizationEngine;
import com.bastion.security.claims.ClaimsCodec;
import com.bastion.security.exchange.CredentialExchangeManager;
import com.bastion.security.exchange.StsTrustProvider;
import com.bastion.security.exchange.TrustProvider;
import com.bastion.security.middleware.RequestAuthenticator;
import com.bastion.security.session.SessionCache;
import com.bastion.security.token.ParameterStoreSecretProvider;
import com.bastion.security.token.SecretProvider;
import com.bastion.security.token.SsmParameterFetcher;
import com.bastion.security.token.StaticSecretProvider;
import com.bastion.security.token.TokenValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

import java.time.Clock;

/**
 * Composes the auth core. Every cache is a singleton owned by this context and injected where
 * it is used.
 */
@Configuration
public class AuthConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AuthConfiguration.class);

    @Bean
    public Clock authClock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry,
                                       @Value("${spring.application.name:auth-gateway}") String serviceName) {
        return new MetricFactory(registry, serviceName);
    }

    @Bean
    public AuthMetrics authMetrics(MetricFactory metricFactory) {
        return new AuthMetrics(metricFactory);
    }

    @Bean
    public SpanHelper spanHelper(ObjectProvider<OpenTelemetry> openTelemetry) {
        return SpanHelper.of(openTelemetry.getIfAvailable(OpenTelemetry::noop));
    }

    @Bean
    public SecretProvider secretProvider(BastionAuthProperties properties) {
        BastionAuthProperties.Secret secret = properties.secret();
        if (secret.isInline()) {
            log.info("Signing secret: inline value");
            return new StaticSecretProvider(secret.value());
        }
        log.info("Signing secret: parameter {} in {}", secret.parameter(), secret.region());
        return new ParameterStoreSecretProvider(new SsmParameterFetcher(), secret.parameter(), secret.region());
    }

    @Bean
    public ClaimsCodec claimsCodec(BastionAuthProperties properties) {
        return new ClaimsCodec(properties.maxResources(), properties.claimPrecedence());
    }

    @Bean
    public TokenValidator tokenValidator(SecretProvider secretProvider, ClaimsCodec claimsCodec,
                                         BastionAuthProperties properties, Clock authClock) {
        return new TokenValidator(secretProvider, claimsCodec, properties.validatorSettings(), authClock);
    }

    @Bean
    public SessionCache sessionCache(BastionAuthProperties properties, Clock authClock, MetricFactory metricFactory) {
        SessionCache sessions = new SessionCache(properties.sessionTtl(), authClock);
        metricFactory.gauge("bastion.auth.sessions", "Cached client sessions", sessions, SessionCache::size);
        return sessions;
    }

    @Bean
    public TrustProvider trustProvider(BastionAuthProperties properties) {
        return new StsTrustProvider(properties.exchange().region());
    }

    @Bean
    public CredentialExchangeManager credentialExchangeManager(TrustProvider trustProvider,
                                                               BastionAuthProperties properties, Clock authClock,
                                                               SpanHelper spanHelper, AuthMetrics authMetrics) {
        return new CredentialExchangeManager(trustProvider, properties.exchange().settings(), authClock,
                Ticker.systemTicker(), spanHelper, authMetrics);
    }

    @Bean
    public RequestAuthenticator requestAuthenticator(TokenValidator tokenValidator, SessionCache sessionCache,
                                                     CredentialExchangeManager credentialExchangeManager,
                                                     BastionAuthProperties properties, AuthMetrics authMetrics,
                                                     Clock authClock) {
        return new RequestAuthenticator(tokenValidator, sessionCache, credentialExchangeManager,
                properties.authenticatorSettings(), authMetrics, authClock);
    }

    @Bean
    public AuthorizationEngine authorizationEngine() {
        return new AuthorizationEngine();
    }

    @Bean
    public AccessGuard accessGuard(AuthorizationEngine authorizationEngine, AuthMetrics authMetrics) {
        return new AccessGuard(authorizationEngine, authMetrics);
    }

    /**
     * Authenticates {@code /api/**} only; actuator endpoints stay reachable for probes.
     */
    @Bean
    public FilterRegistrationBean<AuthenticationFilter> authenticationFilter(RequestAuthenticator requestAuthenticator,
                                                                             ObjectMapper objectMapper) {
        FilterRegistrationBean<AuthenticationFilter> registration =
                new FilterRegistrationBean<>(new AuthenticationFilter(requestAuthenticator, objectMapper));
        registration.addUrlPatterns("/api/*");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
        return registration;
    }
}
