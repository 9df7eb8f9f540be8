package com.bastion.security.middleware;

import com.bastion.observability.SensitiveDataRedactor;
import com.bastion.security.AuthErrorCode;
import com.bastion.security.AuthException;
import com.bastion.security.AuthMetrics;
import com.bastion.security.claims.ClaimSet;
import com.bastion.security.context.AuthScheme;
import com.bastion.security.context.RuntimeAuthState;
import com.bastion.security.exchange.CredentialExchangeManager;
import com.bastion.security.exchange.ScopedCredentials;
import com.bastion.security.session.SessionCache;
import com.bastion.security.session.SessionLookup;
import com.bastion.security.session.SessionRecord;
import com.bastion.security.token.TokenValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Establishes the {@link RuntimeAuthState} of an inbound request from its headers.
 * <ol>
 *   <li>Read the bearer token, session id and requested role.</li>
 *   <li>If the session is cached and live, adopt its identity, unless the request carries a
 *       different token than the one that opened the session.</li>
 *   <li>Otherwise validate the token; store the result for the session, or drop the session
 *       entry if the token is invalid.</li>
 *   <li>If a role is requested, exchange the identity for role credentials and attach them to
 *       the session.</li>
 * </ol>
 * Installing the state for the duration of the request is the caller's job.
 * <p>
 * In strict mode a request without a usable identity fails with TOKEN_REQUIRED,
 * SESSION_EXPIRED or the validation error. In optional mode a request without a token runs as
 * the ambient identity and one with an invalid token runs unauthenticated.
 */
public final class RequestAuthenticator {

    public static final String EXTRA_ROLE = "role";

    private static final Logger log = LoggerFactory.getLogger(RequestAuthenticator.class);

    private final TokenValidator validator;
    private final SessionCache sessions;
    private final CredentialExchangeManager exchange;
    private final AuthenticatorSettings settings;
    private final AuthMetrics metrics;
    private final Clock clock;

    public RequestAuthenticator(TokenValidator validator, SessionCache sessions, CredentialExchangeManager exchange,
                                AuthenticatorSettings settings, AuthMetrics metrics, Clock clock) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @throws AuthException in strict mode when no identity can be established, and in both
     *                       modes when a requested role cannot be assumed
     */
    public RuntimeAuthState authenticate(RequestHeaders headers) {
        AuthHeaders names = settings.headers();
        String token = BearerTokenExtractor.extract(headers.get(names.authorization())).orElse(null);
        String sessionId = blankToNull(headers.get(names.sessionId()));
        String role = blankToNull(headers.get(names.role()));
        String fingerprint = SensitiveDataRedactor.fingerprint(token);

        RuntimeAuthState state = null;
        SessionRecord session = null;
        boolean sessionExpired = false;
        if (sessionId != null) {
            SessionLookup lookup = sessions.lookup(sessionId);
            metrics.sessionLookup(lookup.status());
            if (lookup.isHit()) {
                state = adopt(lookup.record(), token, fingerprint, role);
                session = state == null ? null : lookup.record();
                sessionExpired = state == null && token == null;
            } else {
                sessionExpired = lookup.status() == SessionLookup.Status.EXPIRED;
            }
        }

        if (state == null && token == null) {
            state = withoutToken(sessionId, sessionExpired);
        } else if (state == null) {
            state = validate(token, fingerprint, sessionId);
            if (sessionId != null && state.scheme() == AuthScheme.TOKEN) {
                session = sessions.store(sessionId, state.claims(), state.subjectId(), fingerprint);
            }
        }
        return assumeRoleIfRequested(state, role, session);
    }

    public AuthenticatorSettings settings() {
        return settings;
    }

    private RuntimeAuthState adopt(SessionRecord record, String token, String fingerprint, String requestedRole) {
        if (token != null && !record.openedBy(fingerprint)) {
            log.debug("Session {} presented a different token ({}); re-validating", record.sessionId(), fingerprint);
            return null;
        }
        Instant now = clock.instant();
        if (record.claims().isExpired(now)) {
            sessions.invalidate(record.sessionId());
            return null;
        }
        RuntimeAuthState state = RuntimeAuthState.token(record.claims(), record.sessionId());
        ScopedCredentials credentials = record.credentials();
        if (credentials != null && !credentials.isExpired(now)) {
            ScopedCredentials labelled = credentials.withRoleIfMissing(requestedRole);
            state = state.withAssumedRole(labelled).withExtra(EXTRA_ROLE, labelled.roleId());
        }
        return state;
    }

    private RuntimeAuthState withoutToken(String sessionId, boolean sessionExpired) {
        if (settings.mode() == AuthMode.STRICT) {
            if (sessionExpired) {
                throw new AuthException(AuthErrorCode.SESSION_EXPIRED, "Session has expired");
            }
            throw new AuthException(AuthErrorCode.TOKEN_REQUIRED, "Bearer token required");
        }
        return RuntimeAuthState.ambient(settings.ambient().toClaims(), sessionId);
    }

    private RuntimeAuthState validate(String token, String fingerprint, String sessionId) {
        ClaimSet claims;
        try {
            claims = validator.validate(token);
        } catch (AuthException e) {
            metrics.validationFailed(e.code());
            sessions.invalidate(sessionId);
            log.info("Rejected token {}: {} ({})", fingerprint, e.code().value(), e.getMessage());
            if (settings.mode() == AuthMode.STRICT) {
                throw e;
            }
            return RuntimeAuthState.none(sessionId);
        }
        metrics.validation("valid");
        return RuntimeAuthState.token(claims, sessionId);
    }

    /**
     * @param session the session record this request stored or adopted, or null when it has none
     */
    private RuntimeAuthState assumeRoleIfRequested(RuntimeAuthState state, String requestedRole,
                                                   SessionRecord session) {
        String role = requestedRole;
        if (role == null && settings.assumeClaimedRole() && state.scheme() == AuthScheme.TOKEN) {
            role = state.claims().roleArn();
        }
        if (role == null || !state.isAuthenticated()) {
            return state;
        }

        ScopedCredentials active = state.credentials();
        ScopedCredentials credentials = exchange.assume(state.subjectId(), role, active);
        if (credentials != active && session != null) {
            sessions.attachCredentials(session, credentials);
        }
        return state.withAssumedRole(credentials).withExtra(EXTRA_ROLE, role);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
