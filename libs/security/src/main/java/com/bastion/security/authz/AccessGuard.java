package com.bastion.security.authz;

import com.bastion.security.AuthErrorCode;
import com.bastion.security.AuthException;
import com.bastion.security.AuthMetrics;
import com.bastion.security.context.AuthContextHolder;
import com.bastion.security.context.RuntimeAuthState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Entry point for protected operations: evaluates the request's current identity against the
 * {@link AuthorizationEngine} and hands back the credentials to act with.
 */
public final class AccessGuard {

    private static final Logger log = LoggerFactory.getLogger(AccessGuard.class);

    private final AuthorizationEngine engine;
    private final AuthMetrics metrics;

    public AccessGuard(AuthorizationEngine engine, AuthMetrics metrics) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Decides for the current request without throwing.
     */
    public AuthorizationDecision evaluate(String operation, String resource) {
        RuntimeAuthState state = AuthContextHolder.current();
        AuthorizationDecision decision = engine.decide(operation, resource, state.claims());
        metrics.decision(decision.allowed(),
                decision.allowed() ? "allowed" : decision.denialReason().name().toLowerCase(Locale.ROOT));
        if (!decision.allowed()) {
            log.info("Denied {} on {}: {}", operation, resource, decision.reason());
            return decision;
        }
        return decision.withCredentials(state.effectiveCredentials());
    }

    /**
     * Decides for the current request and fails if denied.
     *
     * @return the allowed decision, carrying the credentials to use
     * @throws AuthException UNAUTHORIZED naming the specific reason
     */
    public AuthorizationDecision check(String operation, String resource) {
        AuthorizationDecision decision = evaluate(operation, resource);
        if (!decision.allowed()) {
            throw new AuthException(AuthErrorCode.UNAUTHORIZED, decision.reason());
        }
        return decision;
    }
}
