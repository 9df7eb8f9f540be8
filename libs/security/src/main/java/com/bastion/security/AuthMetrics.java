package com.bastion.security;

import com.bastion.observability.MetricFactory;
import io.micrometer.core.instrument.Timer;

import java.util.Locale;
import java.util.Objects;

/**
 * Meters recorded by the auth core. All meters carry the service tag of the wrapped
 * {@link MetricFactory}; outcomes are low-cardinality tag values, never subjects or sessions.
 */
public final class AuthMetrics {

    public static final String VALIDATION = "bastion.auth.validation";
    public static final String SESSION = "bastion.auth.session";
    public static final String EXCHANGE = "bastion.auth.exchange";
    public static final String EXCHANGE_LATENCY = "bastion.auth.exchange.latency";
    public static final String DECISION = "bastion.auth.decision";

    public static final String TAG_OUTCOME = "outcome";

    private final MetricFactory metrics;

    public AuthMetrics(MetricFactory metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /** Metrics kept in memory only, for components wired without a registry. */
    public static AuthMetrics inMemory() {
        return new AuthMetrics(MetricFactory.inMemory("bastion"));
    }

    /** "valid", or the lower-case failure code. */
    public void validation(String outcome) {
        metrics.counter(VALIDATION, "Token validation outcomes", TAG_OUTCOME, outcome).increment();
    }

    public void validationFailed(AuthErrorCode code) {
        validation(code.value());
    }

    /** hit, miss or expired. */
    public void sessionLookup(Enum<?> status) {
        metrics.counter(SESSION, "Session cache lookups", TAG_OUTCOME, status.name().toLowerCase(Locale.ROOT))
                .increment();
    }

    /** reused, cached, assumed, failed, negative_cached, timeout or abandoned. */
    public void exchange(String outcome) {
        metrics.counter(EXCHANGE, "Credential exchange outcomes", TAG_OUTCOME, outcome).increment();
    }

    public Timer exchangeLatency() {
        return metrics.timer(EXCHANGE_LATENCY, "Upstream role assumption latency");
    }

    public void decision(boolean allowed, String reason) {
        metrics.counter(DECISION, "Authorization decisions",
                TAG_OUTCOME, allowed ? "allowed" : "denied",
                "reason", reason).increment();
    }

    public MetricFactory factory() {
        return metrics;
    }
}
