package com.bastion.security.exchange;

import java.time.Duration;

/**
 * Tuning of {@link CredentialExchangeManager}.
 *
 * @param timeout          how long a request waits for the trust provider
 * @param negativeTtl      how long a failure is replayed without calling upstream again
 * @param refreshMargin    cached credentials are not handed out once they expire within this margin
 * @param sessionDuration  lifetime requested from the trust provider
 * @param maximumSize      upper bound on cached (owner, role) entries
 * @param maxConcurrent    upstream calls allowed to run at once
 */
public record ExchangeSettings(
        Duration timeout,
        Duration negativeTtl,
        Duration refreshMargin,
        Duration sessionDuration,
        long maximumSize,
        int maxConcurrent
) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_NEGATIVE_TTL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_REFRESH_MARGIN = Duration.ofMinutes(5);
    public static final Duration DEFAULT_SESSION_DURATION = Duration.ofHours(1);

    public ExchangeSettings {
        timeout = positiveOr(timeout, DEFAULT_TIMEOUT);
        negativeTtl = positiveOr(negativeTtl, DEFAULT_NEGATIVE_TTL);
        refreshMargin = refreshMargin == null || refreshMargin.isNegative() ? DEFAULT_REFRESH_MARGIN : refreshMargin;
        sessionDuration = positiveOr(sessionDuration, DEFAULT_SESSION_DURATION);
        if (refreshMargin.compareTo(sessionDuration) >= 0) {
            throw new IllegalArgumentException("refreshMargin must be shorter than sessionDuration");
        }
        if (maximumSize <= 0) {
            maximumSize = 10_000;
        }
        if (maxConcurrent <= 0) {
            maxConcurrent = 16;
        }
    }

    public static ExchangeSettings defaults() {
        return new ExchangeSettings(null, null, null, null, 0, 0);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isZero() || value.isNegative() ? fallback : value;
    }
}
