package com.bastion.security.token;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Secret provider that resolves a parameter-store reference and caches the value.
 * <p>
 * Resolution is per {@code (reference, region)}. The cached value is re-read after
 * {@code softRefresh}; if that read fails the cached value keeps being served until it is
 * {@code hardTtl} old, after which {@link #current()} fails. When a re-read returns a different
 * value the old one is kept as {@link #previous()} so tokens signed before the rotation still
 * verify. Forced refreshes are throttled to one per {@code minForcedRefreshInterval}.
 */
public final class ParameterStoreSecretProvider implements SecretProvider {

    public static final Duration DEFAULT_SOFT_REFRESH = Duration.ofMinutes(5);
    public static final Duration DEFAULT_HARD_TTL = Duration.ofHours(1);
    public static final Duration DEFAULT_MIN_FORCED_REFRESH_INTERVAL = Duration.ofSeconds(30);

    private static final Logger log = LoggerFactory.getLogger(ParameterStoreSecretProvider.class);

    private final ParameterFetcher fetcher;
    private final String reference;
    private final String region;
    private final Clock clock;
    private final Duration softRefresh;
    private final Duration hardTtl;
    private final Duration minForcedRefreshInterval;

    private SigningSecret cached;
    private SigningSecret previous;
    private Instant lastForcedRefresh = Instant.MIN;

    public ParameterStoreSecretProvider(ParameterFetcher fetcher, String reference, String region) {
        this(fetcher, reference, region, Clock.systemUTC(),
                DEFAULT_SOFT_REFRESH, DEFAULT_HARD_TTL, DEFAULT_MIN_FORCED_REFRESH_INTERVAL);
    }

    public ParameterStoreSecretProvider(ParameterFetcher fetcher, String reference, String region, Clock clock,
                                        Duration softRefresh, Duration hardTtl,
                                        Duration minForcedRefreshInterval) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("reference must not be null or blank");
        }
        if (region == null || region.isBlank()) {
            throw new IllegalArgumentException("region must not be null or blank");
        }
        if (hardTtl.compareTo(softRefresh) < 0) {
            throw new IllegalArgumentException("hardTtl must not be shorter than softRefresh");
        }
        this.reference = reference;
        this.region = region;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.softRefresh = softRefresh;
        this.hardTtl = hardTtl;
        this.minForcedRefreshInterval = minForcedRefreshInterval;
    }

    @Override
    public synchronized SigningSecret current() {
        Instant now = clock.instant();
        if (cached != null && age(cached, now).compareTo(softRefresh) < 0) {
            return cached;
        }
        return reload(now);
    }

    @Override
    public synchronized Optional<SigningSecret> previous() {
        return Optional.ofNullable(previous);
    }

    @Override
    public synchronized SigningSecret refresh() {
        Instant now = clock.instant();
        if (cached != null && Duration.between(lastForcedRefresh, now).compareTo(minForcedRefreshInterval) < 0) {
            return current();
        }
        lastForcedRefresh = now;
        return reload(now);
    }

    /** The {@code ssm:<reference>@<region>} name used in logs. */
    public String sourceName() {
        return "ssm:" + reference + "@" + region;
    }

    private SigningSecret reload(Instant now) {
        String value;
        try {
            value = fetcher.fetch(reference, region);
        } catch (RuntimeException e) {
            if (cached != null && age(cached, now).compareTo(hardTtl) < 0) {
                log.warn("Refreshing signing secret from {} failed, serving cached value: {}",
                        sourceName(), e.getMessage());
                return cached;
            }
            throw new SecretUnavailableException("Signing secret " + sourceName() + " could not be fetched", e);
        }
        if (value == null || value.isBlank()) {
            throw new SecretUnavailableException("Signing secret " + sourceName() + " is empty");
        }

        SigningSecret fresh = new SigningSecret(value, sourceName(), now);
        if (cached != null && !cached.sameKeyAs(fresh)) {
            log.info("Signing secret {} rotated", sourceName());
            previous = cached;
        }
        cached = fresh;
        return fresh;
    }

    private static Duration age(SigningSecret secret, Instant now) {
        return Duration.between(secret.fetchedAt(), now);
    }
}
