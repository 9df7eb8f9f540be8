package com.bastion.security.exchange;

import com.bastion.observability.SensitiveDataRedactor;
import com.bastion.observability.SpanHelper;
import com.bastion.security.AuthErrorCode;
import com.bastion.security.AuthException;
import com.bastion.security.AuthMetrics;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.opentelemetry.api.trace.SpanKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Exchanges a subject's identity for short-lived role credentials and caches the result per
 * {@code (owner, role)}.
 * <p>
 * Successful results are cached until {@code refreshMargin} before they expire; failures are
 * cached for {@code negativeTtl} and replayed without calling upstream. Concurrent requests for
 * the same key share one upstream call. Each requester waits at most {@code timeout}; a timeout
 * is cached as a failure, while an interrupted requester abandons the exchange without caching
 * anything. Only requesting threads write to the cache, so a result arriving after every
 * requester gave up is discarded.
 */
public final class CredentialExchangeManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CredentialExchangeManager.class);

    private static final Pattern SOURCE_IDENTITY_INVALID = Pattern.compile("[^\\w+=,.@-]");
    private static final int SOURCE_IDENTITY_MAX = 64;

    private final TrustProvider trustProvider;
    private final ExchangeSettings settings;
    private final Clock clock;
    private final SpanHelper spans;
    private final AuthMetrics metrics;
    private final ExecutorService executor;
    private final Cache<ExchangeKey, ExchangeOutcome> cache;
    private final ConcurrentMap<ExchangeKey, CompletableFuture<ScopedCredentials>> inFlight = new ConcurrentHashMap<>();

    public CredentialExchangeManager(TrustProvider trustProvider, ExchangeSettings settings) {
        this(trustProvider, settings, Clock.systemUTC(), Ticker.systemTicker(), SpanHelper.noop(),
                AuthMetrics.inMemory());
    }

    public CredentialExchangeManager(TrustProvider trustProvider, ExchangeSettings settings, Clock clock,
                                     Ticker ticker, SpanHelper spans, AuthMetrics metrics) {
        this.trustProvider = Objects.requireNonNull(trustProvider, "trustProvider");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.spans = Objects.requireNonNull(spans, "spans");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.executor = new ThreadPoolExecutor(
                settings.maxConcurrent(), settings.maxConcurrent(),
                60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(settings.maxConcurrent() * 8),
                new ExchangeThreadFactory());
        ((ThreadPoolExecutor) executor).allowCoreThreadTimeOut(true);
        this.cache = Caffeine.newBuilder()
                .maximumSize(settings.maximumSize())
                .ticker(ticker)
                .expireAfter(new OutcomeExpiry())
                .build();
    }

    /**
     * Returns credentials for {@code roleId} on behalf of {@code owner}.
     *
     * @param owner  the subject the credentials are issued for
     * @param roleId the role to assume
     * @param active credentials already held by the caller (nullable); returned unchanged if they
     *               are for the same role and not expired
     * @throws AuthException with ROLE_ASSUMPTION_FAILED on refusal, timeout, interruption, or while
     *                       a recent failure is being replayed
     */
    public ScopedCredentials assume(String owner, String roleId, ScopedCredentials active) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner must not be null or blank");
        }
        if (roleId == null || roleId.isBlank()) {
            throw new IllegalArgumentException("roleId must not be null or blank");
        }

        Instant now = clock.instant();
        if (active != null && active.isForRole(roleId) && !active.isExpired(now)) {
            metrics.exchange("reused");
            return active;
        }

        ExchangeKey key = new ExchangeKey(owner, roleId);
        ExchangeOutcome cached = cache.getIfPresent(key);
        if (cached != null) {
            if (cached.failed()) {
                metrics.exchange("negative_cached");
                throw failure(roleId, "failed recently (" + cached.failureReason() + "), retry shortly", null);
            }
            if (!cached.credentials().expiresWithin(settings.refreshMargin(), now)) {
                metrics.exchange("cached");
                return cached.credentials();
            }
            cache.asMap().remove(key, cached);
        }

        return awaitExchange(key, now);
    }

    /** Drops any cached outcome for the pair. */
    public void invalidate(String owner, String roleId) {
        cache.invalidate(new ExchangeKey(owner, roleId));
    }

    public long cachedEntries() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private ScopedCredentials awaitExchange(ExchangeKey key, Instant now) {
        CompletableFuture<ScopedCredentials> fresh = new CompletableFuture<>();
        CompletableFuture<ScopedCredentials> existing = inFlight.putIfAbsent(key, fresh);
        CompletableFuture<ScopedCredentials> future = existing != null ? existing : fresh;
        if (existing == null) {
            start(key, fresh, now);
        } else {
            log.debug("Joining in-flight exchange for role {}", key.roleId());
        }

        try {
            ScopedCredentials credentials = future.get(settings.timeout().toMillis(), TimeUnit.MILLISECONDS);
            cache.put(key, ExchangeOutcome.success(credentials));
            metrics.exchange("assumed");
            return credentials;
        } catch (TimeoutException e) {
            inFlight.remove(key, future);
            cache.put(key, ExchangeOutcome.failure("timed out after " + settings.timeout().toMillis() + " ms"));
            metrics.exchange("timeout");
            throw failure(key.roleId(), "timed out after " + settings.timeout().toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            cache.put(key, ExchangeOutcome.failure(describe(cause)));
            metrics.exchange("failed");
            log.warn("Role assumption for {} failed: {}", key.roleId(), describe(cause));
            throw failure(key.roleId(), "was refused by the trust provider", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            inFlight.remove(key, future);
            metrics.exchange("abandoned");
            log.debug("Exchange for role {} abandoned by an interrupted request", key.roleId());
            throw failure(key.roleId(), "was abandoned", e);
        }
    }

    private void start(ExchangeKey key, CompletableFuture<ScopedCredentials> result, Instant now) {
        RoleAssumptionRequest request = new RoleAssumptionRequest(
                key.owner(),
                key.roleId(),
                sessionName(key.owner(), now),
                sourceIdentity(key.owner()),
                settings.sessionDuration());
        Map<String, String> logContext = MDC.getCopyOfContextMap();
        result.whenComplete((credentials, error) -> inFlight.remove(key, result));
        try {
            executor.execute(() -> runUpstream(request, result, logContext));
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new IllegalStateException("too many concurrent role assumptions", e));
        }
    }

    private void runUpstream(RoleAssumptionRequest request, CompletableFuture<ScopedCredentials> result,
                             Map<String, String> logContext) {
        if (logContext != null) {
            MDC.setContextMap(logContext);
        }
        long started = System.nanoTime();
        try {
            ScopedCredentials credentials = spans.withSpan("bastion.exchange.assume_role", SpanKind.CLIENT,
                    Map.of("bastion.role", request.roleId()),
                    () -> trustProvider.assumeRole(request));
            if (credentials == null) {
                throw new IllegalStateException("trust provider returned no credentials");
            }
            result.complete(credentials.withRoleIfMissing(request.roleId()));
        } catch (Exception e) {
            result.completeExceptionally(e);
        } finally {
            metrics.exchangeLatency().record(System.nanoTime() - started, TimeUnit.NANOSECONDS);
            MDC.clear();
        }
    }

    private Duration timeToLive(ScopedCredentials credentials) {
        if (credentials.expiration() == null) {
            return settings.sessionDuration().minus(settings.refreshMargin());
        }
        Duration ttl = Duration.between(clock.instant(), credentials.expiration().minus(settings.refreshMargin()));
        return ttl.isNegative() ? Duration.ZERO : ttl;
    }

    static String sessionName(String owner, Instant now) {
        return "bastion-" + SensitiveDataRedactor.fingerprint(owner) + "-" + now.getEpochSecond();
    }

    static String sourceIdentity(String owner) {
        String sanitized = SOURCE_IDENTITY_INVALID.matcher(owner).replaceAll("-");
        if (sanitized.length() > SOURCE_IDENTITY_MAX) {
            sanitized = sanitized.substring(0, SOURCE_IDENTITY_MAX);
        }
        return sanitized.length() < 2 ? null : sanitized;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null ? error.getClass().getSimpleName() : message;
    }

    private static AuthException failure(String roleId, String what, Throwable cause) {
        return new AuthException(AuthErrorCode.ROLE_ASSUMPTION_FAILED,
                "Role assumption for '" + roleId + "' " + what, cause);
    }

    private record ExchangeKey(String owner, String roleId) {
    }

    private record ExchangeOutcome(ScopedCredentials credentials, String failureReason) {

        static ExchangeOutcome success(ScopedCredentials credentials) {
            return new ExchangeOutcome(credentials, null);
        }

        static ExchangeOutcome failure(String reason) {
            return new ExchangeOutcome(null, reason);
        }

        boolean failed() {
            return credentials == null;
        }
    }

    private final class OutcomeExpiry implements Expiry<ExchangeKey, ExchangeOutcome> {

        @Override
        public long expireAfterCreate(ExchangeKey key, ExchangeOutcome outcome, long currentTime) {
            Duration ttl = outcome.failed() ? settings.negativeTtl() : timeToLive(outcome.credentials());
            return ttl.toNanos();
        }

        @Override
        public long expireAfterUpdate(ExchangeKey key, ExchangeOutcome outcome, long currentTime,
                                      long currentDuration) {
            return expireAfterCreate(key, outcome, currentTime);
        }

        @Override
        public long expireAfterRead(ExchangeKey key, ExchangeOutcome outcome, long currentTime,
                                    long currentDuration) {
            return currentDuration;
        }
    }

    private static final class ExchangeThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "bastion-exchange-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
