package com.bastion.security.context;

import com.bastion.observability.LogContextKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.concurrent.Callable;

/**
 * Thread-local holder for the {@link RuntimeAuthState} of the request running on this thread,
 * with an SLF4J MDC bridge ({@code authScheme}, {@code subjectId}, {@code sessionId}).
 * <p>
 * States nest: {@link #push(RuntimeAuthState)} returns a scope whose {@code close()} restores
 * the state that was current before it. When the outermost scope closes the thread-local is
 * removed, so a pooled worker thread never carries a previous request's identity. Scopes closed
 * out of order are logged and unwound; a scope closed twice or from another thread is logged
 * and ignored.
 * <p>
 * Work handed to another thread does not inherit the state; use {@link #wrap(Runnable)} or
 * {@link #wrap(Callable)} to carry it explicitly.
 */
public final class AuthContextHolder {

    private static final Logger log = LoggerFactory.getLogger(AuthContextHolder.class);

    private static final ThreadLocal<AuthScope> TOP = new ThreadLocal<>();

    private AuthContextHolder() {
        // utility class
    }

    /**
     * Installs {@code state} as current for this thread until the returned scope is closed.
     */
    public static AuthScope push(RuntimeAuthState state) {
        if (state == null) {
            throw new IllegalArgumentException("state must not be null");
        }
        AuthScope scope = new AuthScope(state, TOP.get(), Thread.currentThread());
        TOP.set(scope);
        populateMdc(state);
        return scope;
    }

    /** The current state, or {@link RuntimeAuthState#none()} outside any scope. */
    public static RuntimeAuthState current() {
        AuthScope top = TOP.get();
        return top == null ? RuntimeAuthState.none() : top.state();
    }

    /** Number of scopes open on this thread. */
    public static int depth() {
        int depth = 0;
        for (AuthScope scope = TOP.get(); scope != null; scope = scope.previous()) {
            depth++;
        }
        return depth;
    }

    /**
     * Closes {@code scope}, restoring the state that was current before it was pushed.
     */
    public static void pop(AuthScope scope) {
        if (scope.owner() != Thread.currentThread()) {
            log.error("Auth scope opened on {} closed from {}; ignored",
                    scope.owner().getName(), Thread.currentThread().getName());
            return;
        }
        if (scope.isClosed()) {
            log.warn("Auth scope closed twice; ignored");
            return;
        }
        AuthScope top = TOP.get();
        if (top != scope) {
            if (!isOpen(scope)) {
                log.warn("Auth scope is not open on this thread; ignored");
                scope.markClosed();
                return;
            }
            log.warn("Auth scope closed out of order; unwinding nested scopes");
            for (AuthScope nested = top; nested != scope; nested = nested.previous()) {
                nested.markClosed();
            }
        }
        scope.markClosed();
        restore(scope.previous());
    }

    public static void runWith(RuntimeAuthState state, Runnable task) {
        try (AuthScope ignored = push(state)) {
            task.run();
        }
    }

    public static <T> T callWith(RuntimeAuthState state, Callable<T> task) throws Exception {
        try (AuthScope ignored = push(state)) {
            return task.call();
        }
    }

    /** A runnable that runs {@code task} with the state current at wrap time. */
    public static Runnable wrap(Runnable task) {
        RuntimeAuthState captured = current();
        return () -> runWith(captured, task);
    }

    /** A callable that runs {@code task} with the state current at wrap time. */
    public static <T> Callable<T> wrap(Callable<T> task) {
        RuntimeAuthState captured = current();
        return () -> callWith(captured, task);
    }

    private static boolean isOpen(AuthScope scope) {
        for (AuthScope open = TOP.get(); open != null; open = open.previous()) {
            if (open == scope) {
                return true;
            }
        }
        return false;
    }

    private static void restore(AuthScope previous) {
        if (previous == null) {
            TOP.remove();
            clearMdc();
        } else {
            TOP.set(previous);
            populateMdc(previous.state());
        }
    }

    private static void populateMdc(RuntimeAuthState state) {
        MDC.put(LogContextKeys.AUTH_SCHEME, state.scheme().name());
        setMdc(LogContextKeys.SUBJECT_ID, state.subjectId());
        setMdc(LogContextKeys.SESSION_ID, state.sessionId());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(LogContextKeys.AUTH_SCHEME);
        MDC.remove(LogContextKeys.SUBJECT_ID);
        MDC.remove(LogContextKeys.SESSION_ID);
    }
}
