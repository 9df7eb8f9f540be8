package com.bastion.security.context;

/**
 * Handle returned by {@link AuthContextHolder#push(RuntimeAuthState)}. Closing it restores the
 * state that was current before the push. Use with try-with-resources.
 */
public final class AuthScope implements AutoCloseable {

    private final RuntimeAuthState state;
    private final AuthScope previous;
    private final Thread owner;
    private boolean closed;

    AuthScope(RuntimeAuthState state, AuthScope previous, Thread owner) {
        this.state = state;
        this.previous = previous;
        this.owner = owner;
    }

    public RuntimeAuthState state() {
        return state;
    }

    public boolean isClosed() {
        return closed;
    }

    AuthScope previous() {
        return previous;
    }

    Thread owner() {
        return owner;
    }

    void markClosed() {
        closed = true;
    }

    @Override
    public void close() {
        AuthContextHolder.pop(this);
    }
}
