package com.bastion.security.token;

import java.util.Optional;

/**
 * Source of the HMAC secret used to verify token signatures.
 * <p>
 * Implementations must be thread-safe. A provider that supports rotation exposes the value it
 * replaced through {@link #previous()} so that tokens signed just before a rotation still verify.
 */
public interface SecretProvider {

    /**
     * Returns the secret to verify with, fetching or refreshing it as the implementation sees fit.
     *
     * @throws SecretUnavailableException if no usable secret can be obtained
     */
    SigningSecret current();

    /** The secret that was current before the last rotation, if any. */
    default Optional<SigningSecret> previous() {
        return Optional.empty();
    }

    /**
     * Re-reads the secret from its source, bypassing any cache. Called after a signature failure.
     *
     * @return the (possibly unchanged) current secret
     */
    default SigningSecret refresh() {
        return current();
    }
}
