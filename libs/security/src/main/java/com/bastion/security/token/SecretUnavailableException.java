package com.bastion.security.token;

/**
 * The signing secret could not be obtained from its source and no cached value is usable.
 * <p>
 * A server-side failure, distinct from any token problem: it surfaces as a 500, not a 401.
 */
public class SecretUnavailableException extends RuntimeException {

    public SecretUnavailableException(String message) {
        super(message);
    }

    public SecretUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
