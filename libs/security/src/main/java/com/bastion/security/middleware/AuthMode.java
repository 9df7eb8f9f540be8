package com.bastion.security.middleware;

/**
 * Whether a valid token is mandatory.
 */
public enum AuthMode {

    /** Every request must carry a valid token or belong to a live session. */
    STRICT,

    /**
     * Requests without a token run as the configured ambient identity; requests with an
     * invalid token run unauthenticated.
     */
    OPTIONAL
}
