package com.bastion.security.context;

/**
 * How the identity of the current request was established.
 */
public enum AuthScheme {

    /** No identity; protected operations are denied. */
    NONE,

    /** A validated bearer token (fresh or from the session cache). */
    TOKEN,

    /** A validated token plus credentials obtained by role assumption. */
    ASSUMED_ROLE,

    /** The statically configured identity used in optional mode when no token is sent. */
    AMBIENT;

    public boolean isAuthenticated() {
        return this != NONE;
    }
}
