package com.bastion.security.claims;

/**
 * How the codec resolves a logical claim that is present in both its expanded form
 * ({@code permissions}) and its abbreviated form ({@code p}).
 */
public enum ClaimPrecedence {

    /** The expanded form is used; the abbreviated form is ignored. */
    EXPANDED_WINS,

    /**
     * Both forms are decoded and must describe the same logical value; a mismatch fails the
     * token as malformed.
     */
    REJECT_CONFLICT
}
