package com.bastion.security;

/**
 * Failure taxonomy for authentication, authorization and role assumption.
 * <p>
 * Each code carries the HTTP status it surfaces as and a remediation hint that is safe to return
 * to the caller. Validation failures are 401, authorization denials 403, and upstream trust
 * provider failures 502 so that callers can tell "who are you" apart from "the dependency is down".
 */
public enum AuthErrorCode {

    TOKEN_REQUIRED("token_required", 401,
            "Send an 'Authorization: Bearer <token>' header issued by the identity provider."),
    MALFORMED_TOKEN("malformed_token", 401,
            "Obtain a fresh token from the identity provider; the supplied one could not be parsed."),
    SIGNATURE_INVALID("signature_invalid", 401,
            "The token was not signed with the expected key. Re-authenticate to obtain a new token."),
    EXPIRED("token_expired", 401,
            "The token has expired. Re-authenticate to obtain a new token."),
    MISSING_REQUIRED_CLAIM("missing_required_claim", 401,
            "The token is missing a mandatory claim (sub, exp). Re-issue it with the required claims."),
    DECOMPRESSION_ERROR("decompression_error", 401,
            "The token's compact claims could not be expanded. Re-issue the token with a valid encoding."),
    SESSION_EXPIRED("session_expired", 401,
            "The session has expired. Send the bearer token again to start a new session."),
    UNAUTHORIZED("unauthorized", 403,
            "Request access to the named permission or bucket from an administrator."),
    ROLE_ASSUMPTION_FAILED("role_assumption_failed", 502,
            "The trust provider could not issue credentials for the requested role. Retry shortly or check the role's trust policy.");

    private final String value;
    private final int httpStatus;
    private final String remediation;

    AuthErrorCode(String value, int httpStatus, String remediation) {
        this.value = value;
        this.httpStatus = httpStatus;
        this.remediation = remediation;
    }

    /** The wire value used in error bodies (e.g. "token_expired"). */
    public String value() {
        return value;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String remediation() {
        return remediation;
    }

    /** True for codes that mean "no trustworthy identity could be established". */
    public boolean isAuthenticationFailure() {
        return httpStatus == 401;
    }
}
