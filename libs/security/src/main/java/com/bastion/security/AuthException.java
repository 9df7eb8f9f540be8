package com.bastion.security;

import java.util.Objects;

/**
 * Thrown when a request cannot be authenticated, is not authorized, or its role assumption fails.
 * <p>
 * A RuntimeException like the rest of the platform's security failures: callers at the edge
 * (servlet filter, exception handler) map the {@link #code()} to a response, everything in
 * between lets it propagate. Messages never contain raw tokens or secret material.
 */
public class AuthException extends RuntimeException {

    private final AuthErrorCode code;

    public AuthException(AuthErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public AuthException(AuthErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public AuthErrorCode code() {
        return code;
    }

    public int httpStatus() {
        return code.httpStatus();
    }

    public String remediation() {
        return code.remediation();
    }

    public static AuthException malformed(String message) {
        return new AuthException(AuthErrorCode.MALFORMED_TOKEN, message);
    }

    public static AuthException decompression(String message) {
        return new AuthException(AuthErrorCode.DECOMPRESSION_ERROR, message);
    }

    public static AuthException unauthorized(String message) {
        return new AuthException(AuthErrorCode.UNAUTHORIZED, message);
    }
}
