package com.bastion.gateway.web;

import com.bastion.security.AuthErrorCode;

import java.net.URI;

/**
 * Problem {@code type} URIs and titles shared by the filter and the exception handler.
 */
final class ProblemTypes {

    static final String BASE = "https://bastion.dev/errors/";

    private ProblemTypes() {
        // utility class
    }

    static URI of(AuthErrorCode code) {
        return URI.create(BASE + code.value().replace('_', '-'));
    }

    static URI of(String slug) {
        return URI.create(BASE + slug);
    }

    static String title(AuthErrorCode code) {
        return switch (code.httpStatus()) {
            case 401 -> "Unauthorized";
            case 403 -> "Forbidden";
            case 502 -> "Bad Gateway";
            default -> "Error";
        };
    }
}
