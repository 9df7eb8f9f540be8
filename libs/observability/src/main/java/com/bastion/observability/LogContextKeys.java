package com.bastion.observability;

/**
 * SLF4J MDC keys shared by every Bastion module. Whatever sets them also removes them.
 */
public final class LogContextKeys {

    public static final String REQUEST_ID = "requestId";
    public static final String SESSION_ID = "sessionId";
    public static final String SUBJECT_ID = "subjectId";
    public static final String AUTH_SCHEME = "authScheme";

    private LogContextKeys() {
        // utility class
    }
}
