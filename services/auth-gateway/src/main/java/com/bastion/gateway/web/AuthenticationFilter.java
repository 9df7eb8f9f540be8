package com.bastion.gateway.web;

import com.bastion.observability.LogContextKeys;
import com.bastion.security.AuthErrorCode;
import com.bastion.security.AuthException;
import com.bastion.security.context.AuthContextHolder;
import com.bastion.security.context.AuthScope;
import com.bastion.security.context.RuntimeAuthState;
import com.bastion.security.middleware.RequestAuthenticator;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Establishes the caller's identity for every request and installs it on the worker thread for
 * exactly the duration of the request.
 *
 * <p>The request id from {@code X-Request-ID} (or a fresh UUID) goes into the MDC and is echoed
 * on the response. Authentication failures are answered here, before the dispatcher, with the
 * same problem body {@link GlobalExceptionHandler} produces. The identity is popped in a
 * {@code finally} block: Tomcat reuses threads.
 */
public class AuthenticationFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    private static final Logger log = LoggerFactory.getLogger(AuthenticationFilter.class);

    private final RequestAuthenticator authenticator;
    private final ObjectMapper objectMapper;

    public AuthenticationFilter(RequestAuthenticator authenticator, ObjectMapper objectMapper) {
        this.authenticator = authenticator;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        MDC.put(LogContextKeys.REQUEST_ID, requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        try {
            RuntimeAuthState state;
            try {
                state = authenticator.authenticate(request::getHeader);
            } catch (AuthException e) {
                log.info("Authentication failed for {} {}: {}", request.getMethod(), request.getRequestURI(),
                        e.code().value());
                writeProblem(response, e, requestId);
                return;
            }
            try (AuthScope ignored = AuthContextHolder.push(state)) {
                filterChain.doFilter(request, response);
            }
        } finally {
            MDC.remove(LogContextKeys.REQUEST_ID);
        }
    }

    private void writeProblem(HttpServletResponse response, AuthException e, String requestId) throws IOException {
        int status = e.httpStatus();
        if (e.code() == AuthErrorCode.TOKEN_REQUIRED) {
            response.setHeader("WWW-Authenticate", "Bearer");
        } else if (status == HttpServletResponse.SC_UNAUTHORIZED) {
            response.setHeader("WWW-Authenticate", "Bearer error=\"invalid_token\"");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", ProblemTypes.of(e.code()).toString());
        body.put("title", ProblemTypes.title(e.code()));
        body.put("status", status);
        body.put("detail", e.getMessage());
        body.put("error", e.code().value());
        body.put("remediation", e.remediation());
        body.put("timestamp", Instant.now().toString());
        body.put("requestId", requestId);

        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
