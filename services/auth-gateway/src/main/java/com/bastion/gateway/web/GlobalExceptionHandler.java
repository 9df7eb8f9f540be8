package com.bastion.gateway.web;

import com.bastion.observability.LogContextKeys;
import com.bastion.security.AuthException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Maps exceptions raised by controllers to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://bastion.dev/errors/unauthorized",
 *   "title": "Forbidden",
 *   "status": 403,
 *   "detail": "bucket 'finance' is not authorized",
 *   "error": "unauthorized",
 *   "remediation": "Request access to the named permission or bucket from an administrator.",
 *   "timestamp": "2026-03-01T12:00:00Z",
 *   "requestId": "abc-123"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<ProblemDetail> handleAuth(AuthException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.httpStatus());
        if (ex.code().isAuthenticationFailure()) {
            log.info("Authentication failed: {}", ex.code().value());
        } else {
            log.warn("Request refused ({}): {}", ex.code().value(), ex.getMessage());
        }
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problem.setTitle(ProblemTypes.title(ex.code()));
        problem.setType(ProblemTypes.of(ex.code()));
        problem.setProperty("error", ex.code().value());
        problem.setProperty("remediation", ex.remediation());
        enrich(problem);
        return ResponseEntity.status(status).body(problem);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Bad Request");
        problem.setType(ProblemTypes.of("bad-request"));
        enrich(problem);
        return problem;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setTitle("Validation Error");
        problem.setType(ProblemTypes.of("validation"));
        enrich(problem);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(ProblemTypes.of("internal"));
        enrich(problem);
        return problem;
    }

    private void enrich(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        String requestId = MDC.get(LogContextKeys.REQUEST_ID);
        if (requestId != null) {
            problem.setProperty("requestId", requestId);
        }
    }
}
