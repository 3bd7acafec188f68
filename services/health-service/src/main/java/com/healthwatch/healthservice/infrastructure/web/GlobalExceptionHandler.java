package com.healthwatch.healthservice.infrastructure.web;

import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 ProblemDetail responses.
 *
 * <p>Health report endpoints never get here; the monitor serves its own fallback payloads.
 * This covers the metrics update endpoint and unexpected framework errors:
 *
 * <pre>
 * {
 *   "type": "https://healthwatch.io/errors/bad-request",
 *   "title": "Bad Request",
 *   "status": 400,
 *   "detail": "errorRate must be within [0, 1]",
 *   "timestamp": "2026-01-15T10:30:00Z"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "Bad Request", "bad-request");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Request body must be a JSON object", "Bad Request", "bad-request");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred",
                "Internal Server Error", "internal");
    }

    private static ProblemDetail problem(HttpStatus status, String detail, String title, String type) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create("https://healthwatch.io/errors/" + type));
        problem.setProperty("timestamp", Instant.now().toString());
        return problem;
    }
}
