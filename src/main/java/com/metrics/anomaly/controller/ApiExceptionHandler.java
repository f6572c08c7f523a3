package com.metrics.anomaly.controller;

import com.metrics.anomaly.exception.InvalidRuleException;
import com.metrics.anomaly.exception.InvalidSampleException;
import com.metrics.anomaly.exception.UnknownRuleException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.OffsetDateTime;

/**
 * Maps domain exceptions to RFC 7807 problem responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidSampleException.class)
    public ResponseEntity<ProblemDetail> handleInvalidSample(InvalidSampleException ex, HttpServletRequest request) {
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "Invalid sample", "ingest.invalid-sample", ex, request);
        if (ex.getMetricName() != null) {
            problem.setProperty("metricName", ex.getMetricName());
        }
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(InvalidRuleException.class)
    public ResponseEntity<ProblemDetail> handleInvalidRule(InvalidRuleException ex, HttpServletRequest request) {
        return ResponseEntity.badRequest()
                .body(problem(HttpStatus.BAD_REQUEST, "Invalid rule", "rule.invalid", ex, request));
    }

    @ExceptionHandler(UnknownRuleException.class)
    public ResponseEntity<ProblemDetail> handleUnknownRule(UnknownRuleException ex, HttpServletRequest request) {
        ProblemDetail problem = problem(HttpStatus.NOT_FOUND, "Unknown rule", "rule.unknown", ex, request);
        problem.setProperty("ruleId", ex.getRuleId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problem);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleBadRequest(IllegalArgumentException ex, HttpServletRequest request) {
        return ResponseEntity.badRequest()
                .body(problem(HttpStatus.BAD_REQUEST, "Invalid request", "request.invalid", ex, request));
    }

    private static ProblemDetail problem(HttpStatus status, String title, String code,
                                         RuntimeException ex, HttpServletRequest request) {
        String detail = (ex.getMessage() == null || ex.getMessage().isBlank())
                ? "Request could not be processed"
                : ex.getMessage();
        log.warn("{}: {} (path={})", title, detail, request.getRequestURI());

        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setProperty("code", code);
        problem.setProperty("timestamp", OffsetDateTime.now());
        problem.setProperty("path", request.getRequestURI());
        return problem;
    }
}
