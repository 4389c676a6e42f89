package org.iceforge.bucketvault.api;

import jakarta.servlet.http.HttpServletRequest;
import org.iceforge.bucketvault.aws.s3.BucketDeletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Maps domain failures to problem-detail responses. Every body carries {@code detail}.
 */
@ControllerAdvice
public class ApiExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(BucketDeletionException.class)
    public ResponseEntity<ProblemDetail> handleBucketDeletion(BucketDeletionException ex, HttpServletRequest request) {
        HttpStatus status = switch (ex.kind()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case CONFLICT -> HttpStatus.CONFLICT;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        log.warn("Bucket deletion failed: path={}, kind={}, phase={}, providerCode={}",
                request.getRequestURI(), ex.kind(), ex.failedIn(), ex.providerCode());

        var problem = ProblemDetail.forStatus(status);
        problem.setTitle("Bucket deletion failed");
        problem.setDetail(ex.getMessage());
        if (ex.providerCode() != null) problem.setProperty("providerCode", ex.providerCode());
        return ResponseEntity.status(status).body(problem);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error: path={}, method={}", request.getRequestURI(), request.getMethod(), ex);
        var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
        problem.setTitle("Internal error");
        problem.setDetail("An unexpected error occurred: " + ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }
}
