package org.iceforge.bucketvault.api;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class BucketApiException extends ErrorResponseException {

    public BucketApiException(HttpStatus status, String title, String detail, Throwable cause) {
        super(status, createProblem(status, title, detail), cause);
    }

    public static BucketApiException invalidBucketName() {
        return new BucketApiException(HttpStatus.BAD_REQUEST, "Invalid request",
                "bucket_name must be provided", null);
    }

    public static BucketApiException creationFailed(String bucketName) {
        return new BucketApiException(HttpStatus.INTERNAL_SERVER_ERROR, "Bucket creation failed",
                "Failed to create bucket '" + bucketName + "'. Check logs for details.", null);
    }

    public static BucketApiException busy(String bucketName) {
        return new BucketApiException(HttpStatus.CONFLICT, "Bucket busy",
                "Another operation on bucket '" + bucketName + "' is in progress.", null);
    }

    private static ProblemDetail createProblem(HttpStatus status, String title, String detail) {
        var problem = ProblemDetail.forStatus(status);
        problem.setTitle(title);
        problem.setDetail(detail);
        return problem;
    }
}
