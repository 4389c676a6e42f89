package org.iceforge.bucketvault.aws.s3;

import java.util.Objects;

public class BucketDeletionException extends RuntimeException {

    public enum Kind { NOT_FOUND, FORBIDDEN, CONFLICT, INTERNAL }

    /** Progress of a single delete request. */
    public enum Phase { REQUESTED, EMPTYING, EMPTIED, DELETING, DELETED }

    private final Kind kind;
    private final Phase failedIn;
    private final String providerCode;

    public BucketDeletionException(Kind kind, Phase failedIn, String providerCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind);
        this.failedIn = Objects.requireNonNull(failedIn);
        this.providerCode = providerCode;
    }

    public Kind kind() { return kind; }

    public Phase failedIn() { return failedIn; }

    /** S3 error code, null for non-provider failures. */
    public String providerCode() { return providerCode; }
}
