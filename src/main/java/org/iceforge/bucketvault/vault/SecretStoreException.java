package org.iceforge.bucketvault.vault;

import java.util.Objects;

public class SecretStoreException extends RuntimeException {

    public enum Failure {
        CONFIGURATION,
        AUTHENTICATION,
        INCOMPLETE_CREDENTIALS,
        PERMISSION_DENIED,
        CONNECTION_REFUSED,
        UNAUTHORIZED,
        PATH_NOT_FOUND,
        BACKEND_ERROR
    }

    private final Failure failure;
    private final String remediation;

    public SecretStoreException(Failure failure, String message, String remediation, Throwable cause) {
        super(message, cause);
        this.failure = Objects.requireNonNull(failure);
        this.remediation = remediation;
    }

    public SecretStoreException(Failure failure, String message, String remediation) {
        this(failure, message, remediation, null);
    }

    public Failure failure() { return failure; }

    /** Human-readable hint on what to fix. May be null. */
    public String remediation() { return remediation; }

    @Override
    public String getMessage() {
        String base = super.getMessage();
        return remediation == null ? base : base + ". " + remediation;
    }
}
