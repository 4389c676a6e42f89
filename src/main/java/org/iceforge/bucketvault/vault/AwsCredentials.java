package org.iceforge.bucketvault.vault;

import java.util.Objects;
import java.util.Optional;

/**
 * AWS key pair (plus optional STS session token) read from the secret store.
 */
public record AwsCredentials(String accessKey, String secretAccessKey, String sessionToken) {

    public AwsCredentials {
        Objects.requireNonNull(accessKey, "accessKey");
        Objects.requireNonNull(secretAccessKey, "secretAccessKey");
        if (sessionToken != null && sessionToken.isBlank()) sessionToken = null;
    }

    public AwsCredentials(String accessKey, String secretAccessKey) {
        this(accessKey, secretAccessKey, null);
    }

    public Optional<String> session() {
        return Optional.ofNullable(sessionToken);
    }

    @Override
    public String toString() {
        return "AwsCredentials[accessKey=" + mask(accessKey)
                + ", secretAccessKey=****"
                + ", sessionToken=" + (sessionToken == null ? "<none>" : "****") + "]";
    }

    private static String mask(String key) {
        return key.length() <= 4 ? "****" : key.substring(0, 4) + "****";
    }
}
