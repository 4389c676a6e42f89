package org.iceforge.bucketvault.vault;

/**
 * Reads the AWS credential bundle from a secrets backend.
 * <p>
 * Implementations hold an authenticated session and nothing else: every call
 * goes to the backend, once, with no caching and no retry.
 */
public interface SecretStoreClient {

    /**
     * @return true if the backend still accepts our token, false if it rejects it
     * @throws SecretStoreException for any other backend failure
     */
    boolean isAuthenticated();

    /**
     * @throws SecretStoreException classified by {@link SecretStoreException.Failure}
     */
    AwsCredentials getAwsCredentials();
}
