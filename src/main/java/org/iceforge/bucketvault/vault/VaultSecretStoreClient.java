package org.iceforge.bucketvault.vault;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.iceforge.bucketvault.vault.SecretStoreException.Failure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.netty.http.client.HttpClient;

import java.net.ConnectException;
import java.time.Duration;
import java.util.Objects;

/**
 * Vault KV v2 client over the HTTP API.
 * <p>
 * The token is checked once at construction; a rejected token fails fast so the
 * application never starts without working credentials.
 */
public class VaultSecretStoreClient implements SecretStoreClient {
    private static final Logger logger = LoggerFactory.getLogger(VaultSecretStoreClient.class);

    static final String TOKEN_HEADER = "X-Vault-Token";
    static final String LOOKUP_SELF_URI = "/v1/auth/token/lookup-self";

    private final WebClient webClient;
    private final String address;
    private final String secretPath;
    private final Duration timeout;

    public VaultSecretStoreClient(WebClient.Builder builder, VaultProperties props) {
        Objects.requireNonNull(builder);
        Objects.requireNonNull(props);
        if (props.getToken() == null || props.getToken().isBlank()) {
            logger.error("Vault token is not set. Cannot initialize Vault client.");
            throw new SecretStoreException(Failure.CONFIGURATION,
                    "Vault token must be provided",
                    "Set VAULT_SERVICE_TOKEN (bucketvault.vault.token)");
        }

        this.address = props.getAddress();
        this.secretPath = props.getMount() + "/data/" + props.getPath();
        this.timeout = props.getTimeout() == null ? Duration.ofSeconds(10) : props.getTimeout();

        HttpClient httpClient = HttpClient.create().responseTimeout(timeout);
        this.webClient = builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .baseUrl(address)
                .defaultHeader(TOKEN_HEADER, props.getToken())
                .build();

        if (!isAuthenticated()) {
            logger.error("Failed to authenticate to Vault at {}. Check VAULT_SERVICE_TOKEN validity/expiration.", address);
            throw new SecretStoreException(Failure.AUTHENTICATION,
                    "Failed to authenticate to Vault with service token",
                    "The token may be invalid or expired");
        }
        logger.info("Authenticated to Vault at {}", address);
    }

    @Override
    public boolean isAuthenticated() {
        try {
            webClient.get()
                    .uri(LOOKUP_SELF_URI)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(timeout)
                    .block();
            return true;
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == 401 || status == 403) {
                logger.warn("Vault rejected the service token (HTTP {})", status);
                return false;
            }
            throw new SecretStoreException(Failure.BACKEND_ERROR,
                    "Vault token lookup at " + LOOKUP_SELF_URI + " failed: HTTP " + status,
                    "Check VAULT_ADDR points at the Vault API (" + address + ")", e);
        } catch (RuntimeException e) {
            throw translate(e);
        }
    }

    @Override
    public AwsCredentials getAwsCredentials() {
        logger.info("Attempting to retrieve AWS credentials from Vault path: {}", secretPath);

        JsonNode root;
        try {
            root = webClient.get()
                    .uri("/v1/" + secretPath)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            SecretStoreException translated = translate(e);
            logger.error("Vault error during credential retrieval from {}: {}", secretPath, translated.failure(), e);
            throw translated;
        }

        JsonNode data = root == null ? MissingNode.getInstance() : root.path("data").path("data");
        if (!data.isObject()) {
            logger.error("No data found at Vault path {} or secret structure is unexpected", secretPath);
            throw new SecretStoreException(Failure.INCOMPLETE_CREDENTIALS,
                    "Failed to retrieve data from Vault path '" + secretPath + "'",
                    "Write access_key and secret_access_key to that path");
        }

        String accessKey = text(data, "access_key");
        String secretAccessKey = text(data, "secret_access_key");
        if (accessKey == null || secretAccessKey == null) {
            logger.error("AWS credentials obtained from Vault are incomplete (missing access_key or secret_access_key)");
            throw new SecretStoreException(Failure.INCOMPLETE_CREDENTIALS,
                    "Incomplete AWS credentials retrieved from Vault",
                    "Both access_key and secret_access_key must be set at '" + secretPath + "'");
        }

        String sessionToken = text(data, "security_token");
        if (sessionToken == null) sessionToken = text(data, "session_token");

        logger.info("Successfully retrieved AWS credentials from Vault path: {}", secretPath);
        return new AwsCredentials(accessKey, secretAccessKey, sessionToken);
    }

    SecretStoreException translate(Throwable e) {
        if (e instanceof WebClientResponseException wre) {
            int status = wre.getStatusCode().value();
            return switch (status) {
                case 401 -> new SecretStoreException(Failure.UNAUTHORIZED,
                        "Vault authentication failed",
                        "The token may be expired or invalid", e);
                case 403 -> new SecretStoreException(Failure.PERMISSION_DENIED,
                        "Vault denied access to '" + secretPath + "'",
                        "Check that the token has 'read' capability on '" + secretPath + "'", e);
                case 404 -> new SecretStoreException(Failure.PATH_NOT_FOUND,
                        "Vault path '" + secretPath + "' not found",
                        "Check the mount point and path", e);
                default -> new SecretStoreException(Failure.BACKEND_ERROR,
                        "Vault error: HTTP " + status, null, e);
            };
        }
        if (causedBy(e, ConnectException.class)) {
            return new SecretStoreException(Failure.CONNECTION_REFUSED,
                    "Vault connection refused",
                    "Is Vault running and accessible at " + address + "?", e);
        }
        return new SecretStoreException(Failure.BACKEND_ERROR, "Vault error: " + e.getMessage(), null, e);
    }

    private static boolean causedBy(Throwable e, Class<? extends Throwable> type) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (type.isInstance(t)) return true;
            if (t.getCause() == t) break;
        }
        return false;
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        String s = v.asText();
        return s.isEmpty() ? null : s;
    }
}
