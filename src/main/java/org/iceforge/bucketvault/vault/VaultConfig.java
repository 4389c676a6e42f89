package org.iceforge.bucketvault.vault;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Vault client and the AWS credentials it reads, both resolved once at startup.
 * Any failure here aborts context startup.
 */
@Configuration
public class VaultConfig {
    private static final Logger logger = LoggerFactory.getLogger(VaultConfig.class);

    @Bean
    public SecretStoreClient secretStoreClient(WebClient.Builder webClientBuilder, VaultProperties props) {
        logger.info("Vault address={} mount={} path={} token={}",
                props.getAddress(), props.getMount(), props.getPath(),
                props.getToken() == null || props.getToken().isBlank() ? "NOT SET" : "set");
        try {
            return new VaultSecretStoreClient(webClientBuilder, props);
        } catch (SecretStoreException e) {
            logger.error("FATAL: Failed to initialize Vault client ({}): {}", e.failure(), e.getMessage());
            throw e;
        }
    }

    @Bean
    public AwsCredentials awsCredentials(SecretStoreClient secretStoreClient) {
        try {
            return secretStoreClient.getAwsCredentials();
        } catch (SecretStoreException e) {
            logger.error("FATAL: Failed to load AWS credentials from Vault ({}): {}", e.failure(), e.getMessage());
            throw e;
        }
    }
}
