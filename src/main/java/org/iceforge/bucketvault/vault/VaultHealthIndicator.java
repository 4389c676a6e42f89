package org.iceforge.bucketvault.vault;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Objects;

/** Reports whether the Vault token still authenticates. */
@Component("vault")
public class VaultHealthIndicator implements HealthIndicator {

    private final SecretStoreClient secretStoreClient;

    public VaultHealthIndicator(SecretStoreClient secretStoreClient) {
        this.secretStoreClient = Objects.requireNonNull(secretStoreClient);
    }

    @Override
    public Health health() {
        try {
            if (secretStoreClient.isAuthenticated()) {
                return Health.up().build();
            }
            return Health.down().withDetail("failure", SecretStoreException.Failure.AUTHENTICATION.name()).build();
        } catch (SecretStoreException e) {
            // failure code only; messages carry the Vault address
            return Health.down().withDetail("failure", e.failure().name()).build();
        }
    }
}
