package org.iceforge.bucketvault.vault;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Where the AWS credential bundle lives in Vault.
 * <p>
 * The secret is read from the KV v2 engine at {@code <mount>/data/<path>}.
 */
@ConfigurationProperties(prefix = "bucketvault.vault")
public class VaultProperties {

    /** Vault base URL. */
    private String address = "http://127.0.0.1:8200";

    /** Service token sent as X-Vault-Token. Required. */
    private String token;

    /** KV v2 mount point. */
    private String mount = "secrets";

    /** Secret path under the mount. */
    private String path = "aws/credentials";

    /** Upper bound for a single Vault call. */
    private Duration timeout = Duration.ofSeconds(10);

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public String getMount() {
        return mount;
    }

    public void setMount(String mount) {
        this.mount = mount;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }
}
