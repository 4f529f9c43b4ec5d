package tech.webextools.sdk.http;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Username and password for an authenticating HTTP proxy.
 */
public record ProxyCredentials(String username, String password) {

    /**
     * Value for the {@code Proxy-Authorization} header using the Basic scheme.
     */
    public String basicAuthorization() {
        String raw = username + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "ProxyCredentials[username=" + username + ", password=***]";
    }
}
