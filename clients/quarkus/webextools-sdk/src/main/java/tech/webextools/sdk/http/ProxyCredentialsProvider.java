package tech.webextools.sdk.http;

/**
 * Supplies proxy credentials when a request is answered with 407 Proxy Authentication Required.
 *
 * <p>Interactive implementations live with the caller; the session only asks.
 */
@FunctionalInterface
public interface ProxyCredentialsProvider {

    ProxyCredentials credentialsFor(String proxyChallenge);
}
