package tech.webextools.sdk.exception;

import java.net.URI;

/**
 * Exception thrown when a proxy demands credentials and the session has no way to obtain them.
 */
public class ProxyAuthenticationException extends WebexApiException {

    public ProxyAuthenticationException(URI uri) {
        super("Proxy authentication required for " + uri + " and no credentials provider is configured", 407);
    }
}
