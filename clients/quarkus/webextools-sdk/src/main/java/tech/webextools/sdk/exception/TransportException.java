package tech.webextools.sdk.exception;

import java.net.URI;

/**
 * Exception thrown when a request never produced an HTTP response:
 * DNS failure, refused or reset connection, timeout, or interruption.
 */
public class TransportException extends WebexApiException {

    private final URI uri;

    public TransportException(URI uri, Throwable cause) {
        super("An error occurred while requesting URL: " + uri + ", error: " + describe(cause), cause);
        this.uri = uri;
    }

    public URI getUri() {
        return uri;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
