package tech.webextools.sdk.exception;

import java.net.URI;

/**
 * Exception thrown when a request keeps failing with a transient status
 * (429 or 407) after the whole retry budget has been spent.
 */
public class RetryExhaustedException extends WebexApiException {

    private final URI uri;
    private final int attempts;

    public RetryExhaustedException(URI uri, int statusCode, int attempts) {
        super("Giving up on " + uri + " after " + attempts + " attempts (last status " + statusCode + ")",
            statusCode);
        this.uri = uri;
        this.attempts = attempts;
    }

    public URI getUri() {
        return uri;
    }

    public int getAttempts() {
        return attempts;
    }
}
