package tech.webextools.sdk.http;

/**
 * Diagnostic switches handed to the session and the resource clients.
 *
 * <p>{@code verbose} logs request lines, response status and retry notices.
 * {@code debug} additionally logs request and response headers, with credentials redacted.
 *
 * @param verbose log one line per request and retry
 * @param debug log headers as well
 */
public record LoggingOptions(boolean verbose, boolean debug) {

    public static LoggingOptions quiet() {
        return new LoggingOptions(false, false);
    }

    /**
     * Map a repeated {@code -v} flag count: 1 enables verbose, 2 or more also enables debug.
     */
    public static LoggingOptions fromVerbosity(int count) {
        return new LoggingOptions(count >= 1, count >= 2);
    }
}
