package tech.webextools.cli.console;

import tech.webextools.sdk.exception.WebexApiException;

import java.util.Map;

/**
 * Renders SDK failures for the terminal, e.g. {@code Error: 404 (Not Found) - Person not found}.
 */
public final class ErrorFormatter {

    private static final Map<Integer, String> REASONS = Map.ofEntries(
        Map.entry(400, "Bad Request"),
        Map.entry(401, "Unauthorized"),
        Map.entry(403, "Forbidden"),
        Map.entry(404, "Not Found"),
        Map.entry(405, "Method Not Allowed"),
        Map.entry(407, "Proxy Authentication Required"),
        Map.entry(409, "Conflict"),
        Map.entry(410, "Gone"),
        Map.entry(415, "Unsupported Media Type"),
        Map.entry(423, "Locked"),
        Map.entry(428, "Precondition Required"),
        Map.entry(429, "Too Many Requests"),
        Map.entry(500, "Internal Server Error"),
        Map.entry(502, "Bad Gateway"),
        Map.entry(503, "Service Unavailable"),
        Map.entry(504, "Gateway Timeout")
    );

    private ErrorFormatter() {
    }

    /**
     * @param error the failure
     * @param debug append the Webex tracking id when there is one
     */
    public static String format(WebexApiException error, boolean debug) {
        StringBuilder text = new StringBuilder("Error: ");
        int status = error.getStatusCode();
        if (status > 0) {
            text.append(status).append(" (").append(REASONS.getOrDefault(status, "HTTP " + status)).append(')');
            String message = error.getRemoteMessage().orElse(error.getMessage());
            if (message != null && !message.isBlank()) {
                text.append(" - ").append(message);
            }
        } else {
            text.append(error.getMessage());
        }
        if (debug) {
            error.getTrackingId().ifPresent(id -> text.append(System.lineSeparator()).append("Tracking ID: ").append(id));
        }
        return text.toString();
    }
}
