package tech.webextools.sdk.exception;

import java.util.Map;
import java.util.Optional;

/**
 * Base exception for WebexTools SDK errors.
 *
 * <p>A status code of {@code 0} means no HTTP response was involved (validation,
 * transport or pagination failures). The context map holds the decoded error body
 * returned by Webex, when there was one.
 */
public class WebexApiException extends RuntimeException {

    private final int statusCode;
    private final Map<String, Object> context;

    public WebexApiException(String message) {
        this(message, 0, null, Map.of());
    }

    public WebexApiException(String message, int statusCode) {
        this(message, statusCode, null, Map.of());
    }

    public WebexApiException(String message, Throwable cause) {
        this(message, 0, cause, Map.of());
    }

    public WebexApiException(String message, int statusCode, Throwable cause, Map<String, Object> context) {
        super(message, cause);
        this.statusCode = statusCode;
        this.context = context != null ? context : Map.of();
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    /**
     * Webex tracking id of the failed call, useful when opening a support case.
     */
    public Optional<String> getTrackingId() {
        Object trackingId = context.get("trackingId");
        return trackingId instanceof String s && !s.isBlank() ? Optional.of(s) : Optional.empty();
    }

    /**
     * Error message reported by the remote API in the response body, if any.
     */
    public Optional<String> getRemoteMessage() {
        Object message = context.get("message");
        return message instanceof String s && !s.isBlank() ? Optional.of(s) : Optional.empty();
    }
}
