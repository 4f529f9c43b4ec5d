package tech.webextools.sdk.http;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import tech.webextools.sdk.exception.AuthenticationException;
import tech.webextools.sdk.exception.WebexApiException;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Sealed classification of one HTTP exchange, consumed by the session's retry loop.
 *
 * <ul>
 *   <li>{@link Ok} - 2xx, hand the response to the caller</li>
 *   <li>{@link RateLimited} - 429, wait and repeat the same request</li>
 *   <li>{@link ProxyAuthRequired} - 407, obtain proxy credentials and repeat</li>
 *   <li>{@link Fatal} - anything else, propagate to the caller</li>
 * </ul>
 */
public sealed interface ResponseOutcome permits
    ResponseOutcome.Ok,
    ResponseOutcome.RateLimited,
    ResponseOutcome.ProxyAuthRequired,
    ResponseOutcome.Fatal {

    /**
     * Whether the retry loop may repeat the request.
     */
    boolean isRetryable();

    record Ok(ApiResponse response) implements ResponseOutcome {
        @Override
        public boolean isRetryable() {
            return false;
        }
    }

    /**
     * @param url URL that was throttled
     * @param retryAfter how long to wait before retrying
     */
    record RateLimited(URI url, Duration retryAfter) implements ResponseOutcome {
        @Override
        public boolean isRetryable() {
            return true;
        }
    }

    /**
     * @param url URL the proxy refused to forward
     * @param challenge value of the Proxy-Authenticate header, empty when absent
     */
    record ProxyAuthRequired(URI url, String challenge) implements ResponseOutcome {
        @Override
        public boolean isRetryable() {
            return true;
        }
    }

    record Fatal(WebexApiException error) implements ResponseOutcome {
        @Override
        public boolean isRetryable() {
            return false;
        }
    }

    /**
     * Classify a response.
     *
     * @param response the response to classify
     * @param defaultRetryAfter wait to use when a 429 carries no usable Retry-After header
     * @param objectMapper used to decode error bodies
     */
    static ResponseOutcome classify(ApiResponse response, Duration defaultRetryAfter, ObjectMapper objectMapper) {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return new Ok(response);
        }
        if (status == 429) {
            return new RateLimited(response.uri(), retryAfter(response, defaultRetryAfter));
        }
        if (status == 407) {
            return new ProxyAuthRequired(response.uri(), response.header("Proxy-Authenticate").orElse(""));
        }

        Map<String, Object> context = errorContext(response, objectMapper);
        if (status == 401) {
            return new Fatal(AuthenticationException.tokenRejected(context));
        }
        String reason = context.get("message") instanceof String s && !s.isBlank()
            ? s
            : "HTTP " + status + " for " + response.uri();
        return new Fatal(new WebexApiException(reason, status, null, context));
    }

    private static Duration retryAfter(ApiResponse response, Duration defaultRetryAfter) {
        return response.header("Retry-After")
            .map(String::trim)
            .map(value -> {
                try {
                    long seconds = Long.parseLong(value);
                    return seconds >= 0 ? Duration.ofSeconds(seconds) : defaultRetryAfter;
                } catch (NumberFormatException e) {
                    // HTTP-date form is not used by Webex
                    return defaultRetryAfter;
                }
            })
            .orElse(defaultRetryAfter);
    }

    private static Map<String, Object> errorContext(ApiResponse response, ObjectMapper objectMapper) {
        if (!response.hasBody()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(response.body(), new TypeReference<Map<String, Object>>() {});
        } catch (Exception e) {
            return Map.of("body", response.body());
        }
    }
}
