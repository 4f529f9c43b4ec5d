package tech.webextools.sdk.http;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Per-call request settings.
 *
 * <p>Query parameters apply to the first request of a call only: next-page links returned by
 * the server already carry their own query string and are followed verbatim.
 *
 * @param query query parameters in insertion order
 * @param body object serialized as the JSON request body, or {@code null}
 * @param headers headers added to every request of the call
 */
public record RequestOptions(Map<String, String> query, Object body, Map<String, String> headers) {

    private static final RequestOptions NONE = new RequestOptions(Map.of(), null, Map.of());

    public RequestOptions {
        query = Collections.unmodifiableMap(new LinkedHashMap<>(query));
        headers = Map.copyOf(headers);
    }

    public static RequestOptions none() {
        return NONE;
    }

    public static RequestOptions json(Object body) {
        return builder().json(body).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Encoded query string without the leading {@code ?}, empty when there are no parameters.
     */
    public String queryString() {
        return query.entrySet().stream()
            .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
            .collect(Collectors.joining("&"));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    public static final class Builder {
        private final Map<String, String> query = new LinkedHashMap<>();
        private final Map<String, String> headers = new LinkedHashMap<>();
        private Object body;

        private Builder() {
        }

        public Builder query(String name, Object value) {
            if (value != null) {
                query.put(name, String.valueOf(value));
            }
            return this;
        }

        public Builder json(Object body) {
            this.body = body;
            return this;
        }

        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public RequestOptions build() {
            return new RequestOptions(query, body, headers);
        }
    }
}
