package tech.webextools.sdk.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import tech.webextools.sdk.exception.WebexApiException;

import java.net.URI;
import java.net.http.HttpHeaders;
import java.net.http.HttpResponse;
import java.util.Optional;

/**
 * One fully-read HTTP response of a paginated call.
 *
 * @param statusCode HTTP status
 * @param uri URL that produced this response
 * @param headers response headers
 * @param body response body, empty string when there was none
 */
public record ApiResponse(int statusCode, URI uri, HttpHeaders headers, String body) {

    public ApiResponse {
        body = body != null ? body : "";
    }

    public static ApiResponse of(HttpResponse<String> response) {
        return new ApiResponse(response.statusCode(), response.uri(), response.headers(), response.body());
    }

    public boolean hasBody() {
        return !body.isBlank();
    }

    public Optional<String> header(String name) {
        return headers.firstValue(name);
    }

    /**
     * URL advertised as {@code rel="next"} in the Link header, if any.
     */
    public Optional<String> nextLink() {
        return LinkHeader.next(headers);
    }

    /**
     * Parse the body as JSON. An empty body yields a {@link MissingNode}.
     */
    public JsonNode json(ObjectMapper objectMapper) {
        if (!hasBody()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (Exception e) {
            throw new WebexApiException("Failed to parse response from " + uri, e);
        }
    }
}
