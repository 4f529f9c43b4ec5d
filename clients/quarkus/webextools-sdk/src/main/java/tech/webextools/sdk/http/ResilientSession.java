package tech.webextools.sdk.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import tech.webextools.sdk.exception.ProxyAuthenticationException;
import tech.webextools.sdk.exception.RetryExhaustedException;
import tech.webextools.sdk.exception.TransportException;
import tech.webextools.sdk.exception.WebexApiException;

import java.io.IOException;
import java.net.HttpCookie;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * HTTP session that retries throttled requests and follows {@code Link} pagination.
 *
 * <p>{@link #request(String, String, RequestOptions)} returns a lazy {@link PageSequence}: nothing
 * is sent until the caller asks for the first page, and every further page is fetched only when
 * the caller advances the sequence.
 *
 * <p>Per page, the session applies this policy:
 * <ul>
 *   <li>429 - wait for Retry-After (or the configured default) and repeat the same request</li>
 *   <li>407 - ask the {@link ProxyCredentialsProvider}, install the credentials for the rest of
 *       the session and repeat</li>
 *   <li>both count against {@code maxRetries}; the counter resets after a successful page</li>
 *   <li>any other non-2xx status, and any transport failure, is thrown to the caller</li>
 * </ul>
 *
 * <p>Cookies set by the server and installed proxy credentials are session state. A session has
 * a single owner: it is not thread-safe and must not be shared by concurrently running sequences.
 */
public class ResilientSession {

    private static final Logger LOG = Logger.getLogger(ResilientSession.class);
    private static final Pattern ABSOLUTE_URL = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://.*");
    private static final Set<String> REDACTED_HEADERS = Set.of("authorization", "proxy-authorization", "cookie", "set-cookie");

    private final SessionOptions options;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ProxyCredentialsProvider proxyCredentialsProvider;
    private final Sleeper sleeper;

    private final Map<String, String> cookies = new LinkedHashMap<>();
    private String proxyAuthorization;

    public ResilientSession(SessionOptions options) {
        this(options, new ObjectMapper(), null, Sleeper.THREAD);
    }

    /**
     * @param options session settings
     * @param objectMapper JSON mapper for request bodies and error payloads
     * @param proxyCredentialsProvider asked on 407 responses; {@code null} makes 407 fatal
     * @param sleeper blocks during retry backoff
     */
    public ResilientSession(SessionOptions options, ObjectMapper objectMapper,
                            ProxyCredentialsProvider proxyCredentialsProvider, Sleeper sleeper) {
        this.options = options;
        this.objectMapper = objectMapper;
        this.proxyCredentialsProvider = proxyCredentialsProvider;
        this.sleeper = sleeper;
        this.cookies.putAll(options.cookies());

        HttpClient.Builder builder = HttpClient.newBuilder()
            .connectTimeout(options.timeout())
            .followRedirects(HttpClient.Redirect.NORMAL);
        options.proxy().ifPresent(proxy -> builder.proxy(ProxySelector.of(proxy)));
        this.httpClient = builder.build();
    }

    public PageSequence get(String url) {
        return request("GET", url, RequestOptions.none());
    }

    public PageSequence get(String url, RequestOptions requestOptions) {
        return request("GET", url, requestOptions);
    }

    public PageSequence post(String url, RequestOptions requestOptions) {
        return request("POST", url, requestOptions);
    }

    public PageSequence put(String url, RequestOptions requestOptions) {
        return request("PUT", url, requestOptions);
    }

    public PageSequence patch(String url, RequestOptions requestOptions) {
        return request("PATCH", url, requestOptions);
    }

    public PageSequence delete(String url) {
        return request("DELETE", url, RequestOptions.none());
    }

    /**
     * Start a logical call. Each invocation begins a fresh retry and pagination cycle.
     *
     * @param method HTTP method
     * @param url absolute URL, or a path relative to the session's base URL
     * @param requestOptions query parameters, body and headers of the call
     * @return a lazy, finite, single-use sequence of responses, one per page
     */
    public PageSequence request(String method, String url, RequestOptions requestOptions) {
        String first = normalizeUrl(url);
        String query = requestOptions.queryString();
        if (!query.isEmpty()) {
            first = first + (first.indexOf('?') >= 0 ? "&" : "?") + query;
        }
        return new PageSequence(this, method.toUpperCase(Locale.ROOT), URI.create(first), requestOptions,
            options.maxPages());
    }

    /**
     * Resolve a URL without a scheme against the base URL; absolute URLs are returned unchanged.
     */
    public String normalizeUrl(String url) {
        if (ABSOLUTE_URL.matcher(url).matches()) {
            return url;
        }
        String path = url.startsWith("/") ? url.substring(1) : url;
        return options.baseUrl() + "/" + path;
    }

    public SessionOptions getOptions() {
        return options;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * Cookies that will be sent with the next request.
     */
    public Map<String, String> getCookies() {
        return Map.copyOf(cookies);
    }

    /**
     * Execute one page, retrying transient failures.
     */
    ApiResponse fetch(String method, URI uri, RequestOptions requestOptions) {
        int retries = 0;
        while (true) {
            ApiResponse response = send(method, uri, requestOptions);
            ResponseOutcome outcome = ResponseOutcome.classify(response, options.defaultRetryAfter(), objectMapper);

            if (outcome instanceof ResponseOutcome.Ok ok) {
                if (options.logging().debug()) {
                    LOG.infof("Request successful: %s %s", method, uri);
                }
                return ok.response();
            }
            if (outcome instanceof ResponseOutcome.Fatal fatal) {
                if (options.logging().debug()) {
                    LOG.infof("An error occurred while requesting URL: %s, error: %d", uri, response.statusCode());
                }
                throw fatal.error();
            }

            if (retries >= options.maxRetries()) {
                LOG.warnf("Retry budget of %d exhausted for %s %s", options.maxRetries(), method, uri);
                throw new RetryExhaustedException(uri, response.statusCode(), retries + 1);
            }
            retries++;

            if (outcome instanceof ResponseOutcome.RateLimited limited) {
                if (options.logging().verbose()) {
                    LOG.infof("Received 429 Too Many Requests. Retrying after %d seconds... (Attempt %d/%d)",
                        limited.retryAfter().toSeconds(), retries, options.maxRetries() + 1);
                }
                backoff(limited, uri);
            } else if (outcome instanceof ResponseOutcome.ProxyAuthRequired proxy) {
                installProxyCredentials(proxy);
            }
        }
    }

    private void backoff(ResponseOutcome.RateLimited limited, URI uri) {
        try {
            sleeper.sleep(limited.retryAfter());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(uri, e);
        }
    }

    private void installProxyCredentials(ResponseOutcome.ProxyAuthRequired proxy) {
        if (proxyCredentialsProvider == null) {
            throw new ProxyAuthenticationException(proxy.url());
        }
        if (options.logging().verbose()) {
            LOG.infof("Received 407 Proxy Authentication Required for %s", proxy.url());
        }
        ProxyCredentials credentials = proxyCredentialsProvider.credentialsFor(proxy.challenge());
        this.proxyAuthorization = credentials.basicAuthorization();
    }

    private ApiResponse send(String method, URI uri, RequestOptions requestOptions) {
        HttpRequest request = buildRequest(method, uri, requestOptions);

        if (options.logging().verbose()) {
            LOG.infof("Request: %s %s", method, uri);
        }
        if (options.logging().debug()) {
            LOG.infof("Request headers: %s", redact(request.headers()));
        }

        HttpResponse<String> httpResponse;
        try {
            httpResponse = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            if (options.logging().debug()) {
                LOG.infof("An error occurred while requesting URL: %s, error: %s", uri, e.toString());
            }
            throw new TransportException(uri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(uri, e);
        }

        ApiResponse response = ApiResponse.of(httpResponse);
        if (options.logging().verbose()) {
            LOG.infof("Response: %d", response.statusCode());
        }
        if (options.logging().debug()) {
            LOG.infof("Response headers: %s", redact(response.headers()));
        }
        mergeCookies(response.headers());
        return response;
    }

    private HttpRequest buildRequest(String method, URI uri, RequestOptions requestOptions) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(options.timeout())
            .header("Accept", "application/json");

        if (!options.authorization().isEmpty()) {
            builder.header("Authorization", options.authorization());
        }
        options.headers().forEach(builder::header);
        requestOptions.headers().forEach(builder::header);
        if (proxyAuthorization != null) {
            builder.header("Proxy-Authorization", proxyAuthorization);
        }
        if (!cookies.isEmpty()) {
            builder.header("Cookie", cookies.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("; ")));
        }

        if (requestOptions.body() != null) {
            builder.header("Content-Type", "application/json");
            builder.method(method, HttpRequest.BodyPublishers.ofString(toJson(requestOptions.body())));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }
        return builder.build();
    }

    private String toJson(Object body) {
        if (body instanceof String s) {
            return s;
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new WebexApiException("Failed to serialize request body", e);
        }
    }

    private void mergeCookies(HttpHeaders headers) {
        for (String setCookie : headers.allValues("Set-Cookie")) {
            try {
                for (HttpCookie cookie : HttpCookie.parse(setCookie)) {
                    cookies.put(cookie.getName(), cookie.getValue());
                }
            } catch (IllegalArgumentException e) {
                LOG.debugf("Ignoring malformed Set-Cookie header: %s", e.getMessage());
            }
        }
    }

    private static Map<String, String> redact(HttpHeaders headers) {
        Map<String, String> printable = new LinkedHashMap<>();
        headers.map().forEach((name, values) -> printable.put(name,
            REDACTED_HEADERS.contains(name.toLowerCase(Locale.ROOT)) ? "***" : String.join(", ", values)));
        return printable;
    }
}
