package tech.webextools.sdk.http;

import tech.webextools.sdk.config.WebexToolsConfig;
import tech.webextools.sdk.exception.ValidationException;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable settings of a {@link ResilientSession}.
 *
 * @param baseUrl root that relative request URLs are resolved against
 * @param authorization value of the Authorization header, empty for none
 * @param maxRetries retries allowed per page for 429 and 407 responses
 * @param timeout bound on each individual network call
 * @param defaultRetryAfter wait used when a 429 carries no Retry-After header
 * @param maxPages upper bound on the pages one request may follow
 * @param headers extra headers sent with every request
 * @param cookies cookies sent with the first request
 * @param proxy HTTP proxy, if any
 * @param logging diagnostic switches
 */
public record SessionOptions(
    String baseUrl,
    String authorization,
    int maxRetries,
    Duration timeout,
    Duration defaultRetryAfter,
    int maxPages,
    Map<String, String> headers,
    Map<String, String> cookies,
    Optional<InetSocketAddress> proxy,
    LoggingOptions logging
) {
    public static final String DEFAULT_BASE_URL = "https://webexapis.com/v1";
    public static final int DEFAULT_MAX_RETRIES = 6;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(15);
    public static final int DEFAULT_MAX_PAGES = 10_000;

    public SessionOptions {
        baseUrl = baseUrl.replaceAll("/+$", "");
        authorization = authorization != null ? authorization : "";
        headers = Map.copyOf(headers);
        cookies = Map.copyOf(cookies);
        proxy = proxy != null ? proxy : Optional.empty();
        logging = logging != null ? logging : LoggingOptions.quiet();
        if (maxRetries < 0) {
            throw new ValidationException("maxRetries", "maxRetries must not be negative");
        }
        if (maxPages < 1) {
            throw new ValidationException("maxPages", "maxPages must be at least 1");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Derive session settings from the application configuration.
     *
     * @param config application configuration
     * @param baseUrl API root this session talks to
     * @param token bearer token
     * @param logging diagnostic switches
     */
    public static SessionOptions fromConfig(WebexToolsConfig config, String baseUrl, String token,
                                            LoggingOptions logging) {
        var http = config.http();
        var builder = builder()
            .baseUrl(baseUrl)
            .bearerToken(token)
            .maxRetries(http.maxRetries())
            .timeout(Duration.ofSeconds(http.timeout()))
            .defaultRetryAfter(Duration.ofSeconds(http.defaultRetryAfter()))
            .maxPages(http.maxPages())
            .logging(logging);
        http.proxy().filter(p -> !p.isBlank()).map(SessionOptions::parseProxy).ifPresent(builder::proxy);
        return builder.build();
    }

    static InetSocketAddress parseProxy(String hostAndPort) {
        int colon = hostAndPort.lastIndexOf(':');
        if (colon <= 0 || colon == hostAndPort.length() - 1) {
            throw new ValidationException("proxy", "Proxy must be given as host:port, got '" + hostAndPort + "'");
        }
        try {
            int port = Integer.parseInt(hostAndPort.substring(colon + 1));
            return InetSocketAddress.createUnresolved(hostAndPort.substring(0, colon), port);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("proxy", "Invalid proxy port in '" + hostAndPort + "'");
        }
    }

    public static final class Builder {
        private String baseUrl = DEFAULT_BASE_URL;
        private String authorization = "";
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration timeout = DEFAULT_TIMEOUT;
        private Duration defaultRetryAfter = DEFAULT_RETRY_AFTER;
        private int maxPages = DEFAULT_MAX_PAGES;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private final Map<String, String> cookies = new LinkedHashMap<>();
        private InetSocketAddress proxy;
        private LoggingOptions logging = LoggingOptions.quiet();

        private Builder() {
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder authorization(String authorization) {
            this.authorization = authorization;
            return this;
        }

        public Builder bearerToken(String token) {
            this.authorization = token == null || token.isBlank() ? "" : "Bearer " + token;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder defaultRetryAfter(Duration defaultRetryAfter) {
            this.defaultRetryAfter = defaultRetryAfter;
            return this;
        }

        public Builder maxPages(int maxPages) {
            this.maxPages = maxPages;
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder cookie(String name, String value) {
            this.cookies.put(name, value);
            return this;
        }

        public Builder proxy(InetSocketAddress proxy) {
            this.proxy = proxy;
            return this;
        }

        public Builder logging(LoggingOptions logging) {
            this.logging = logging;
            return this;
        }

        public SessionOptions build() {
            return new SessionOptions(baseUrl, authorization, maxRetries, timeout, defaultRetryAfter,
                maxPages, headers, cookies, Optional.ofNullable(proxy), logging);
        }
    }
}
