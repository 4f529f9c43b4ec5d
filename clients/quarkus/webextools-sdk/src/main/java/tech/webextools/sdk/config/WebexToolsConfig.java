package tech.webextools.sdk.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

/**
 * Configuration for the WebexTools SDK.
 *
 * <p>Configure in application.properties:
 * <pre>
 * webextools.base-url=https://webexapis.com/v1
 * webextools.identity-url=https://webexapis.com/identity
 * webextools.http.max-retries=6
 * </pre>
 */
@ConfigMapping(prefix = "webextools")
public interface WebexToolsConfig {

    /**
     * Root of the Webex REST API.
     */
    @WithName("base-url")
    @WithDefault("https://webexapis.com/v1")
    String baseUrl();

    /**
     * Root of the Webex identity (SCIM) API.
     */
    @WithName("identity-url")
    @WithDefault("https://webexapis.com/identity")
    String identityUrl();

    /**
     * Bearer token. When absent the WEBEX_TEAMS_ACCESS_TOKEN environment value or a prompt is used.
     */
    Optional<String> token();

    /**
     * Default organization. When absent it is derived from the token.
     */
    @WithName("org-id")
    Optional<String> orgId();

    /**
     * HTTP client configuration.
     */
    HttpConfig http();

    interface HttpConfig {
        /**
         * Per-request timeout in seconds.
         */
        @WithDefault("10")
        int timeout();

        /**
         * Retries allowed for rate-limited (429) or proxy-challenged (407) requests.
         */
        @WithName("max-retries")
        @WithDefault("6")
        int maxRetries();

        /**
         * Seconds to wait on a 429 response that carries no Retry-After header.
         */
        @WithName("default-retry-after")
        @WithDefault("15")
        int defaultRetryAfter();

        /**
         * Upper bound on the pages followed by one logical request.
         */
        @WithName("max-pages")
        @WithDefault("10000")
        int maxPages();

        /**
         * Optional HTTP proxy as host:port.
         */
        Optional<String> proxy();
    }
}
