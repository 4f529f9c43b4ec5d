package tech.webextools.sdk.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import tech.webextools.sdk.client.auth.OrganizationIds;
import tech.webextools.sdk.client.auth.TokenProvider;
import tech.webextools.sdk.client.resources.RecordingReports;
import tech.webextools.sdk.client.resources.ScimUsers;
import tech.webextools.sdk.config.WebexToolsConfig;
import tech.webextools.sdk.http.LoggingOptions;
import tech.webextools.sdk.http.ProxyCredentialsProvider;
import tech.webextools.sdk.http.ResilientSession;
import tech.webextools.sdk.http.SessionOptions;
import tech.webextools.sdk.http.Sleeper;

/**
 * Entry point to the Webex APIs used by the admin tools.
 *
 * <p>Holds two sessions: one for the REST API root and one for the identity (SCIM) root. Both
 * carry the same bearer token. Like the sessions, a client has a single owner.
 *
 * <p>Example usage:
 * <pre>{@code
 * var client = WebexClient.create(config, tokenProvider, LoggingOptions.quiet(), null);
 *
 * client.scimUsers().listUsers()
 *     .filter(user -> !user.active())
 *     .forEach(user -> System.out.println(user.primaryEmail()));
 * }</pre>
 */
public class WebexClient {

    private static final Logger LOG = Logger.getLogger(WebexClient.class);

    private final ResilientSession apiSession;
    private final ResilientSession identitySession;
    private final String defaultOrgId;
    private final LoggingOptions logging;

    private ScimUsers scimUsers;
    private RecordingReports recordingReports;

    /**
     * @param apiSession session bound to the REST API root
     * @param identitySession session bound to the identity API root
     * @param defaultOrgId organization used by SCIM calls that name none, may be {@code null}
     * @param logging diagnostic switches for the resources
     */
    public WebexClient(ResilientSession apiSession, ResilientSession identitySession, String defaultOrgId,
                       LoggingOptions logging) {
        this.apiSession = apiSession;
        this.identitySession = identitySession;
        this.defaultOrgId = defaultOrgId;
        this.logging = logging != null ? logging : LoggingOptions.quiet();
    }

    /**
     * Build a client from the application configuration.
     *
     * <p>The default organization is the configured {@code webextools.org-id}, else the one embedded
     * in the token. When neither is available, SCIM calls must pass an organization explicitly.
     *
     * @param config application configuration
     * @param tokenProvider source of the access token, asked once
     * @param logging diagnostic switches
     * @param proxyCredentialsProvider asked on 407 responses, may be {@code null}
     */
    public static WebexClient create(WebexToolsConfig config, TokenProvider tokenProvider, LoggingOptions logging,
                                     ProxyCredentialsProvider proxyCredentialsProvider) {
        String token = tokenProvider.getAccessToken();
        ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        var apiSession = new ResilientSession(
            SessionOptions.fromConfig(config, config.baseUrl(), token, logging),
            objectMapper, proxyCredentialsProvider, Sleeper.THREAD);
        var identitySession = new ResilientSession(
            SessionOptions.fromConfig(config, config.identityUrl(), token, logging),
            objectMapper, proxyCredentialsProvider, Sleeper.THREAD);

        String orgId = config.orgId()
            .filter(id -> !id.isBlank())
            .or(() -> OrganizationIds.tryFromToken(token))
            .orElse(null);
        if (orgId == null) {
            LOG.debug("No default organization configured or embedded in the token");
        }
        return new WebexClient(apiSession, identitySession, orgId, logging);
    }

    /**
     * Get the SCIM Users resource.
     */
    public ScimUsers scimUsers() {
        if (scimUsers == null) {
            scimUsers = new ScimUsers(identitySession, defaultOrgId, logging);
        }
        return scimUsers;
    }

    /**
     * Get the Recording Reports resource.
     */
    public RecordingReports recordingReports() {
        if (recordingReports == null) {
            recordingReports = new RecordingReports(apiSession);
        }
        return recordingReports;
    }

    public ResilientSession apiSession() {
        return apiSession;
    }

    public ResilientSession identitySession() {
        return identitySession;
    }

    public String getDefaultOrgId() {
        return defaultOrgId;
    }
}
