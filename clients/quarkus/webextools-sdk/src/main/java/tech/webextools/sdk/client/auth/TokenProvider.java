package tech.webextools.sdk.client.auth;

/**
 * Source of the Webex API access token.
 */
@FunctionalInterface
public interface TokenProvider {

    /**
     * @return a non-blank, trimmed access token
     */
    String getAccessToken();
}
