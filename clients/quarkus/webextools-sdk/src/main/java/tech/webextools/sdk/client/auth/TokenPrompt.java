package tech.webextools.sdk.client.auth;

/**
 * Asks the operator for an access token when none is configured.
 */
@FunctionalInterface
public interface TokenPrompt {

    /**
     * @return the entered text, possibly blank; {@code null} when no input is available
     */
    String promptForToken();
}
