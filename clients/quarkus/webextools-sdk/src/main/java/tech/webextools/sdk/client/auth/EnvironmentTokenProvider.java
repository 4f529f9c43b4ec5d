package tech.webextools.sdk.client.auth;

import org.jboss.logging.Logger;
import tech.webextools.sdk.exception.ValidationException;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves the access token from configuration, then the environment, then an interactive prompt.
 *
 * <p>The resolved token is cached for the lifetime of the provider.
 */
public class EnvironmentTokenProvider implements TokenProvider {

    private static final Logger LOG = Logger.getLogger(EnvironmentTokenProvider.class);

    public static final String TOKEN_VARIABLE = "WEBEX_TEAMS_ACCESS_TOKEN";
    static final int MAX_PROMPTS = 3;

    private final Optional<String> configuredToken;
    private final Map<String, String> environment;
    private final TokenPrompt prompt;

    private String accessToken;

    public EnvironmentTokenProvider(Optional<String> configuredToken, TokenPrompt prompt) {
        this(configuredToken, System.getenv(), prompt);
    }

    /**
     * @param configuredToken token from configuration, if any
     * @param environment environment variables to consult
     * @param prompt asked when neither source has a token, may be {@code null}
     */
    public EnvironmentTokenProvider(Optional<String> configuredToken, Map<String, String> environment,
                                    TokenPrompt prompt) {
        this.configuredToken = configuredToken != null ? configuredToken : Optional.empty();
        this.environment = environment;
        this.prompt = prompt;
    }

    @Override
    public String getAccessToken() {
        if (accessToken == null) {
            accessToken = resolve();
        }
        return accessToken;
    }

    private String resolve() {
        Optional<String> fromConfig = configuredToken.map(String::trim).filter(t -> !t.isEmpty());
        if (fromConfig.isPresent()) {
            LOG.debug("Using access token from configuration");
            return fromConfig.get();
        }

        String fromEnvironment = environment.get(TOKEN_VARIABLE);
        if (fromEnvironment != null && !fromEnvironment.isBlank()) {
            LOG.debugf("Using access token from %s", TOKEN_VARIABLE);
            return fromEnvironment.trim();
        }

        if (prompt == null) {
            throw ValidationException.invalidToken("no token configured and " + TOKEN_VARIABLE + " is not set");
        }
        for (int attempt = 1; attempt <= MAX_PROMPTS; attempt++) {
            String entered = prompt.promptForToken();
            if (entered == null) {
                break;
            }
            if (!entered.isBlank()) {
                return entered.trim();
            }
            LOG.warn("Invalid token provided, token cannot be empty.");
        }
        throw ValidationException.invalidToken("token cannot be empty");
    }
}
