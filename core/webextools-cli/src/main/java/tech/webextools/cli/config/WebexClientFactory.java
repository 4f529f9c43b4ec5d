package tech.webextools.cli.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.webextools.cli.console.ConsolePrompts;
import tech.webextools.sdk.client.WebexClient;
import tech.webextools.sdk.client.auth.EnvironmentTokenProvider;
import tech.webextools.sdk.config.WebexToolsConfig;
import tech.webextools.sdk.http.LoggingOptions;

/**
 * Builds a {@link WebexClient} per command run, once the verbosity flags are known.
 */
@ApplicationScoped
public class WebexClientFactory {

    @Inject
    WebexToolsConfig config;

    @Inject
    ConsolePrompts prompts;

    public WebexClient create(LoggingOptions logging) {
        var tokenProvider = new EnvironmentTokenProvider(config.token(), prompts);
        return WebexClient.create(config, tokenProvider, logging, prompts);
    }
}
