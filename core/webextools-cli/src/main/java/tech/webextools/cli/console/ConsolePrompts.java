package tech.webextools.cli.console;

import jakarta.enterprise.context.ApplicationScoped;
import tech.webextools.sdk.client.auth.TokenPrompt;
import tech.webextools.sdk.exception.WebexApiException;
import tech.webextools.sdk.http.ProxyCredentials;
import tech.webextools.sdk.http.ProxyCredentialsProvider;

import java.io.Console;

/**
 * Interactive prompts on the system console. Secrets are read without echo.
 */
@ApplicationScoped
public class ConsolePrompts implements TokenPrompt, ProxyCredentialsProvider {

    @Override
    public String promptForToken() {
        Console console = System.console();
        if (console == null) {
            return null;
        }
        char[] token = console.readPassword("%n Enter your Webex API access token: ");
        console.printf("%n");
        return token != null ? new String(token) : null;
    }

    @Override
    public ProxyCredentials credentialsFor(String proxyChallenge) {
        Console console = System.console();
        if (console == null) {
            throw new WebexApiException("Proxy authentication required but no console is available", 407);
        }
        if (proxyChallenge != null && !proxyChallenge.isBlank()) {
            console.printf("Proxy requested authentication: %s%n", proxyChallenge);
        }
        String username = console.readLine("Proxy username: ");
        char[] password = console.readPassword("Proxy password: ");
        return new ProxyCredentials(username != null ? username : "", password != null ? new String(password) : "");
    }
}
