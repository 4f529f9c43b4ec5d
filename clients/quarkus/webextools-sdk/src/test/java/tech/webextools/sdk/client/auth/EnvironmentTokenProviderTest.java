package tech.webextools.sdk.client.auth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.webextools.sdk.exception.ValidationException;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EnvironmentTokenProviderTest {

    @Mock
    TokenPrompt prompt;

    @Test
    @DisplayName("Should prefer the configured token")
    void shouldPreferConfiguredToken() {
        var provider = new EnvironmentTokenProvider(Optional.of(" configured "),
            Map.of(EnvironmentTokenProvider.TOKEN_VARIABLE, "from-env"), prompt);

        assertThat(provider.getAccessToken()).isEqualTo("configured");
        verifyNoInteractions(prompt);
    }

    @Test
    @DisplayName("Should fall back to the environment")
    void shouldUseEnvironment() {
        var provider = new EnvironmentTokenProvider(Optional.empty(),
            Map.of(EnvironmentTokenProvider.TOKEN_VARIABLE, "from-env\n"), prompt);

        assertThat(provider.getAccessToken()).isEqualTo("from-env");
        verifyNoInteractions(prompt);
    }

    @Test
    @DisplayName("Should prompt again after blank answers")
    void shouldRepromptOnBlankInput() {
        // Arrange
        when(prompt.promptForToken()).thenReturn("", "  ", " entered ");
        var provider = new EnvironmentTokenProvider(Optional.of(""), Map.of(), prompt);

        // Act
        String token = provider.getAccessToken();

        // Assert
        assertThat(token).isEqualTo("entered");
        verify(prompt, times(3)).promptForToken();
    }

    @Test
    @DisplayName("Should give up after three blank answers")
    void shouldGiveUpAfterThreeBlankAnswers() {
        when(prompt.promptForToken()).thenReturn("");
        var provider = new EnvironmentTokenProvider(Optional.empty(), Map.of(), prompt);

        assertThatThrownBy(provider::getAccessToken).isInstanceOf(ValidationException.class);
        verify(prompt, times(3)).promptForToken();
    }

    @Test
    @DisplayName("Should fail without any token source")
    void shouldFailWithoutPrompt() {
        var provider = new EnvironmentTokenProvider(Optional.empty(), Map.of(), null);

        assertThatThrownBy(provider::getAccessToken)
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining(EnvironmentTokenProvider.TOKEN_VARIABLE);
    }

    @Test
    @DisplayName("Should resolve the token only once")
    void shouldCacheToken() {
        when(prompt.promptForToken()).thenReturn("entered");
        var provider = new EnvironmentTokenProvider(Optional.empty(), Map.of(), prompt);

        provider.getAccessToken();
        provider.getAccessToken();

        verify(prompt, times(1)).promptForToken();
    }
}
