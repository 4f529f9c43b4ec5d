package tech.webextools.sdk.exception;

import java.util.Map;

/**
 * Exception thrown when the access token is rejected.
 */
public class AuthenticationException extends WebexApiException {

    public AuthenticationException(String message) {
        super(message, 401);
    }

    public AuthenticationException(String message, Map<String, Object> context) {
        super(message, 401, null, context);
    }

    public static AuthenticationException tokenRejected(Map<String, Object> context) {
        return new AuthenticationException("Access token expired or invalid", context);
    }
}
