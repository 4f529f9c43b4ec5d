package tech.webextools.sdk.exception;

import java.util.List;

/**
 * Exception thrown when input fails local validation, before any network call is made.
 */
public class ValidationException extends WebexApiException {

    private final List<ValidationError> errors;

    public ValidationException(String message, List<ValidationError> errors) {
        super(message);
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public ValidationException(String field, String message) {
        this(message, List.of(new ValidationError(field, message, null)));
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    public static ValidationException missingOrganizationId() {
        return new ValidationException("orgId", "Organization ID is required");
    }

    public static ValidationException invalidPatch(String reason) {
        return new ValidationException("Invalid data for updating user: " + reason,
            List.of(new ValidationError("patch", reason, "INVALID_PATCH")));
    }

    public static ValidationException invalidToken(String reason) {
        return new ValidationException("Invalid Webex API access token: " + reason,
            List.of(new ValidationError("token", reason, "INVALID_TOKEN")));
    }

    public record ValidationError(String field, String message, String code) {}
}
