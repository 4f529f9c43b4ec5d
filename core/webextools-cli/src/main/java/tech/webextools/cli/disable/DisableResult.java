package tech.webextools.cli.disable;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One line of the disable-users report.
 *
 * @param email address as read from the CSV file
 * @param userId directory id, {@code null} when the user was not found
 * @param displayName directory display name, {@code null} when the user was not found
 * @param status outcome
 * @param message failure detail, {@code null} otherwise
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"email", "userId", "displayName", "status", "message"})
public record DisableResult(String email, String userId, String displayName, DisableStatus status, String message) {

    public static DisableResult notFound(String email) {
        return new DisableResult(email, null, null, DisableStatus.NOT_FOUND, null);
    }
}
