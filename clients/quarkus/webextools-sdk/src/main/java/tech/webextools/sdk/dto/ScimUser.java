package tech.webextools.sdk.dto;

import com.fasterxml.jackson.databind.JsonNode;
import tech.webextools.sdk.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A user account of the Webex directory, decoded from a SCIM {@code User} resource.
 *
 * <p>Missing or wrongly typed attributes fall back to empty strings, empty lists and
 * {@code false}. Two users are equal when their ids are equal.
 */
public record ScimUser(
    String id,
    String userName,
    List<ScimValue> emails,
    String displayName,
    String nickName,
    String firstName,
    String lastName,
    List<ScimValue> roles,
    String timezone,
    boolean active,
    String userType
) {
    public ScimUser {
        id = Objects.requireNonNullElse(id, "");
        userName = Objects.requireNonNullElse(userName, "");
        emails = emails != null ? List.copyOf(emails) : List.of();
        displayName = Objects.requireNonNullElse(displayName, "");
        nickName = Objects.requireNonNullElse(nickName, "");
        firstName = Objects.requireNonNullElse(firstName, "");
        lastName = Objects.requireNonNullElse(lastName, "");
        roles = roles != null ? List.copyOf(roles) : List.of();
        timezone = Objects.requireNonNullElse(timezone, "");
        userType = Objects.requireNonNullElse(userType, "");
    }

    /**
     * Decode a SCIM user resource.
     *
     * @throws ValidationException if the node is not a JSON object
     */
    public static ScimUser fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ValidationException("resource", "SCIM user resource must be a JSON object");
        }
        JsonNode name = node.path("name");
        return new ScimUser(
            text(node, "id"),
            text(node, "userName"),
            values(node.path("emails")),
            text(node, "displayName"),
            text(node, "nickName"),
            text(name, "givenName"),
            text(name, "familyName"),
            values(node.path("roles")),
            text(node, "timezone"),
            node.path("active").isBoolean() && node.path("active").booleanValue(),
            text(node, "userType")
        );
    }

    /**
     * The primary email, else the first email, else the user name.
     */
    public String primaryEmail() {
        return emails.stream()
            .filter(ScimValue::primary)
            .map(ScimValue::value)
            .filter(v -> !v.isBlank())
            .findFirst()
            .or(() -> emails.stream().map(ScimValue::value).filter(v -> !v.isBlank()).findFirst())
            .orElse(userName);
    }

    /**
     * Whether the address matches the user name or any email, ignoring case.
     */
    public boolean hasEmail(String address) {
        if (address == null || address.isBlank()) {
            return false;
        }
        String wanted = address.trim();
        return userName.equalsIgnoreCase(wanted)
            || emails.stream().anyMatch(e -> e.value().equalsIgnoreCase(wanted));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ScimUser other && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isValueNode() && !value.isNull() ? value.asText() : "";
    }

    private static List<ScimValue> values(JsonNode array) {
        List<ScimValue> result = new ArrayList<>();
        if (array.isArray()) {
            array.forEach(item -> result.add(ScimValue.fromJson(item)));
        }
        return result;
    }
}
