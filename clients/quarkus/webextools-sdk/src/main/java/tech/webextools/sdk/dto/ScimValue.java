package tech.webextools.sdk.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One entry of a SCIM multi-valued attribute such as {@code emails} or {@code roles}.
 */
public record ScimValue(String value, String type, String display, boolean primary) {

    /**
     * Decode an entry. A bare string becomes the value; anything else that is not an object
     * yields an empty entry.
     */
    static ScimValue fromJson(JsonNode node) {
        if (node.isTextual()) {
            return new ScimValue(node.asText(), "", "", false);
        }
        if (!node.isObject()) {
            return new ScimValue("", "", "", false);
        }
        return new ScimValue(
            ScimUser.text(node, "value"),
            ScimUser.text(node, "type"),
            ScimUser.text(node, "display"),
            node.path("primary").asBoolean(false)
        );
    }
}
