package tech.webextools.sdk.dto;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders for SCIM 2.0 {@code PatchOp} documents.
 *
 * <pre>{@code
 * { "schemas": ["urn:ietf:params:scim:api:messages:2.0:PatchOp"],
 *   "Operations": [ { "op": "replace", "value": { "active": false } } ] }
 * }</pre>
 */
public final class ScimPatch {

    public static final String PATCH_OP_SCHEMA = "urn:ietf:params:scim:api:messages:2.0:PatchOp";
    public static final String SCHEMAS = "schemas";
    public static final String OPERATIONS = "Operations";

    private ScimPatch() {
    }

    /**
     * A single {@code replace} operation setting the given attributes.
     */
    public static Map<String, Object> replace(Map<String, Object> values) {
        Map<String, Object> operation = new LinkedHashMap<>();
        operation.put("op", "replace");
        operation.put("value", new LinkedHashMap<>(values));

        Map<String, Object> document = new LinkedHashMap<>();
        document.put(SCHEMAS, List.of(PATCH_OP_SCHEMA));
        document.put(OPERATIONS, List.of(operation));
        return document;
    }

    public static Map<String, Object> deactivate() {
        return replace(Map.of("active", false));
    }
}
