package com.pingidentity.scim2.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;

/**
 * Lookups on a JSON tree that follow SCIM's case-insensitive attribute names.
 */
final class JsonTree {

    private JsonTree() {
    }

    /**
     * @return the value under the name, ignoring case, or null when there is none
     */
    static JsonNode field(JsonNode node, String name) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode exact = node.get(name);
        if (exact != null) {
            return exact;
        }
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String candidate = names.next();
            if (candidate.equalsIgnoreCase(name)) {
                return node.get(candidate);
            }
        }
        return null;
    }

    static boolean isPresent(JsonNode value) {
        return value != null && !value.isNull();
    }

    /**
     * Missing, null, blank text and empty arrays all count as empty.
     */
    static boolean isEmpty(JsonNode value) {
        if (!isPresent(value)) {
            return true;
        }
        if (value.isTextual()) {
            return value.asText().isBlank();
        }
        return value.isArray() && value.isEmpty();
    }

    static ObjectNode objectField(JsonNode node, String name) {
        JsonNode value = field(node, name);
        return value != null && value.isObject() ? (ObjectNode) value : null;
    }

    static Long longField(JsonNode node, String name) {
        JsonNode value = field(node, name);
        return value != null && value.isIntegralNumber() ? value.longValue() : null;
    }

    static String textField(JsonNode node, String name) {
        JsonNode value = field(node, name);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
