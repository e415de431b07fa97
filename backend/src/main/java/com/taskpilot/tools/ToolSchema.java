package com.taskpilot.tools;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Small builder for the JSON-schema "object" blocks used as tool parameter declarations.
 */
final class ToolSchema {

    private final ObjectNode root = JsonNodeFactory.instance.objectNode();
    private final ObjectNode properties;
    private final ArrayNode required;

    private ToolSchema() {
        root.put("type", "object");
        properties = root.putObject("properties");
        required = root.putArray("required");
        root.put("additionalProperties", false);
    }

    static ToolSchema object() {
        return new ToolSchema();
    }

    ToolSchema string(String name, String description, boolean isRequired) {
        ObjectNode prop = properties.putObject(name);
        prop.put("type", "string");
        prop.put("description", description);
        if (isRequired) {
            required.add(name);
        }
        return this;
    }

    ToolSchema enumeration(String name, String description, String... values) {
        ObjectNode prop = properties.putObject(name);
        prop.put("type", "string");
        prop.put("description", description);
        ArrayNode allowed = prop.putArray("enum");
        for (String value : values) {
            allowed.add(value);
        }
        return this;
    }

    ObjectNode build() {
        return root.deepCopy();
    }
}
