package com.taskpilot.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of one tool invocation. Both variants carry a JSON payload so errors can be fed back
 * into model context exactly like successes.
 */
public record ToolResult(
        boolean success,
        JsonNode payload
) {
    public static ToolResult success(JsonNode payload) {
        return new ToolResult(true, payload);
    }

    public static ToolResult failure(JsonNode payload) {
        return new ToolResult(false, payload);
    }

    public String error() {
        return success || payload == null ? null : payload.path("error").asText(null);
    }
}
