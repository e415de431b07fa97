package com.taskpilot.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A tool call proposed by the model. {@code arguments} is null when the model sent something that
 * is not a JSON object; {@code rawArguments} keeps the original text for the trace.
 */
public record ToolRequest(String id, String name, JsonNode arguments, String rawArguments) {

    public boolean hasValidArguments() {
        return arguments != null && arguments.isObject();
    }
}
