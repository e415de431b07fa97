package com.taskpilot.agent;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One executed tool call of a turn. Returned to the caller, never stored.
 */
public record ToolInvocation(String name, JsonNode arguments, JsonNode result, boolean success) {
}
