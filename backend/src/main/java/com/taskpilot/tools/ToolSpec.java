package com.taskpilot.tools;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Catalogue entry handed to the model: tool name, description and JSON schema of its arguments.
 */
public record ToolSpec(String name, String description, ObjectNode parameters) {
}
