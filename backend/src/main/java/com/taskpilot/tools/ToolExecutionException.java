package com.taskpilot.tools;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A named tool failed in a way the model should hear about. Never escapes the registry.
 */
public class ToolExecutionException extends RuntimeException {

    private final transient ObjectNode payload;

    private ToolExecutionException(String error, ObjectNode payload) {
        super(error);
        this.payload = payload;
    }

    public static ToolExecutionException taskNotFound(String taskId) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("error", "Task not found");
        payload.put("task_id", taskId);
        return new ToolExecutionException("Task not found", payload);
    }

    public static ToolExecutionException invalid(String error, String details) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("error", error);
        if (details != null) {
            payload.put("details", details);
        }
        return new ToolExecutionException(error, payload);
    }

    public ObjectNode payload() {
        return payload.deepCopy();
    }
}
