package com.taskpilot.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Exposes the {@link TaskTool} catalogue and dispatches model tool requests to
 * {@link TaskToolService}. The user id is always the one bound by the caller; any
 * {@code user_id} in the model's arguments is ignored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TaskToolRegistry {

    private final TaskToolService taskToolService;

    public List<ToolSpec> catalogue() {
        return Arrays.stream(TaskTool.values())
                .map(TaskTool::spec)
                .toList();
    }

    public ToolResult invoke(String userId, ToolRequest request) {
        TaskTool tool = TaskTool.fromName(request.name()).orElse(null);
        if (tool == null) {
            log.debug("Model requested unknown tool '{}'", request.name());
            return ToolResult.failure(error("Unknown tool", "No tool named '" + request.name() + "'"));
        }
        if (!request.hasValidArguments()) {
            return ToolResult.failure(error("Invalid arguments", "Arguments must be a JSON object"));
        }

        JsonNode args = request.arguments();
        try {
            ObjectNode payload = switch (tool) {
                case ADD_TASK -> taskToolService.addTask(userId, text(args, "title"), text(args, "description"));
                case LIST_TASKS -> taskToolService.listTasks(userId, text(args, "status"));
                case COMPLETE_TASK -> taskToolService.completeTask(userId, text(args, "task_id"));
                case UPDATE_TASK -> taskToolService.updateTask(userId, text(args, "task_id"),
                        text(args, "title"), text(args, "description"));
                case DELETE_TASK -> taskToolService.deleteTask(userId, text(args, "task_id"));
            };
            log.debug("Tool {} succeeded for user {}", tool.toolName(), userId);
            return ToolResult.success(payload);
        } catch (ToolExecutionException e) {
            log.debug("Tool {} failed for user {}: {}", tool.toolName(), userId, e.getMessage());
            return ToolResult.failure(e.payload());
        } catch (RuntimeException e) {
            log.error("Tool {} raised an unexpected error for user {}", tool.toolName(), userId, e);
            return ToolResult.failure(error("Failed to run " + tool.toolName(), "Internal error while accessing tasks"));
        }
    }

    private static String text(JsonNode args, String field) {
        JsonNode value = args.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private static ObjectNode error(String error, String details) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("error", error);
        payload.put("details", details);
        return payload;
    }
}
