package com.taskpilot.tools;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of operations the model may request. The catalogue sent to the model and the
 * dispatch in {@link TaskToolRegistry} are both derived from these constants.
 * <p>
 * None of the schemas declares a user id: the caller's id is always bound by the orchestrator.
 */
public enum TaskTool {

    ADD_TASK("add_task",
            "Add a new task for the user. Use this when the user wants to create a task, "
                    + "add something to their todo list, or remember to do something.",
            ToolSchema.object()
                    .string("title", "The task title (required, 1-255 characters)", true)
                    .string("description", "Optional task description with more details", false)),

    LIST_TASKS("list_tasks",
            "Retrieve the user's tasks, optionally filtered by status. Use this to show tasks, "
                    + "check what is pending, or find a task id before changing it.",
            ToolSchema.object()
                    .enumeration("status", "Filter by status, default \"all\"", "all", "pending", "completed")),

    COMPLETE_TASK("complete_task",
            "Mark a task as completed. Use this when the user says a task is done.",
            ToolSchema.object()
                    .string("task_id", "The id of the task to complete", true)),

    UPDATE_TASK("update_task",
            "Change an existing task's title or description.",
            ToolSchema.object()
                    .string("task_id", "The id of the task to update", true)
                    .string("title", "New title, if changing", false)
                    .string("description", "New description, if changing", false)),

    DELETE_TASK("delete_task",
            "Delete a task from the user's list.",
            ToolSchema.object()
                    .string("task_id", "The id of the task to delete", true));

    private final String toolName;
    private final String description;
    private final ToolSchema schema;

    TaskTool(String toolName, String description, ToolSchema schema) {
        this.toolName = toolName;
        this.description = description;
        this.schema = schema;
    }

    public String toolName() {
        return toolName;
    }

    public ToolSpec spec() {
        return new ToolSpec(toolName, description, schema.build());
    }

    public static Optional<TaskTool> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(t -> t.toolName.equals(name))
                .findFirst();
    }
}
