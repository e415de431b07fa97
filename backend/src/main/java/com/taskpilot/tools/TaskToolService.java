package com.taskpilot.tools;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskpilot.model.entity.Task;
import com.taskpilot.model.entity.TaskStatus;
import com.taskpilot.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Task operations behind the tool catalogue. Every method runs in its own transaction and looks
 * the task up by id <em>and</em> owner before touching it, so a foreign task id reads as not found.
 */
@Service
@RequiredArgsConstructor
public class TaskToolService {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private final TaskRepository taskRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ObjectNode addTask(String userId, String title, String description) {
        if (title == null || title.isBlank()) {
            throw ToolExecutionException.invalid("Failed to create task", "Title is required");
        }

        Task task = Task.builder()
                .userId(userId)
                .title(truncateTitle(title.strip()))
                .description(blankToNull(description))
                .status(TaskStatus.PENDING)
                .build();
        task = taskRepository.save(task);

        ObjectNode result = JSON.objectNode();
        result.put("task_id", task.getId().toString());
        result.put("status", "created");
        result.put("title", task.getTitle());
        return result;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public ObjectNode listTasks(String userId, String statusFilter) {
        String filter = normalizeFilter(statusFilter);
        List<Task> tasks = switch (filter) {
            case "pending" -> taskRepository.findByUserIdAndStatusOrderByCreatedAtAsc(userId, TaskStatus.PENDING);
            case "completed" -> taskRepository.findByUserIdAndStatusOrderByCreatedAtAsc(userId, TaskStatus.COMPLETED);
            default -> taskRepository.findByUserIdOrderByCreatedAtAsc(userId);
        };

        ObjectNode result = JSON.objectNode();
        ArrayNode items = result.putArray("tasks");
        for (Task task : tasks) {
            ObjectNode item = items.addObject();
            item.put("id", task.getId().toString());
            item.put("title", task.getTitle());
            item.put("description", task.getDescription() != null ? task.getDescription() : "");
            item.put("completed", task.getStatus() == TaskStatus.COMPLETED);
            if (task.getCreatedAt() != null) {
                item.put("created_at", task.getCreatedAt().toString());
            } else {
                item.putNull("created_at");
            }
        }
        result.put("count", tasks.size());
        result.put("filter", filter);
        return result;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ObjectNode completeTask(String userId, String taskId) {
        Task task = findOwned(userId, taskId);
        task.setStatus(TaskStatus.COMPLETED);
        task = taskRepository.save(task);

        ObjectNode result = JSON.objectNode();
        result.put("task_id", task.getId().toString());
        result.put("status", "completed");
        result.put("title", task.getTitle());
        return result;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ObjectNode updateTask(String userId, String taskId, String title, String description) {
        if (title == null && description == null) {
            throw ToolExecutionException.invalid("No updates provided", "Specify title or description to update");
        }

        Task task = findOwned(userId, taskId);

        List<String> changes = new ArrayList<>();
        if (title != null && !title.isBlank()) {
            task.setTitle(truncateTitle(title.strip()));
            changes.add("title");
        }
        if (description != null) {
            task.setDescription(blankToNull(description));
            changes.add("description");
        }
        if (changes.isEmpty()) {
            throw ToolExecutionException.invalid("No valid updates provided", null);
        }
        task = taskRepository.save(task);

        ObjectNode result = JSON.objectNode();
        result.put("task_id", task.getId().toString());
        result.put("status", "updated");
        result.put("title", task.getTitle());
        ArrayNode changed = result.putArray("changes");
        changes.forEach(changed::add);
        return result;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ObjectNode deleteTask(String userId, String taskId) {
        Task task = findOwned(userId, taskId);
        String title = task.getTitle();
        taskRepository.delete(task);

        ObjectNode result = JSON.objectNode();
        result.put("task_id", task.getId().toString());
        result.put("status", "deleted");
        result.put("title", title);
        return result;
    }

    private Task findOwned(String userId, String taskId) {
        UUID id = parseTaskId(taskId);
        return taskRepository.findByIdAndUserId(id, userId)
                .orElseThrow(() -> ToolExecutionException.taskNotFound(taskId));
    }

    private UUID parseTaskId(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw ToolExecutionException.taskNotFound(taskId);
        }
        try {
            return UUID.fromString(taskId.strip());
        } catch (IllegalArgumentException e) {
            throw ToolExecutionException.taskNotFound(taskId);
        }
    }

    private static String normalizeFilter(String statusFilter) {
        if (statusFilter == null) {
            return "all";
        }
        String value = statusFilter.strip().toLowerCase();
        return value.equals("pending") || value.equals("completed") ? value : "all";
    }

    private static String truncateTitle(String title) {
        return title.length() > Task.TITLE_MAX_LENGTH ? title.substring(0, Task.TITLE_MAX_LENGTH) : title;
    }

    private static String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.strip();
    }
}
