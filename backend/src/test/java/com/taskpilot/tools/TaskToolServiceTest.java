package com.taskpilot.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskpilot.model.entity.Task;
import com.taskpilot.model.entity.TaskStatus;
import com.taskpilot.repository.TaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

// Each tool operation commits on its own, so the test itself runs outside a transaction.
@DataJpaTest
@ActiveProfiles("test")
@Import(TaskToolService.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class TaskToolServiceTest {

    @Autowired
    private TaskToolService taskToolService;

    @Autowired
    private TaskRepository taskRepository;

    @BeforeEach
    void setUp() {
        taskRepository.deleteAll();
    }

    @Test
    void addTaskTrimsTitleAndStoresPending() {
        ObjectNode result = taskToolService.addTask("alice", "  buy milk  ", "   ");

        assertThat(result.path("status").asText()).isEqualTo("created");
        assertThat(result.path("title").asText()).isEqualTo("buy milk");
        Task stored = taskRepository.findById(UUID.fromString(result.path("task_id").asText())).orElseThrow();
        assertThat(stored.getUserId()).isEqualTo("alice");
        assertThat(stored.getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(stored.getDescription()).isNull();
    }

    @Test
    void addTaskTruncatesLongTitle() {
        ObjectNode result = taskToolService.addTask("alice", "x".repeat(300), null);

        assertThat(result.path("title").asText()).hasSize(Task.TITLE_MAX_LENGTH);
    }

    @Test
    void addTaskRequiresTitle() {
        assertThatThrownBy(() -> taskToolService.addTask("alice", "  ", null))
                .isInstanceOf(ToolExecutionException.class)
                .satisfies(e -> assertThat(((ToolExecutionException) e).payload().path("details").asText())
                        .isEqualTo("Title is required"));
    }

    @Test
    void listTasksFiltersByStatusAndOwner() {
        String first = taskToolService.addTask("alice", "first", null).path("task_id").asText();
        taskToolService.addTask("alice", "second", null);
        taskToolService.addTask("bob", "not mine", null);
        taskToolService.completeTask("alice", first);

        ObjectNode all = taskToolService.listTasks("alice", null);
        ObjectNode pending = taskToolService.listTasks("alice", "PENDING");
        ObjectNode completed = taskToolService.listTasks("alice", "completed");
        ObjectNode unknown = taskToolService.listTasks("alice", "someday");

        assertThat(all.path("count").asInt()).isEqualTo(2);
        assertThat(all.path("filter").asText()).isEqualTo("all");
        assertThat(pending.path("tasks")).extracting(t -> t.path("title").asText()).containsExactly("second");
        assertThat(completed.path("tasks").get(0).path("completed").asBoolean()).isTrue();
        assertThat(unknown.path("filter").asText()).isEqualTo("all");
    }

    @Test
    void otherUsersCannotCompleteTask() {
        String taskId = taskToolService.addTask("alice", "buy milk", null).path("task_id").asText();

        assertThatThrownBy(() -> taskToolService.completeTask("bob", taskId))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessage("Task not found");
        Task stored = taskRepository.findById(UUID.fromString(taskId)).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(TaskStatus.PENDING);
    }

    @Test
    void otherUsersCannotDeleteTask() {
        String taskId = taskToolService.addTask("alice", "buy milk", null).path("task_id").asText();

        assertThatThrownBy(() -> taskToolService.deleteTask("bob", taskId))
                .isInstanceOf(ToolExecutionException.class);
        assertThat(taskRepository.existsById(UUID.fromString(taskId))).isTrue();
    }

    @Test
    void malformedTaskIdReadsAsNotFound() {
        assertThatThrownBy(() -> taskToolService.completeTask("alice", "not-a-uuid"))
                .isInstanceOf(ToolExecutionException.class)
                .satisfies(e -> assertThat(((ToolExecutionException) e).payload().path("task_id").asText())
                        .isEqualTo("not-a-uuid"));
    }

    @Test
    void updateTaskReportsChangedFields() {
        String taskId = taskToolService.addTask("alice", "buy milk", null).path("task_id").asText();

        ObjectNode result = taskToolService.updateTask("alice", taskId, "buy oat milk", "2 litres");

        assertThat(result.path("status").asText()).isEqualTo("updated");
        JsonNode changes = result.path("changes");
        assertThat(changes).extracting(JsonNode::asText).containsExactly("title", "description");
        assertThat(taskRepository.findById(UUID.fromString(taskId)).orElseThrow().getTitle())
                .isEqualTo("buy oat milk");
    }

    @Test
    void updateTaskRejectsEmptyUpdates() {
        String taskId = taskToolService.addTask("alice", "buy milk", null).path("task_id").asText();

        assertThatThrownBy(() -> taskToolService.updateTask("alice", taskId, null, null))
                .hasMessage("No updates provided");
        assertThatThrownBy(() -> taskToolService.updateTask("alice", taskId, "   ", null))
                .hasMessage("No valid updates provided");
    }

    @Test
    void deleteTaskRemovesRow() {
        String taskId = taskToolService.addTask("alice", "buy milk", null).path("task_id").asText();

        ObjectNode result = taskToolService.deleteTask("alice", taskId);

        assertThat(result.path("status").asText()).isEqualTo("deleted");
        assertThat(result.path("title").asText()).isEqualTo("buy milk");
        assertThat(taskRepository.count()).isZero();
    }
}
