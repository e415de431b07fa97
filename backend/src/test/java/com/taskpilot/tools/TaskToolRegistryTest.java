package com.taskpilot.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TaskToolRegistryTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private TaskToolService taskToolService;

    private TaskToolRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new TaskToolRegistry(taskToolService);
    }

    @Test
    void catalogueListsEveryTool() {
        List<ToolSpec> catalogue = registry.catalogue();

        assertThat(catalogue).extracting(ToolSpec::name)
                .containsExactly("add_task", "list_tasks", "complete_task", "update_task", "delete_task");
    }

    @Test
    void schemasNeverExposeUserId() {
        for (ToolSpec spec : registry.catalogue()) {
            assertThat(spec.parameters().path("properties").has("user_id"))
                    .as(spec.name())
                    .isFalse();
            assertThat(spec.parameters().path("type").asText()).isEqualTo("object");
        }
    }

    @Test
    void addTaskUsesBoundUserIdAndIgnoresModelSuppliedOne() {
        ObjectNode created = JsonNodeFactory.instance.objectNode().put("status", "created");
        when(taskToolService.addTask("alice", "buy milk", null)).thenReturn(created);

        ToolResult result = registry.invoke("alice",
                request("add_task", "{\"title\":\"buy milk\",\"user_id\":\"bob\"}"));

        assertThat(result.success()).isTrue();
        assertThat(result.payload().path("status").asText()).isEqualTo("created");
        verify(taskToolService).addTask("alice", "buy milk", null);
        verify(taskToolService, never()).addTask(eq("bob"), any(), any());
    }

    @Test
    void dispatchesEachToolToMatchingOperation() {
        ObjectNode ok = JsonNodeFactory.instance.objectNode();
        when(taskToolService.listTasks("alice", "pending")).thenReturn(ok);
        when(taskToolService.completeTask("alice", "t1")).thenReturn(ok);
        when(taskToolService.updateTask("alice", "t1", "new", null)).thenReturn(ok);
        when(taskToolService.deleteTask("alice", "t1")).thenReturn(ok);

        assertThat(registry.invoke("alice", request("list_tasks", "{\"status\":\"pending\"}")).success()).isTrue();
        assertThat(registry.invoke("alice", request("complete_task", "{\"task_id\":\"t1\"}")).success()).isTrue();
        assertThat(registry.invoke("alice", request("update_task", "{\"task_id\":\"t1\",\"title\":\"new\"}")).success()).isTrue();
        assertThat(registry.invoke("alice", request("delete_task", "{\"task_id\":\"t1\"}")).success()).isTrue();
    }

    @Test
    void unknownToolBecomesErrorPayload() {
        ToolResult result = registry.invoke("alice", request("drop_database", "{}"));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Unknown tool");
        verifyNoInteractions(taskToolService);
    }

    @Test
    void malformedArgumentsBecomeErrorPayload() {
        ToolResult result = registry.invoke("alice", new ToolRequest("call_1", "add_task", null, "{oops"));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Invalid arguments");
        verifyNoInteractions(taskToolService);
    }

    @Test
    void toolExecutionErrorBecomesErrorPayload() {
        when(taskToolService.completeTask("alice", "missing"))
                .thenThrow(ToolExecutionException.taskNotFound("missing"));

        ToolResult result = registry.invoke("alice", request("complete_task", "{\"task_id\":\"missing\"}"));

        assertThat(result.success()).isFalse();
        assertThat(result.payload().path("error").asText()).isEqualTo("Task not found");
        assertThat(result.payload().path("task_id").asText()).isEqualTo("missing");
    }

    @Test
    void persistenceFailureDoesNotEscapeRegistry() {
        when(taskToolService.listTasks(anyString(), any()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        ToolResult result = registry.invoke("alice", request("list_tasks", "{}"));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Failed to run list_tasks");
        assertThat(result.payload().toString()).doesNotContain("connection refused");
    }

    private static ToolRequest request(String name, String rawArguments) {
        try {
            JsonNode arguments = MAPPER.readTree(rawArguments);
            return new ToolRequest("call_1", name, arguments, rawArguments);
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }
}
