package com.taskpilot.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.taskpilot.exception.ModelInvocationException;
import com.taskpilot.model.entity.Message;
import com.taskpilot.model.entity.MessageRole;
import com.taskpilot.tools.TaskToolRegistry;
import com.taskpilot.tools.ToolRequest;
import com.taskpilot.tools.ToolResult;
import com.taskpilot.tools.ToolSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the model/tool loop of one chat turn.
 * <p>
 * {@code AWAITING_MODEL -> EVALUATING_OUTPUT -> RESPONDING | INVOKING_TOOLS -> AWAITING_MODEL ... -> DONE}
 * <p>
 * Tool requests are executed one after another in the order the model listed them, always with the
 * caller's user id. Tool failures are fed back to the model as data; only a failing model call
 * aborts the turn. Persistence is the caller's job.
 */
@Service
@Slf4j
public class AgentOrchestrator {

    static final String EMPTY_REPLY_FALLBACK = "I apologize, but I couldn't process that request.";

    enum TurnState {
        AWAITING_MODEL,
        EVALUATING_OUTPUT,
        INVOKING_TOOLS,
        RESPONDING,
        DONE
    }

    private final ModelClient modelClient;
    private final TaskToolRegistry toolRegistry;
    private final int maxToolRounds;

    public AgentOrchestrator(ModelClient modelClient,
            TaskToolRegistry toolRegistry,
            @Value("${app.agent.max-tool-rounds:10}") int maxToolRounds) {
        if (maxToolRounds < 1) {
            throw new IllegalArgumentException("app.agent.max-tool-rounds must be at least 1");
        }
        this.modelClient = modelClient;
        this.toolRegistry = toolRegistry;
        this.maxToolRounds = maxToolRounds;
    }

    public String modelName() {
        return modelClient.modelName();
    }

    /**
     * @param userId  authenticated caller; the only user id any tool ever sees
     * @param history persisted transcript window, oldest first, ending with the current user message
     */
    public TurnResult runTurn(String userId, List<Message> history) {
        List<ModelMessage> context = new ArrayList<>();
        context.add(ModelMessage.system(AgentInstructions.SYSTEM_PROMPT));
        for (Message message : history) {
            context.add(message.getRole() == MessageRole.USER
                    ? ModelMessage.user(message.getContent())
                    : ModelMessage.assistant(message.getContent()));
        }

        List<ToolSpec> catalogue = toolRegistry.catalogue();
        List<ToolInvocation> trace = new ArrayList<>();
        int rounds = 0;
        boolean limitReached = false;
        ModelReply reply = null;
        String responseText = null;

        TurnState state = TurnState.AWAITING_MODEL;
        while (state != TurnState.DONE) {
            switch (state) {
                case AWAITING_MODEL -> {
                    reply = callModel(context, catalogue);
                    state = TurnState.EVALUATING_OUTPUT;
                }
                case EVALUATING_OUTPUT -> state = reply.hasToolRequests()
                        ? TurnState.INVOKING_TOOLS
                        : TurnState.RESPONDING;
                case INVOKING_TOOLS -> {
                    if (rounds >= maxToolRounds) {
                        log.warn("Tool round limit ({}) reached for user {}; {} pending request(s) dropped",
                                maxToolRounds, userId, reply.toolRequests().size());
                        limitReached = true;
                        responseText = limitMessage();
                        state = TurnState.DONE;
                    } else {
                        rounds++;
                        executeTools(userId, reply, context, trace);
                        state = TurnState.AWAITING_MODEL;
                    }
                }
                case RESPONDING -> {
                    String text = reply.text();
                    responseText = text != null && !text.isBlank() ? text.strip() : EMPTY_REPLY_FALLBACK;
                    state = TurnState.DONE;
                }
                default -> throw new IllegalStateException("Unexpected turn state " + state);
            }
        }

        long failedTools = trace.stream().filter(invocation -> !invocation.success()).count();
        log.info("Turn finished for user {}: rounds={}, toolCalls={}, failedToolCalls={}, limitReached={}",
                userId, rounds, trace.size(), failedTools, limitReached);
        return new TurnResult(responseText, trace, rounds, limitReached);
    }

    private ModelReply callModel(List<ModelMessage> context, List<ToolSpec> catalogue) {
        ModelReply reply;
        try {
            reply = modelClient.complete(List.copyOf(context), catalogue);
        } catch (ModelInvocationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ModelInvocationException("Model client failed: " + e.getMessage(), e);
        }
        if (reply == null) {
            throw new ModelInvocationException("Model client returned no reply");
        }
        return reply;
    }

    private void executeTools(String userId, ModelReply reply, List<ModelMessage> context,
            List<ToolInvocation> trace) {
        context.add(ModelMessage.assistantToolCalls(reply.text(), reply.toolRequests()));
        for (ToolRequest request : reply.toolRequests()) {
            ToolResult result = toolRegistry.invoke(userId, request);
            if (!result.success()) {
                log.debug("Tool {} returned an error to the model: {}", request.name(), result.error());
            }
            trace.add(new ToolInvocation(request.name(), traceArguments(request), result.payload(), result.success()));
            context.add(ModelMessage.toolResult(request.id(), result.payload().toString()));
        }
    }

    private static JsonNode traceArguments(ToolRequest request) {
        if (request.arguments() != null) {
            return request.arguments();
        }
        return request.rawArguments() != null ? TextNode.valueOf(request.rawArguments()) : null;
    }

    private String limitMessage() {
        return "I had to stop after " + maxToolRounds + " rounds of task operations for this message. "
                + "Any changes made so far are saved. Send another message if you'd like me to continue.";
    }
}
