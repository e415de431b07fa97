package com.taskpilot.service;

import com.taskpilot.agent.AgentOrchestrator;
import com.taskpilot.agent.ToolInvocation;
import com.taskpilot.agent.TurnResult;
import com.taskpilot.exception.ChatTurnFailedException;
import com.taskpilot.exception.InvalidRequestException;
import com.taskpilot.exception.ModelInvocationException;
import com.taskpilot.model.dto.ChatRequest;
import com.taskpilot.model.dto.ChatResponse;
import com.taskpilot.model.dto.ToolCallDto;
import com.taskpilot.model.entity.Conversation;
import com.taskpilot.model.entity.Message;
import com.taskpilot.model.entity.MessageRole;
import com.taskpilot.model.entity.UsageLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Sequences one chat turn: persist the user message, run the agent, persist the reply.
 */
@Service
@Slf4j
public class ChatService {

    private final ConversationService conversationService;
    private final ConversationLockService lockService;
    private final AgentOrchestrator orchestrator;
    private final UsageTrackingService usageTrackingService;
    private final int historyLimit;

    public ChatService(ConversationService conversationService,
                       ConversationLockService lockService,
                       AgentOrchestrator orchestrator,
                       UsageTrackingService usageTrackingService,
                       @Value("${app.agent.history-limit:100}") int historyLimit) {
        this.conversationService = conversationService;
        this.lockService = lockService;
        this.orchestrator = orchestrator;
        this.usageTrackingService = usageTrackingService;
        this.historyLimit = historyLimit;
    }

    public ChatResponse chat(String userId, ChatRequest request) {
        String message = validateMessage(request.getMessage());

        Conversation conversation = conversationService.getOrCreate(request.getConversationId(), userId, message);
        Long conversationId = conversation.getId();

        return lockService.withLock(conversationId, () -> runTurn(userId, conversationId, message));
    }

    private ChatResponse runTurn(String userId, Long conversationId, String message) {
        long startTime = System.currentTimeMillis();

        conversationService.appendUserMessage(conversationId, message);
        List<Message> history = conversationService.loadHistory(conversationId, historyLimit);
        log.info("Turn started in conversation {} with {} message(s) of history", conversationId, history.size());

        TurnResult turn;
        try {
            turn = orchestrator.runTurn(userId, history);
        } catch (ModelInvocationException e) {
            usageTrackingService.record(userId, conversationId, orchestrator.modelName(),
                    0, 0, System.currentTimeMillis() - startTime, UsageLog.STATUS_ERROR);
            throw new ChatTurnFailedException(conversationId, e);
        }

        conversationService.appendMessage(conversationId, MessageRole.ASSISTANT, turn.responseText());

        usageTrackingService.record(userId, conversationId, orchestrator.modelName(),
                turn.toolTrace().size(), turn.toolRounds(), System.currentTimeMillis() - startTime,
                turn.limitReached() ? UsageLog.STATUS_LIMIT_REACHED : UsageLog.STATUS_SUCCESS);

        return ChatResponse.builder()
                .conversationId(conversationId)
                .response(turn.responseText())
                .toolCalls(turn.toolTrace().stream().map(ChatService::toDto).toList())
                .build();
    }

    private static String validateMessage(String raw) {
        String message = raw != null ? raw.strip() : "";
        if (message.isEmpty()) {
            throw new InvalidRequestException("Message cannot be empty");
        }
        if (message.length() > ChatRequest.MAX_MESSAGE_LENGTH) {
            throw new InvalidRequestException("Message too long (max " + ChatRequest.MAX_MESSAGE_LENGTH + " characters)");
        }
        return message;
    }

    private static ToolCallDto toDto(ToolInvocation invocation) {
        return ToolCallDto.builder()
                .name(invocation.name())
                .arguments(invocation.arguments())
                .result(invocation.result())
                .build();
    }
}
