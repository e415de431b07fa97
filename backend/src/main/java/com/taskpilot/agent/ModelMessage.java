package com.taskpilot.agent;

import com.taskpilot.tools.ToolRequest;

import java.util.List;

/**
 * One entry of the context window sent to the model.
 */
public record ModelMessage(Role role, String content, List<ToolRequest> toolRequests, String toolCallId) {

    public enum Role {
        SYSTEM, USER, ASSISTANT, TOOL
    }

    public static ModelMessage system(String content) {
        return new ModelMessage(Role.SYSTEM, content, List.of(), null);
    }

    public static ModelMessage user(String content) {
        return new ModelMessage(Role.USER, content, List.of(), null);
    }

    public static ModelMessage assistant(String content) {
        return new ModelMessage(Role.ASSISTANT, content, List.of(), null);
    }

    public static ModelMessage assistantToolCalls(String content, List<ToolRequest> toolRequests) {
        return new ModelMessage(Role.ASSISTANT, content, List.copyOf(toolRequests), null);
    }

    public static ModelMessage toolResult(String toolCallId, String content) {
        return new ModelMessage(Role.TOOL, content, List.of(), toolCallId);
    }
}
