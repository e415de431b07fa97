package com.taskpilot.agent;

import com.taskpilot.tools.ToolRequest;

import java.util.List;

public record ModelReply(String text, List<ToolRequest> toolRequests) {

    public ModelReply {
        toolRequests = toolRequests == null ? List.of() : List.copyOf(toolRequests);
    }

    public static ModelReply text(String text) {
        return new ModelReply(text, List.of());
    }

    public static ModelReply toolCalls(List<ToolRequest> toolRequests) {
        return new ModelReply(null, toolRequests);
    }

    public boolean hasToolRequests() {
        return !toolRequests.isEmpty();
    }
}
