package com.taskpilot.agent;

import java.util.List;

public record TurnResult(String responseText, List<ToolInvocation> toolTrace, int toolRounds, boolean limitReached) {

    public TurnResult {
        toolTrace = List.copyOf(toolTrace);
    }
}
