package com.taskpilot.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
@AllArgsConstructor
public class ChatResponse {
    private Long conversationId;
    private String response;
    private List<ToolCallDto> toolCalls;
}
