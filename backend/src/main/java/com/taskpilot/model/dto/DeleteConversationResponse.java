package com.taskpilot.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class DeleteConversationResponse {
    private boolean success;
    private Long deletedConversationId;
    private long deletedMessageCount;
}
