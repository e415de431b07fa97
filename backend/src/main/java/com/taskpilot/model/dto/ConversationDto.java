package com.taskpilot.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.taskpilot.model.entity.MessageRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversationDto {
    private Long id;
    private String title;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
    private Long messageCount;
    private List<MessageDto> messages;

    @Data
    @Builder
    @AllArgsConstructor
    public static class MessageDto {
        private Long id;
        private MessageRole role;
        private String content;
        private OffsetDateTime createdAt;
    }
}
