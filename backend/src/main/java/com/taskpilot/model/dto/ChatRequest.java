package com.taskpilot.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {
    public static final int MAX_MESSAGE_LENGTH = 4000;

    @NotBlank(message = "Message is required")
    @Size(max = MAX_MESSAGE_LENGTH, message = "Message too long")
    private String message;

    private Long conversationId;
}
