package com.taskpilot.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class ConversationListResponse {
    private List<ConversationDto> conversations;
}
