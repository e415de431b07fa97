package com.taskpilot.model.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class ToolCallDto {
    private String name;
    private JsonNode arguments;
    private JsonNode result;
}
