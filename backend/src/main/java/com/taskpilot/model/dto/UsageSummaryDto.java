package com.taskpilot.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class UsageSummaryDto {
    private Long totalTurns;
    private Long failedTurns;
    private Long totalToolCalls;
    private Double avgResponseTimeMs;
}
