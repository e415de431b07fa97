package com.taskpilot.service;

import com.taskpilot.model.dto.UsageSummaryDto;
import com.taskpilot.model.entity.UsageLog;
import com.taskpilot.repository.UsageLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;

@Service
@RequiredArgsConstructor
@Slf4j
public class UsageTrackingService {

    private final UsageLogRepository usageLogRepository;

    public void record(String userId, Long conversationId, String model,
                       int toolCallCount, int toolRounds, long responseTimeMs, String status) {
        UsageLog usageLog = UsageLog.builder()
                .userId(userId)
                .conversationId(conversationId)
                .model(model)
                .toolCallCount(toolCallCount)
                .toolRounds(toolRounds)
                .responseTimeMs(responseTimeMs)
                .status(status)
                .build();
        try {
            usageLogRepository.save(usageLog);
        } catch (RuntimeException e) {
            // A lost usage row must not fail the turn.
            log.warn("Failed to record usage for conversation {}: {}", conversationId, e.getMessage());
        }
    }

    public UsageSummaryDto getUserUsageSummary(String userId, int days) {
        OffsetDateTime since = OffsetDateTime.now().minusDays(days);

        return UsageSummaryDto.builder()
                .totalTurns(usageLogRepository.countByUserIdSince(userId, since))
                .failedTurns(usageLogRepository.countByUserIdAndStatusSince(userId, UsageLog.STATUS_ERROR, since))
                .totalToolCalls(usageLogRepository.sumToolCallsByUserIdSince(userId, since))
                .avgResponseTimeMs(usageLogRepository.avgResponseTimeMsByUserIdSince(userId, since))
                .build();
    }
}
