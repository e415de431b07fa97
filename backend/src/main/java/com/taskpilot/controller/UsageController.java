package com.taskpilot.controller;

import com.taskpilot.model.dto.UsageSummaryDto;
import com.taskpilot.security.CallerAccess;
import com.taskpilot.service.UsageTrackingService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/{userId}/usage")
@RequiredArgsConstructor
@Validated
public class UsageController {

    private final UsageTrackingService usageTrackingService;

    @GetMapping("/summary")
    public ResponseEntity<UsageSummaryDto> summary(
            @PathVariable String userId,
            @AuthenticationPrincipal String callerId,
            @RequestParam(defaultValue = "30") @Min(1) @Max(365) int days) {
        CallerAccess.requireSameUser(userId, callerId);
        return ResponseEntity.ok(usageTrackingService.getUserUsageSummary(callerId, days));
    }
}
