package com.taskpilot.controller;

import com.taskpilot.model.dto.ChatRequest;
import com.taskpilot.model.dto.ChatResponse;
import com.taskpilot.security.CallerAccess;
import com.taskpilot.service.ChatService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/{userId}/chat")
@RequiredArgsConstructor
public class ChatController {

    private final ChatService chatService;

    @PostMapping
    public ResponseEntity<ChatResponse> chat(@PathVariable String userId,
                                             @AuthenticationPrincipal String callerId,
                                             @Valid @RequestBody ChatRequest request) {
        CallerAccess.requireSameUser(userId, callerId);
        return ResponseEntity.ok(chatService.chat(callerId, request));
    }
}
