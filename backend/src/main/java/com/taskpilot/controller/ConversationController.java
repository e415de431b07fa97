package com.taskpilot.controller;

import com.taskpilot.model.dto.ConversationDto;
import com.taskpilot.model.dto.ConversationListResponse;
import com.taskpilot.model.dto.DeleteConversationResponse;
import com.taskpilot.security.CallerAccess;
import com.taskpilot.service.ConversationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/{userId}/conversations")
@RequiredArgsConstructor
public class ConversationController {

    private final ConversationService conversationService;

    @GetMapping
    public ResponseEntity<ConversationListResponse> list(@PathVariable String userId,
                                                        @AuthenticationPrincipal String callerId) {
        CallerAccess.requireSameUser(userId, callerId);
        return ResponseEntity.ok(new ConversationListResponse(conversationService.listForOwner(callerId)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ConversationDto> get(@PathVariable String userId,
                                               @PathVariable Long id,
                                               @AuthenticationPrincipal String callerId) {
        CallerAccess.requireSameUser(userId, callerId);
        return ResponseEntity.ok(conversationService.getWithMessages(id, callerId));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<DeleteConversationResponse> delete(@PathVariable String userId,
                                                             @PathVariable Long id,
                                                             @AuthenticationPrincipal String callerId) {
        CallerAccess.requireSameUser(userId, callerId);
        long deleted = conversationService.delete(id, callerId);
        return ResponseEntity.ok(DeleteConversationResponse.builder()
                .success(true)
                .deletedConversationId(id)
                .deletedMessageCount(deleted)
                .build());
    }
}
