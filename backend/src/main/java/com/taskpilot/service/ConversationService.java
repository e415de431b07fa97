package com.taskpilot.service;

import com.taskpilot.exception.ForbiddenException;
import com.taskpilot.exception.NotFoundException;
import com.taskpilot.model.dto.ConversationDto;
import com.taskpilot.model.entity.Conversation;
import com.taskpilot.model.entity.Message;
import com.taskpilot.model.entity.MessageRole;
import com.taskpilot.repository.ConversationRepository;
import com.taskpilot.repository.MessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationService {

    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;

    /**
     * Resolves the conversation a chat turn writes to. Without an id a new conversation is created,
     * titled from the first {@value Conversation#TITLE_LENGTH} characters of {@code seedMessage}.
     *
     * @throws NotFoundException  if {@code conversationId} does not exist
     * @throws ForbiddenException if it belongs to another user
     */
    @Transactional
    public Conversation getOrCreate(Long conversationId, String ownerId, String seedMessage) {
        if (conversationId != null) {
            Conversation conversation = conversationRepository.findById(conversationId)
                    .orElseThrow(() -> new NotFoundException("Conversation not found"));
            if (!conversation.isOwnedBy(ownerId)) {
                throw new ForbiddenException("Access denied");
            }
            return conversation;
        }

        Conversation conversation = Conversation.builder()
                .ownerId(ownerId)
                .title(Conversation.deriveTitle(seedMessage))
                .updatedAt(OffsetDateTime.now())
                .build();
        conversation = conversationRepository.save(conversation);
        log.info("Created conversation {} for user {}", conversation.getId(), ownerId);
        return conversation;
    }

    @Transactional
    public Message appendMessage(Long conversationId, MessageRole role, String content) {
        Conversation conversation = lockConversation(conversationId);
        return append(conversation, role, content);
    }

    /**
     * Appends the user message of a new turn. If the newest stored message is a user message with the
     * same content, the previous turn ended without a reply and that message is reused.
     */
    @Transactional
    public Message appendUserMessage(Long conversationId, String content) {
        Conversation conversation = lockConversation(conversationId);
        Optional<Message> newest = messageRepository.findFirstByConversationIdOrderByCreatedAtDescIdDesc(conversationId);
        if (newest.isPresent()
                && newest.get().getRole() == MessageRole.USER
                && newest.get().getContent().equals(content)) {
            log.debug("Reusing unanswered user message {} in conversation {}", newest.get().getId(), conversationId);
            return newest.get();
        }
        return append(conversation, MessageRole.USER, content);
    }

    /**
     * @return the newest {@code limit} messages, oldest first
     */
    @Transactional(readOnly = true)
    public List<Message> loadHistory(Long conversationId, int limit) {
        List<Message> newestFirst = messageRepository.findByConversationIdOrderByCreatedAtDescIdDesc(
                conversationId, PageRequest.of(0, limit));
        List<Message> history = new ArrayList<>(newestFirst);
        Collections.reverse(history);
        return history;
    }

    @Transactional(readOnly = true)
    public List<ConversationDto> listForOwner(String ownerId) {
        List<Conversation> conversations = conversationRepository.findByOwnerIdOrderByUpdatedAtDescIdDesc(ownerId);
        Map<Long, Long> counts = countMessages(conversations);
        return conversations.stream()
                .map(c -> ConversationDto.builder()
                        .id(c.getId())
                        .title(c.getTitle())
                        .createdAt(c.getCreatedAt())
                        .updatedAt(c.getUpdatedAt())
                        .messageCount(counts.getOrDefault(c.getId(), 0L))
                        .build())
                .toList();
    }

    @Transactional(readOnly = true)
    public ConversationDto getWithMessages(Long conversationId, String ownerId) {
        Conversation conversation = findOwned(conversationId, ownerId);

        List<ConversationDto.MessageDto> messages = messageRepository
                .findByConversationIdOrderByCreatedAtAscIdAsc(conversationId)
                .stream()
                .map(m -> ConversationDto.MessageDto.builder()
                        .id(m.getId())
                        .role(m.getRole())
                        .content(m.getContent())
                        .createdAt(m.getCreatedAt())
                        .build())
                .toList();

        return ConversationDto.builder()
                .id(conversation.getId())
                .title(conversation.getTitle())
                .createdAt(conversation.getCreatedAt())
                .updatedAt(conversation.getUpdatedAt())
                .messages(messages)
                .build();
    }

    /**
     * Deletes the conversation and all of its messages.
     *
     * @return number of messages removed
     */
    @Transactional
    public long delete(Long conversationId, String ownerId) {
        // Same row lock as appends, so no message lands between the two deletes.
        Conversation conversation = conversationRepository.findByIdForUpdate(conversationId)
                .filter(c -> c.isOwnedBy(ownerId))
                .orElseThrow(() -> new NotFoundException("Conversation not found"));
        int deletedMessages = messageRepository.deleteByConversationId(conversationId);
        conversationRepository.delete(conversation);
        log.info("Deleted conversation {} ({} messages) for user {}", conversationId, deletedMessages, ownerId);
        return deletedMessages;
    }

    private Map<Long, Long> countMessages(List<Conversation> conversations) {
        if (conversations.isEmpty()) {
            return Map.of();
        }
        List<Long> ids = conversations.stream().map(Conversation::getId).toList();
        Map<Long, Long> counts = new HashMap<>();
        for (Object[] row : messageRepository.countGroupedByConversationId(ids)) {
            counts.put((Long) row[0], (Long) row[1]);
        }
        return counts;
    }

    // Not owned reads as missing.
    private Conversation findOwned(Long conversationId, String ownerId) {
        return conversationRepository.findByIdAndOwnerId(conversationId, ownerId)
                .orElseThrow(() -> new NotFoundException("Conversation not found"));
    }

    private Conversation lockConversation(Long conversationId) {
        return conversationRepository.findByIdForUpdate(conversationId)
                .orElseThrow(() -> new NotFoundException("Conversation not found"));
    }

    private Message append(Conversation conversation, MessageRole role, String content) {
        Message message = Message.builder()
                .conversationId(conversation.getId())
                .role(role)
                .content(content)
                .build();
        message = messageRepository.save(message);
        conversation.setUpdatedAt(OffsetDateTime.now());
        conversationRepository.save(conversation);
        return message;
    }
}
