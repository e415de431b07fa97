package com.taskpilot.service;

import com.taskpilot.exception.ConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes chat turns per conversation within this instance. Entries are dropped once no turn
 * holds or waits for them.
 */
@Service
@Slf4j
public class ConversationLockService {

    private final Map<Long, LockHolder> locks = new ConcurrentHashMap<>();
    private final long timeoutSeconds;

    public ConversationLockService(@Value("${app.agent.turn-lock-timeout-seconds:120}") long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * Runs {@code action} while holding the conversation's turn lock.
     *
     * @throws ConflictException if the lock is not acquired within the configured timeout
     */
    public <T> T withLock(Long conversationId, Supplier<T> action) {
        LockHolder holder = locks.compute(conversationId, (id, existing) -> {
            LockHolder h = existing != null ? existing : new LockHolder();
            h.users++;
            return h;
        });
        try {
            acquire(conversationId, holder);
            try {
                return action.get();
            } finally {
                holder.lock.unlock();
            }
        } finally {
            locks.computeIfPresent(conversationId, (id, h) -> --h.users == 0 ? null : h);
        }
    }

    boolean isLocked(Long conversationId) {
        LockHolder holder = locks.get(conversationId);
        return holder != null && holder.lock.isLocked();
    }

    int trackedConversations() {
        return locks.size();
    }

    private void acquire(Long conversationId, LockHolder holder) {
        boolean acquired;
        try {
            acquired = holder.lock.tryLock(timeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConflictException("Conversation is busy");
        }
        if (!acquired) {
            log.warn("Timed out after {}s waiting for conversation {}", timeoutSeconds, conversationId);
            throw new ConflictException("Conversation is busy");
        }
    }

    private static final class LockHolder {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }
}
