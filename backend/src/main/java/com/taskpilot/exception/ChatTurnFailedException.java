package com.taskpilot.exception;

import lombok.Getter;

/**
 * A chat turn aborted after its user message was stored. Carries the conversation id so the
 * client can resend into the same conversation.
 */
@Getter
public class ChatTurnFailedException extends RuntimeException {

    private final Long conversationId;

    public ChatTurnFailedException(Long conversationId, Throwable cause) {
        super("Chat turn failed in conversation " + conversationId, cause);
        this.conversationId = conversationId;
    }
}
