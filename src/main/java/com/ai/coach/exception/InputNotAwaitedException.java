package com.ai.coach.exception;

/**
 * An answer named a message that is not the one the session is waiting on.
 */
public class InputNotAwaitedException extends ChatFlowException {

    private final int messageId;
    private final Integer awaitingMessageId;

    public InputNotAwaitedException(int messageId, Integer awaitingMessageId) {
        super("Message " + messageId + " is not awaiting input (awaiting " + awaitingMessageId + ")");
        this.messageId = messageId;
        this.awaitingMessageId = awaitingMessageId;
    }

    public int getMessageId() {
        return messageId;
    }

    public Integer getAwaitingMessageId() {
        return awaitingMessageId;
    }
}
