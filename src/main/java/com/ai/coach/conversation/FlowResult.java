package com.ai.coach.conversation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fully processed output of one orchestrator run: the messages to display, in order, and
 * whether the conversation now waits for the user.
 */
public final class FlowResult {

    private final List<ChatMessage> messages;
    private final boolean awaitingInput;
    private final Integer interactionMessageId;
    private final String sequenceId;

    private FlowResult(List<ChatMessage> messages, boolean awaitingInput, Integer interactionMessageId, String sequenceId) {
        this.messages = messages == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(messages));
        this.awaitingInput = awaitingInput;
        this.interactionMessageId = interactionMessageId;
        this.sequenceId = sequenceId;
    }

    public static FlowResult completed(List<ChatMessage> messages, String sequenceId) {
        return new FlowResult(messages, false, null, sequenceId);
    }

    public static FlowResult awaitingInput(List<ChatMessage> messages, int interactionMessageId, String sequenceId) {
        return new FlowResult(messages, true, interactionMessageId, sequenceId);
    }

    public static FlowResult empty(String sequenceId) {
        return new FlowResult(null, false, null, sequenceId);
    }

    public List<ChatMessage> getMessages() {
        return messages;
    }

    public boolean isAwaitingInput() {
        return awaitingInput;
    }

    public Integer getInteractionMessageId() {
        return interactionMessageId;
    }

    public String getSequenceId() {
        return sequenceId;
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    @Override
    public String toString() {
        return "FlowResult(messages=" + messages.size() + ", awaitingInput=" + awaitingInput
                + ", interactionMessageId=" + interactionMessageId + ", sequenceId=" + sequenceId + ")";
    }
}
