package com.ai.coach.dto;

import com.ai.coach.conversation.ChatMessage;
import com.ai.coach.conversation.FlowResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What a client receives after each turn: messages to display and whether an answer is expected.
 */
public final class FlowResponse {

    private final String sessionId;
    private final List<ChatMessage> messages;
    private final boolean awaitingInput;
    private final Integer interactionMessageId;
    private final String sequenceId;

    private FlowResponse(String sessionId, List<ChatMessage> messages, boolean awaitingInput,
                         Integer interactionMessageId, String sequenceId) {
        this.sessionId = sessionId;
        this.messages = messages == null ? Collections.emptyList() : new ArrayList<>(messages);
        this.awaitingInput = awaitingInput;
        this.interactionMessageId = interactionMessageId;
        this.sequenceId = sequenceId;
    }

    public static FlowResponse of(String sessionId, FlowResult result) {
        return new FlowResponse(sessionId, result.getMessages(), result.isAwaitingInput(),
                result.getInteractionMessageId(), result.getSequenceId());
    }

    public String getSessionId() {
        return sessionId;
    }

    public List<ChatMessage> getMessages() {
        return Collections.unmodifiableList(messages);
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
}
