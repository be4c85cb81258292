package com.ai.coach.conversation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw outcome of one walk along {@code nextMessageId} links: the collected nodes
 * (unprocessed) and why the walk stopped.
 */
public final class TraversalResult {

    private final List<ChatMessage> messages;
    private final TraversalStopReason stopReason;
    private final Integer stopMessageId;
    private final String targetSequenceId;
    private final String errorMessage;

    private TraversalResult(List<ChatMessage> messages, TraversalStopReason stopReason,
                            Integer stopMessageId, String targetSequenceId, String errorMessage) {
        this.messages = messages == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(messages));
        this.stopReason = stopReason;
        this.stopMessageId = stopMessageId;
        this.targetSequenceId = targetSequenceId;
        this.errorMessage = errorMessage;
    }

    public static TraversalResult endOfSequence(List<ChatMessage> messages) {
        return new TraversalResult(messages, TraversalStopReason.END_OF_SEQUENCE, null, null, null);
    }

    public static TraversalResult interactive(List<ChatMessage> messages, int stopMessageId) {
        return new TraversalResult(messages, TraversalStopReason.INTERACTIVE_MESSAGE, stopMessageId, null, null);
    }

    public static TraversalResult autoroute(List<ChatMessage> messages, int stopMessageId) {
        return new TraversalResult(messages, TraversalStopReason.AUTOROUTE, stopMessageId, null, null);
    }

    public static TraversalResult sequenceTransition(List<ChatMessage> messages, int stopMessageId, String targetSequenceId) {
        return new TraversalResult(messages, TraversalStopReason.SEQUENCE_TRANSITION, stopMessageId, targetSequenceId, null);
    }

    public static TraversalResult error(List<ChatMessage> messages, String errorMessage) {
        return new TraversalResult(messages, TraversalStopReason.MAX_DEPTH_REACHED, null, null, errorMessage);
    }

    public List<ChatMessage> getMessages() {
        return messages;
    }

    public TraversalStopReason getStopReason() {
        return stopReason;
    }

    public Integer getStopMessageId() {
        return stopMessageId;
    }

    public String getTargetSequenceId() {
        return targetSequenceId;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public boolean isSuccess() {
        return stopReason != TraversalStopReason.MAX_DEPTH_REACHED;
    }

    public boolean requiresSequenceTransition() {
        return stopReason == TraversalStopReason.SEQUENCE_TRANSITION;
    }

    public boolean isAwaitingInput() {
        return stopReason == TraversalStopReason.INTERACTIVE_MESSAGE;
    }

    @Override
    public String toString() {
        return "TraversalResult(messages=" + messages.size() + ", stopReason=" + stopReason
                + ", stopMessageId=" + stopMessageId + ", targetSequenceId=" + targetSequenceId + ")";
    }
}
