package com.ai.coach.conversation;

/**
 * Where an autoroute node sends the flow. {@code nextMessageId} is relative to the sequence
 * that is active after the decision; null ends the traversal.
 */
public final class RouteDecision {

    private final Integer nextMessageId;
    private final String switchedToSequenceId;

    private RouteDecision(Integer nextMessageId, String switchedToSequenceId) {
        this.nextMessageId = nextMessageId;
        this.switchedToSequenceId = switchedToSequenceId;
    }

    public static RouteDecision continueAt(Integer nextMessageId) {
        return new RouteDecision(nextMessageId, null);
    }

    public static RouteDecision switchedSequence(String sequenceId, Integer entryMessageId) {
        return new RouteDecision(entryMessageId, sequenceId);
    }

    public Integer getNextMessageId() {
        return nextMessageId;
    }

    public String getSwitchedToSequenceId() {
        return switchedToSequenceId;
    }

    public boolean isSequenceSwitch() {
        return switchedToSequenceId != null;
    }

    public boolean isEnd() {
        return nextMessageId == null;
    }

    @Override
    public String toString() {
        return isSequenceSwitch()
                ? "RouteDecision(sequence=" + switchedToSequenceId + ", next=" + nextMessageId + ")"
                : "RouteDecision(next=" + nextMessageId + ")";
    }
}
