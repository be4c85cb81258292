package com.ai.coach.exception;

/**
 * A cross-sequence switch failed. When {@link #isInconsistent()} is true the rollback load
 * failed too and the active sequence no longer matches {@link #getRestoredSequenceId()}.
 */
public class SequenceTransitionException extends ChatFlowException {

    private final String requestedSequenceId;
    private final String restoredSequenceId;
    private final boolean inconsistent;

    public SequenceTransitionException(String requestedSequenceId, String restoredSequenceId,
                                       boolean inconsistent, String message, Throwable cause) {
        super(message, cause);
        this.requestedSequenceId = requestedSequenceId;
        this.restoredSequenceId = restoredSequenceId;
        this.inconsistent = inconsistent;
    }

    public String getRequestedSequenceId() {
        return requestedSequenceId;
    }

    public String getRestoredSequenceId() {
        return restoredSequenceId;
    }

    public boolean isInconsistent() {
        return inconsistent;
    }
}
