package com.ai.coach.exception;

/**
 * A sequence document could not be read, parsed or failed structural validation.
 */
public class SequenceLoadException extends ChatFlowException {

    private final String sequenceId;

    public SequenceLoadException(String sequenceId, String message) {
        super(message);
        this.sequenceId = sequenceId;
    }

    public SequenceLoadException(String sequenceId, String message, Throwable cause) {
        super(message, cause);
        this.sequenceId = sequenceId;
    }

    public String getSequenceId() {
        return sequenceId;
    }
}
