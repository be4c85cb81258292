package com.ai.coach.exception;

public class FlowTraversalException extends ChatFlowException {

    public FlowTraversalException(String message) {
        super(message);
    }
}
