package com.ai.coach.exception;

/**
 * Base of every failure the flow engine surfaces to its caller.
 */
public class ChatFlowException extends RuntimeException {

    public ChatFlowException(String message) {
        super(message);
    }

    public ChatFlowException(String message, Throwable cause) {
        super(message, cause);
    }
}
