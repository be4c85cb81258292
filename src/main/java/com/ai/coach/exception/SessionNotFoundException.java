package com.ai.coach.exception;

public class SessionNotFoundException extends ChatFlowException {

    public SessionNotFoundException(String sessionId) {
        super("Unknown chat session: " + sessionId);
    }
}
