package com.ai.coach.conversation;

/**
 * States of the flow orchestrator. ERROR always resolves back to IDLE once the failure is surfaced.
 */
public enum FlowState {
    IDLE,
    TRAVERSING,
    PROCESSING_ROUTES,
    PROCESSING_MESSAGES,
    TRANSITIONING_SEQUENCE,
    AWAITING_INPUT,
    ERROR
}
