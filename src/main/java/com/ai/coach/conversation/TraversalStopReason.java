package com.ai.coach.conversation;

/**
 * Why a traversal stopped.
 */
public enum TraversalStopReason {
    /** Reached a choice or textInput node. */
    INTERACTIVE_MESSAGE,
    /** Reached an autoroute node; the route processor picks the continuation. */
    AUTOROUTE,
    /** No successor, or the successor id is not in the sequence. */
    END_OF_SEQUENCE,
    /** A node names another sequence. */
    SEQUENCE_TRANSITION,
    /** Depth budget exhausted, most likely a nextMessageId cycle. */
    MAX_DEPTH_REACHED
}
