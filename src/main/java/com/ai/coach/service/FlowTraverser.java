package com.ai.coach.service;

import com.ai.coach.conversation.ChatMessage;
import com.ai.coach.conversation.ChatSequence;
import com.ai.coach.conversation.TraversalResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Walks {@code nextMessageId} links inside the active sequence and collects nodes without
 * processing them. Stops at the first interactive node, autoroute node, cross-sequence jump
 * or dead end.
 */
public class FlowTraverser {

    private static final Logger log = LoggerFactory.getLogger(FlowTraverser.class);

    private final String sessionId;
    private final SequenceTransitionManager transitionManager;
    private final int maxDepth;

    public FlowTraverser(String sessionId, SequenceTransitionManager transitionManager, int maxDepth) {
        this.sessionId = sessionId;
        this.transitionManager = transitionManager;
        this.maxDepth = maxDepth;
    }

    public TraversalResult traverse(int startId) {
        ChatSequence sequence = transitionManager.getCurrentSequence();
        List<ChatMessage> collected = new ArrayList<>();
        if (sequence == null) {
            log.warn("[{}] No active sequence, nothing to traverse", sessionId);
            return TraversalResult.endOfSequence(collected);
        }

        Integer currentId = startId;
        for (int depth = 0; depth < maxDepth; depth++) {
            Optional<ChatMessage> found = sequence.getMessage(currentId);
            if (found.isEmpty()) {
                log.warn("[{}] Message {} not found in '{}', ending traversal", sessionId, currentId, sequence.getSequenceId());
                return TraversalResult.endOfSequence(collected);
            }
            ChatMessage node = found.get();
            collected.add(node);

            if (node.isInteractive()) {
                return TraversalResult.interactive(collected, node.getId());
            }
            if (node.isAutoRoute()) {
                return TraversalResult.autoroute(collected, node.getId());
            }
            if (node.getSequenceId() != null) {
                return TraversalResult.sequenceTransition(collected, node.getId(), node.getSequenceId());
            }
            if (node.getNextMessageId() == null) {
                return TraversalResult.endOfSequence(collected);
            }
            currentId = node.getNextMessageId();
        }

        log.error("[{}] Traversal from {} in '{}' exceeded {} steps", sessionId, startId, sequence.getSequenceId(), maxDepth);
        return TraversalResult.error(collected, "Traversal exceeded " + maxDepth + " messages starting at " + startId);
    }
}
