package com.ai.coach.service;

import com.ai.coach.conversation.ChatMessage;
import com.ai.coach.conversation.ChatSequence;
import com.ai.coach.conversation.FlowResult;
import com.ai.coach.conversation.FlowState;
import com.ai.coach.conversation.RouteDecision;
import com.ai.coach.conversation.TraversalResult;
import com.ai.coach.exception.FlowTraversalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives one session's flow: traverse, apply data actions, resolve autoroutes, follow
 * cross-sequence jumps and render, until the user has to answer or the graph ends.
 * <p>
 * Not thread-safe. A call made while a run is in progress returns an empty result.
 */
public class FlowOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(FlowOrchestrator.class);

    private final String sessionId;
    private final FlowTraverser traverser;
    private final RouteProcessor routeProcessor;
    private final DataActionProcessor dataActionProcessor;
    private final SequenceTransitionManager transitionManager;
    private final MessageRenderer renderer;
    private final int maxProcessingCycles;

    private FlowState state = FlowState.IDLE;
    private boolean processing;
    private Integer awaitingMessageId;

    public FlowOrchestrator(String sessionId,
                            FlowTraverser traverser,
                            RouteProcessor routeProcessor,
                            DataActionProcessor dataActionProcessor,
                            SequenceTransitionManager transitionManager,
                            MessageRenderer renderer,
                            int maxProcessingCycles) {
        this.sessionId = sessionId;
        this.traverser = traverser;
        this.routeProcessor = routeProcessor;
        this.dataActionProcessor = dataActionProcessor;
        this.transitionManager = transitionManager;
        this.renderer = renderer;
        this.maxProcessingCycles = maxProcessingCycles;
    }

    public FlowState getState() {
        return state;
    }

    public Integer getAwaitingMessageId() {
        return awaitingMessageId;
    }

    /**
     * Runs the flow from {@code startId} in the active sequence.
     */
    public FlowResult processFlow(int startId) {
        return run(startId, null);
    }

    /**
     * Switches to {@code sequenceId} and runs the flow from its first message.
     */
    public FlowResult processFlowInSequence(String sequenceId) {
        return run(null, sequenceId);
    }

    /**
     * Ends the conversation without traversing, e.g. after an answer with no continuation.
     */
    public FlowResult finish() {
        if (processing) {
            return FlowResult.empty(transitionManager.getCurrentSequenceId());
        }
        state = FlowState.IDLE;
        awaitingMessageId = null;
        return FlowResult.completed(new ArrayList<>(), transitionManager.getCurrentSequenceId());
    }

    private FlowResult run(Integer startId, String switchToSequenceId) {
        if (processing) {
            log.warn("[{}] Flow already in progress, ignoring request", sessionId);
            return FlowResult.empty(transitionManager.getCurrentSequenceId());
        }
        processing = true;
        awaitingMessageId = null;
        try {
            Integer nextId = startId;
            if (switchToSequenceId != null) {
                nextId = switchSequence(switchToSequenceId);
            }
            FlowResult result = loop(nextId);
            log.info("[{}] Flow finished: {}", sessionId, result);
            return result;
        } catch (RuntimeException e) {
            state = FlowState.ERROR;
            log.error("[{}] Flow failed in sequence '{}': {}", sessionId, transitionManager.getCurrentSequenceId(), e.getMessage());
            throw e;
        } finally {
            if (state != FlowState.AWAITING_INPUT) {
                state = FlowState.IDLE;
            }
            processing = false;
        }
    }

    private FlowResult loop(Integer startId) {
        List<ChatMessage> output = new ArrayList<>();
        Integer nextId = startId;

        for (int cycle = 0; cycle < maxProcessingCycles; cycle++) {
            if (nextId == null) {
                return FlowResult.completed(output, transitionManager.getCurrentSequenceId());
            }
            state = FlowState.TRAVERSING;
            TraversalResult traversal = traverser.traverse(nextId);
            log.debug("[{}] {}", sessionId, traversal);
            if (!traversal.isSuccess()) {
                throw new FlowTraversalException(traversal.getErrorMessage());
            }

            state = FlowState.PROCESSING_MESSAGES;
            ChatMessage last = null;
            for (ChatMessage node : traversal.getMessages()) {
                last = node;
                if (node.isDataAction()) {
                    dataActionProcessor.processActions(node.getDataActions());
                } else if (node.isDisplayable()) {
                    output.addAll(renderer.render(node));
                }
            }

            switch (traversal.getStopReason()) {
                case INTERACTIVE_MESSAGE:
                    state = FlowState.AWAITING_INPUT;
                    awaitingMessageId = traversal.getStopMessageId();
                    return FlowResult.awaitingInput(output, awaitingMessageId, transitionManager.getCurrentSequenceId());
                case AUTOROUTE:
                    state = FlowState.PROCESSING_ROUTES;
                    RouteDecision decision = routeProcessor.processAutoRoute(last);
                    log.debug("[{}] Autoroute {} -> {}", sessionId, last.getId(), decision);
                    nextId = decision.getNextMessageId();
                    break;
                case SEQUENCE_TRANSITION:
                    nextId = switchSequence(traversal.getTargetSequenceId());
                    break;
                case END_OF_SEQUENCE:
                default:
                    return FlowResult.completed(output, transitionManager.getCurrentSequenceId());
            }
        }
        throw new FlowTraversalException("Flow did not settle within " + maxProcessingCycles + " processing cycles");
    }

    private Integer switchSequence(String sequenceId) {
        state = FlowState.TRANSITIONING_SEQUENCE;
        ChatSequence target = transitionManager.transitionToSequence(sequenceId);
        return transitionManager.entryMessageId(target);
    }
}
