package com.ai.coach.service;

import com.ai.coach.conversation.ChatMessage;
import com.ai.coach.conversation.ChatSequence;
import com.ai.coach.conversation.RouteCondition;
import com.ai.coach.conversation.RouteDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the continuation of an autoroute node.
 * <p>
 * Conditional routes are tried in list order first; a default route is only taken when none of
 * them matches, wherever it sits in the list. Without a match the node's own
 * {@code nextMessageId} applies.
 */
public class RouteProcessor {

    private static final Logger log = LoggerFactory.getLogger(RouteProcessor.class);

    private final String sessionId;
    private final ConditionEvaluator conditionEvaluator;
    private final SequenceTransitionManager transitionManager;

    public RouteProcessor(String sessionId, ConditionEvaluator conditionEvaluator,
                          SequenceTransitionManager transitionManager) {
        this.sessionId = sessionId;
        this.conditionEvaluator = conditionEvaluator;
        this.transitionManager = transitionManager;
    }

    public RouteDecision processAutoRoute(ChatMessage node) {
        for (RouteCondition route : node.getRoutes()) {
            if (route.isDefaultRoute() || route.getCondition() == null) {
                continue;
            }
            if (conditionEvaluator.evaluateCompound(route.getCondition())) {
                log.debug("[{}] Autoroute {} matched \"{}\"", sessionId, node.getId(), route.getCondition());
                return execute(route);
            }
        }
        for (RouteCondition route : node.getRoutes()) {
            if (route.isDefaultRoute()) {
                log.debug("[{}] Autoroute {} took default route", sessionId, node.getId());
                return execute(route);
            }
        }
        log.debug("[{}] Autoroute {} matched nothing, falling through to {}", sessionId, node.getId(), node.getNextMessageId());
        return RouteDecision.continueAt(node.getNextMessageId());
    }

    private RouteDecision execute(RouteCondition route) {
        if (route.getSequenceId() != null) {
            ChatSequence target = transitionManager.transitionToSequence(route.getSequenceId());
            return RouteDecision.switchedSequence(target.getSequenceId(), transitionManager.entryMessageId(target));
        }
        return RouteDecision.continueAt(route.getNextMessageId());
    }
}
