package com.ai.coach.service;

import com.ai.coach.conversation.ChatMessage;
import com.ai.coach.conversation.ChatSequence;
import com.ai.coach.conversation.Choice;
import com.ai.coach.conversation.FlowResult;
import com.ai.coach.conversation.FlowState;
import com.ai.coach.conversation.MessageType;
import com.ai.coach.exception.InputNotAwaitedException;
import com.ai.coach.store.KeyValueStore;
import com.ai.coach.store.StoreValue;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One chat session's engine: the active sequence, the orchestrator and the store they share.
 * Built by {@link ChatEngineFactory}; callers serialize access per session.
 */
public class ChatEngine {

    private static final Logger log = LoggerFactory.getLogger(ChatEngine.class);

    private final String sessionId;
    private final KeyValueStore store;
    private final SequenceTransitionManager transitionManager;
    private final FlowOrchestrator orchestrator;

    ChatEngine(String sessionId, KeyValueStore store, SequenceTransitionManager transitionManager,
               FlowOrchestrator orchestrator) {
        this.sessionId = sessionId;
        this.store = store;
        this.transitionManager = transitionManager;
        this.orchestrator = orchestrator;
    }

    public String getSessionId() {
        return sessionId;
    }

    public KeyValueStore getStore() {
        return store;
    }

    public String currentSequenceId() {
        return transitionManager.getCurrentSequenceId();
    }

    public FlowState flowState() {
        return orchestrator.getState();
    }

    /**
     * Activates {@code sequenceId} and runs it from the configured initial message, or from its
     * first message when the document has no such id.
     */
    public FlowResult start(String sequenceId) {
        log.info("[{}] Starting sequence '{}'", sessionId, sequenceId);
        ChatSequence sequence = transitionManager.transitionToSequence(sequenceId);
        Integer entryId = transitionManager.entryMessageId(sequence);
        if (entryId == null) {
            return orchestrator.finish();
        }
        return orchestrator.processFlow(entryId);
    }

    public FlowResult processFlow(int startId) {
        return orchestrator.processFlow(startId);
    }

    /**
     * Records the choice picked on the awaited choice node and continues the flow.
     *
     * @throws InputNotAwaitedException when {@code messageId} is not the node awaiting input
     * @throws IllegalArgumentException when {@code choiceIndex} is out of range
     */
    public FlowResult respondWithChoice(int messageId, int choiceIndex) {
        ChatMessage node = awaitedNode(messageId, MessageType.CHOICE);
        if (choiceIndex < 0 || choiceIndex >= node.getChoices().size()) {
            throw new IllegalArgumentException("Choice index " + choiceIndex + " out of range for message " + messageId);
        }
        Choice choice = node.getChoices().get(choiceIndex);
        log.info("[{}] Choice on {}: '{}'", sessionId, messageId, choice.getText());
        storeResponse(node, StoreValue.of(choice.getStoredValue()));

        if (choice.getSequenceId() != null) {
            return orchestrator.processFlowInSequence(choice.getSequenceId());
        }
        return continueFrom(choice.getNextMessageId() != null ? choice.getNextMessageId() : node.getNextMessageId());
    }

    /**
     * Records free text typed on the awaited text input node and continues the flow.
     *
     * @throws InputNotAwaitedException when {@code messageId} is not the node awaiting input
     * @throws IllegalArgumentException when the text is blank
     */
    public FlowResult respondWithText(int messageId, String text) {
        ChatMessage node = awaitedNode(messageId, MessageType.TEXT_INPUT);
        if (StringUtils.isBlank(text)) {
            throw new IllegalArgumentException("Text response for message " + messageId + " is blank");
        }
        String answer = text.trim();
        log.info("[{}] Text on {}: '{}'", sessionId, messageId, answer);
        storeResponse(node, StoreValue.ofString(answer));

        if (node.getSequenceId() != null) {
            return orchestrator.processFlowInSequence(node.getSequenceId());
        }
        return continueFrom(node.getNextMessageId());
    }

    private FlowResult continueFrom(Integer nextMessageId) {
        if (nextMessageId == null) {
            log.info("[{}] Response leads nowhere, conversation ends", sessionId);
            return orchestrator.finish();
        }
        return orchestrator.processFlow(nextMessageId);
    }

    private void storeResponse(ChatMessage node, StoreValue value) {
        if (StringUtils.isNotBlank(node.getStoreKey())) {
            store.set(node.getStoreKey(), value);
        }
    }

    private ChatMessage awaitedNode(int messageId, MessageType expectedType) {
        Integer awaited = orchestrator.getAwaitingMessageId();
        if (orchestrator.getState() != FlowState.AWAITING_INPUT || awaited == null || awaited != messageId) {
            throw new InputNotAwaitedException(messageId, awaited);
        }
        ChatMessage node = transitionManager.getCurrentSequence().getMessage(messageId)
                .orElseThrow(() -> new IllegalStateException("Message " + messageId + " not in sequence "
                        + currentSequenceId()));
        if (node.getType() != expectedType) {
            throw new IllegalArgumentException("Message " + messageId + " is a " + node.getType().getJsonName()
                    + " message, not " + expectedType.getJsonName());
        }
        return node;
    }
}
