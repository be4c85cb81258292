package com.ai.coach.service;

import com.ai.coach.conversation.FlowResult;
import com.ai.coach.dto.FlowResponse;
import com.ai.coach.exception.SessionNotFoundException;
import com.ai.coach.store.InMemoryKeyValueStore;
import com.ai.coach.store.StoreValue;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live chat sessions, each with its own engine and in-memory store.
 * Turns of one session are serialized on its engine.
 */
@Service
public class ChatSessionService {

    private static final Logger log = LoggerFactory.getLogger(ChatSessionService.class);

    private final ChatEngineFactory engineFactory;
    private final SessionStateInitializer sessionStateInitializer;
    private final Map<String, ChatEngine> sessions = new ConcurrentHashMap<>();

    public ChatSessionService(ChatEngineFactory engineFactory, SessionStateInitializer sessionStateInitializer) {
        this.engineFactory = engineFactory;
        this.sessionStateInitializer = sessionStateInitializer;
    }

    public FlowResponse startSession(String sequenceId) {
        String sessionId = UUID.randomUUID().toString();
        String startSequence = StringUtils.isNotBlank(sequenceId)
                ? sequenceId.trim()
                : engineFactory.getSettings().getInitialSequenceId();

        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        sessionStateInitializer.initialize(sessionId, store);
        ChatEngine engine = engineFactory.create(sessionId, store);
        sessions.put(sessionId, engine);
        try {
            synchronized (engine) {
                FlowResult result = engine.start(startSequence);
                log.info("[{}] Session started on '{}'", sessionId, startSequence);
                return FlowResponse.of(sessionId, result);
            }
        } catch (RuntimeException e) {
            sessions.remove(sessionId);
            throw e;
        }
    }

    public FlowResponse respondWithChoice(String sessionId, int messageId, int choiceIndex) {
        ChatEngine engine = getEngine(sessionId);
        synchronized (engine) {
            return FlowResponse.of(sessionId, engine.respondWithChoice(messageId, choiceIndex));
        }
    }

    public FlowResponse respondWithText(String sessionId, int messageId, String text) {
        ChatEngine engine = getEngine(sessionId);
        synchronized (engine) {
            return FlowResponse.of(sessionId, engine.respondWithText(messageId, text));
        }
    }

    /**
     * Plain-Java view of the session store, keyed in sorted order.
     */
    public Map<String, Object> getSessionData(String sessionId) {
        ChatEngine engine = getEngine(sessionId);
        Map<String, Object> data = new LinkedHashMap<>();
        for (Map.Entry<String, StoreValue> e : engine.getStore().snapshot().entrySet()) {
            data.put(e.getKey(), e.getValue().toJava());
        }
        return data;
    }

    public void endSession(String sessionId) {
        if (sessions.remove(sessionId) == null) {
            throw new SessionNotFoundException(sessionId);
        }
        log.info("[{}] Session ended", sessionId);
    }

    public ChatEngine getEngine(String sessionId) {
        ChatEngine engine = sessions.get(sessionId);
        if (engine == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return engine;
    }

    public int activeSessions() {
        return sessions.size();
    }
}
