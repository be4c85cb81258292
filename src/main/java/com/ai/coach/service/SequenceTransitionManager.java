package com.ai.coach.service;

import com.ai.coach.conversation.ChatSequence;
import com.ai.coach.exception.SequenceLoadException;
import com.ai.coach.exception.SequenceTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Owns the active sequence of one session and switches it atomically:
 * snapshot the active id, load the target, validate, then commit or roll back.
 */
public class SequenceTransitionManager {

    private static final Logger log = LoggerFactory.getLogger(SequenceTransitionManager.class);

    private final String sessionId;
    private final SequenceLoader loader;
    private final int initialMessageId;

    private ChatSequence currentSequence;

    public SequenceTransitionManager(String sessionId, SequenceLoader loader, int initialMessageId) {
        this.sessionId = sessionId;
        this.loader = loader;
        this.initialMessageId = initialMessageId;
    }

    public ChatSequence getCurrentSequence() {
        return currentSequence;
    }

    public String getCurrentSequenceId() {
        return currentSequence == null ? null : currentSequence.getSequenceId();
    }

    /**
     * Where a freshly activated sequence starts: the configured initial message when the
     * sequence has it, otherwise its first listed message. Null for a sequence without messages.
     */
    public Integer entryMessageId(ChatSequence sequence) {
        if (sequence.hasMessage(initialMessageId)) {
            return initialMessageId;
        }
        return sequence.getFirstMessageId().orElse(null);
    }

    /**
     * Makes {@code sequenceId} the active sequence.
     *
     * @throws SequenceTransitionException when the target cannot be loaded or fails validation;
     *                                     the previous sequence is active again unless
     *                                     {@link SequenceTransitionException#isInconsistent()}
     */
    public ChatSequence transitionToSequence(String sequenceId) {
        String backupId = getCurrentSequenceId();
        log.info("[{}] Transition {} -> {}", sessionId, backupId, sequenceId);

        ChatSequence loaded;
        try {
            loaded = loader.load(sequenceId);
        } catch (SequenceLoadException e) {
            log.error("[{}] Loading sequence '{}' failed, staying on '{}'", sessionId, sequenceId, backupId);
            throw new SequenceTransitionException(sequenceId, backupId, false,
                    "Failed to load sequence '" + sequenceId + "'", e);
        }

        currentSequence = loaded;
        String problem = validateLoaded(sequenceId, loaded);
        if (problem == null) {
            log.info("[{}] Now on sequence '{}'", sessionId, sequenceId);
            return loaded;
        }

        log.error("[{}] Sequence '{}' rejected ({}), rolling back to '{}'", sessionId, sequenceId, problem, backupId);
        rollback(sequenceId, backupId, problem);
        throw new SequenceTransitionException(sequenceId, backupId, false,
                "Sequence '" + sequenceId + "' rejected: " + problem, null);
    }

    private void rollback(String requestedId, String backupId, String problem) {
        if (backupId == null) {
            currentSequence = null;
            return;
        }
        try {
            currentSequence = loader.load(backupId);
            log.info("[{}] Restored sequence '{}'", sessionId, backupId);
        } catch (SequenceLoadException e) {
            log.error("[{}] Rollback to '{}' failed, active sequence is '{}'",
                    sessionId, backupId, getCurrentSequenceId(), e);
            throw new SequenceTransitionException(requestedId, backupId, true,
                    "Sequence '" + requestedId + "' rejected (" + problem + ") and rollback to '"
                            + backupId + "' failed", e);
        }
    }

    private static String validateLoaded(String requestedId, ChatSequence loaded) {
        if (!Objects.equals(requestedId, loaded.getSequenceId())) {
            return "document declares sequenceId '" + loaded.getSequenceId() + "'";
        }
        if (loaded.isEmpty()) {
            return "no messages";
        }
        return null;
    }
}
