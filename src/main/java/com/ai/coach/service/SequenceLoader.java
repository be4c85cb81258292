package com.ai.coach.service;

import com.ai.coach.component.SequenceSource;
import com.ai.coach.conversation.ChatSequence;
import com.ai.coach.exception.SequenceLoadException;
import com.ai.coach.validation.SequenceValidator;
import com.ai.coach.validation.ValidationIssue;
import com.ai.coach.validation.ValidationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads, parses and validates sequence documents. Parsed sequences are immutable and cached,
 * so one loader serves every session.
 */
@Service
public class SequenceLoader {

    private static final Logger log = LoggerFactory.getLogger(SequenceLoader.class);

    private final SequenceSource source;
    private final ObjectMapper objectMapper;
    private final SequenceValidator validator;
    private final Map<String, ChatSequence> cache = new ConcurrentHashMap<>();

    public SequenceLoader(SequenceSource source, ObjectMapper objectMapper, SequenceValidator validator) {
        this.source = source;
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    /**
     * @throws SequenceLoadException when the document is missing, malformed or structurally invalid
     */
    public ChatSequence load(String sequenceId) {
        ChatSequence cached = cache.get(sequenceId);
        if (cached != null) {
            return cached;
        }
        ChatSequence sequence = parse(sequenceId, source.readDocument(sequenceId));
        cache.put(sequenceId, sequence);
        log.info("Loaded sequence '{}' with {} messages", sequenceId, sequence.getMessages().size());
        return sequence;
    }

    ChatSequence parse(String sequenceId, String json) {
        ChatSequence sequence;
        try {
            sequence = objectMapper.readValue(json, ChatSequence.class);
        } catch (JsonProcessingException e) {
            throw new SequenceLoadException(sequenceId,
                    "Malformed sequence document '" + sequenceId + "': " + e.getOriginalMessage(), e);
        }
        if (sequence == null) {
            throw new SequenceLoadException(sequenceId, "Sequence document '" + sequenceId + "' is empty");
        }

        ValidationResult result = validator.validate(sequence);
        for (ValidationIssue warning : result.getWarnings()) {
            log.warn("Sequence '{}': {}", sequenceId, warning);
        }
        if (!result.isValid()) {
            throw new SequenceLoadException(sequenceId,
                    "Sequence '" + sequenceId + "' is invalid: " + result.summary());
        }
        return sequence;
    }

    public void evict(String sequenceId) {
        cache.remove(sequenceId);
    }

    public void clearCache() {
        cache.clear();
    }
}
