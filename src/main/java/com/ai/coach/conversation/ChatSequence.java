package com.ai.coach.conversation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A named sequence document: ordered nodes plus an id index.
 * Immutable once loaded; a transition replaces it wholesale.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ChatSequence {

    private final String sequenceId;
    private final String name;
    private final String description;
    private final List<ChatMessage> messages;
    private final Map<Integer, ChatMessage> index;

    @JsonCreator
    public ChatSequence(@JsonProperty("sequenceId") String sequenceId,
                        @JsonProperty("name") String name,
                        @JsonProperty("description") String description,
                        @JsonProperty("messages") List<ChatMessage> messages) {
        this.sequenceId = sequenceId;
        this.name = name != null ? name : sequenceId;
        this.description = description != null ? description : "";
        this.messages = messages != null ? Collections.unmodifiableList(new ArrayList<>(messages)) : Collections.emptyList();
        Map<Integer, ChatMessage> byId = new LinkedHashMap<>();
        for (ChatMessage m : this.messages) {
            // first occurrence wins; duplicates are reported by the validator
            byId.putIfAbsent(m.getId(), m);
        }
        this.index = Collections.unmodifiableMap(byId);
    }

    public String getSequenceId() {
        return sequenceId;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<ChatMessage> getMessages() {
        return messages;
    }

    public Optional<ChatMessage> getMessage(int id) {
        return Optional.ofNullable(index.get(id));
    }

    public boolean hasMessage(int id) {
        return index.containsKey(id);
    }

    @JsonIgnore
    public List<Integer> getMessageIds() {
        return new ArrayList<>(index.keySet());
    }

    @JsonIgnore
    public Optional<Integer> getFirstMessageId() {
        return messages.isEmpty() ? Optional.empty() : Optional.of(messages.get(0).getId());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return messages.isEmpty();
    }

    @Override
    public String toString() {
        return "ChatSequence(" + sequenceId + ", messages=" + messages.size() + ")";
    }
}
