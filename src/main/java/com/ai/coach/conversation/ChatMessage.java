package com.ai.coach.conversation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A node of a sequence graph. Loaded nodes are never mutated; rendering produces
 * copies through {@link #toBuilder()}.
 */
@Getter
@ToString
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ChatMessage {

    public static final int DEFAULT_DELAY = 1000;
    public static final String DEFAULT_PLACEHOLDER = "Type your answer...";

    private final int id;

    @Builder.Default
    private final MessageType type = MessageType.BOT;

    @Builder.Default
    private final String text = "";

    @Builder.Default
    private final int delay = DEFAULT_DELAY;

    private final String sender;

    private final String contentKey;

    private final Integer nextMessageId;

    private final String sequenceId;

    private final String storeKey;

    private final String placeholderText;

    private final String imagePath;

    private final Map<String, Object> animation;

    private final List<RouteCondition> routes;

    private final List<DataAction> dataActions;

    private final List<Choice> choices;

    public String getText() {
        return text == null ? "" : text;
    }

    public MessageType getType() {
        return type == null ? MessageType.BOT : type;
    }

    public String getPlaceholderText() {
        return placeholderText != null ? placeholderText : (getType() == MessageType.TEXT_INPUT ? DEFAULT_PLACEHOLDER : null);
    }

    public List<RouteCondition> getRoutes() {
        return routes == null ? Collections.emptyList() : Collections.unmodifiableList(routes);
    }

    public List<DataAction> getDataActions() {
        return dataActions == null ? Collections.emptyList() : Collections.unmodifiableList(dataActions);
    }

    public List<Choice> getChoices() {
        return choices == null ? Collections.emptyList() : Collections.unmodifiableList(choices);
    }

    public Map<String, Object> getAnimation() {
        return animation == null ? null : Collections.unmodifiableMap(animation);
    }

    @JsonIgnore
    public boolean isInteractive() {
        return getType().isInteractive();
    }

    @JsonIgnore
    public boolean isAutoRoute() {
        return getType() == MessageType.AUTOROUTE;
    }

    @JsonIgnore
    public boolean isDataAction() {
        return getType() == MessageType.DATA_ACTION;
    }

    @JsonIgnore
    public boolean isDisplayable() {
        return getType().isDisplayable();
    }

    @JsonIgnore
    public boolean isFromUser() {
        return getType() == MessageType.USER;
    }

    @JsonIgnore
    public boolean hasMultipleTexts(String separator) {
        return getText().contains(separator);
    }
}
