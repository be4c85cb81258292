package com.ai.coach.conversation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Node kinds of a sequence document. Only {@link #CHOICE} and {@link #TEXT_INPUT} wait for the user;
 * {@link #AUTOROUTE} and {@link #DATA_ACTION} are processed and never rendered.
 */
public enum MessageType {
    BOT("bot"),
    USER("user"),
    CHOICE("choice"),
    TEXT_INPUT("textInput"),
    AUTOROUTE("autoroute"),
    DATA_ACTION("dataAction"),
    IMAGE("image");

    private final String jsonName;

    MessageType(String jsonName) {
        this.jsonName = jsonName;
    }

    @JsonValue
    public String getJsonName() {
        return jsonName;
    }

    @JsonCreator
    public static MessageType fromJson(String value) {
        for (MessageType t : values()) {
            if (t.jsonName.equals(value)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown message type: " + value);
    }

    public boolean isInteractive() {
        return this == CHOICE || this == TEXT_INPUT;
    }

    public boolean isDisplayable() {
        return this != AUTOROUTE && this != DATA_ACTION;
    }
}
