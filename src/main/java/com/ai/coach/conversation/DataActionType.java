package com.ai.coach.conversation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DataActionType {
    SET,
    INCREMENT,
    DECREMENT,
    RESET,
    APPEND,
    REMOVE,
    TRIGGER;

    @JsonValue
    public String getJsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Null for names that are not an action type; such actions load and are skipped when run.
     */
    @JsonCreator
    public static DataActionType fromJson(String value) {
        for (DataActionType t : values()) {
            if (t.getJsonName().equals(value)) {
                return t;
            }
        }
        return null;
    }
}
