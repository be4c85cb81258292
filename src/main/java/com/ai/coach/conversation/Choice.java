package com.ai.coach.conversation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * Option of a choice node. {@code value} is what gets stored; the text is stored when it is absent.
 */
@Getter
@ToString
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Choice {

    private final String text;

    private final Object value;

    private final Integer nextMessageId;

    private final String sequenceId;

    private final String contentKey;

    public Object getStoredValue() {
        return value != null ? value : text;
    }
}
