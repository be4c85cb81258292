package com.ai.coach.conversation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.Map;

/**
 * One mutation of a dataAction node. {@code value} is a JSON literal or a reserved
 * template-function token; {@code event}/{@code data} are only used by {@link DataActionType#TRIGGER}.
 */
@Getter
@ToString
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DataAction {

    private final DataActionType type;

    private final String key;

    private final Object value;

    private final String event;

    private final Map<String, Object> data;

    public Map<String, Object> getData() {
        return data == null ? Collections.emptyMap() : Collections.unmodifiableMap(data);
    }
}
