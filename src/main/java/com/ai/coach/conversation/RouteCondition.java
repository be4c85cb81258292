package com.ai.coach.conversation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * One rule of an autoroute node. The target is either a node of the current
 * sequence ({@code nextMessageId}) or another sequence ({@code sequenceId}).
 */
@Getter
@ToString
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RouteCondition {

    private final String condition;

    @JsonProperty("default")
    private final boolean defaultRoute;

    private final Integer nextMessageId;

    private final String sequenceId;

    public boolean hasDestination() {
        return nextMessageId != null || sequenceId != null;
    }
}
