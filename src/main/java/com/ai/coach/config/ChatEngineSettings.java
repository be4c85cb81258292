package com.ai.coach.config;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable engine tuning, bound from {@code chat.*} properties.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class ChatEngineSettings {

    @Builder.Default
    private final String initialSequenceId = "onboarding";

    @Builder.Default
    private final int initialMessageId = 1;

    @Builder.Default
    private final int maxTraversalDepth = 100;

    @Builder.Default
    private final int maxProcessingCycles = 25;

    @Builder.Default
    private final String multiTextSeparator = "|||";

    @Builder.Default
    private final String sequencesPath = "sequences/";

    @Builder.Default
    private final String formattersPath = "formatters/";

    @Builder.Default
    private final String contentPath = "content/";

    @Builder.Default
    private final String activeDaysKey = "task.activeDays";

    @Builder.Default
    private final String firstActiveDateAnchorKey = "task.startDate";

    public static ChatEngineSettings defaults() {
        return ChatEngineSettings.builder().build();
    }
}
