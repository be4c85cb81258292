package com.ai.coach.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ChatEngineConfig {

    @Value("${chat.initial-sequence-id:onboarding}")
    private String initialSequenceId;

    @Value("${chat.initial-message-id:1}")
    private int initialMessageId;

    @Value("${chat.max-traversal-depth:100}")
    private int maxTraversalDepth;

    @Value("${chat.max-processing-cycles:25}")
    private int maxProcessingCycles;

    @Value("${chat.multi-text-separator:|||}")
    private String multiTextSeparator;

    @Value("${chat.sequences-path:sequences/}")
    private String sequencesPath;

    @Value("${chat.formatters-path:formatters/}")
    private String formattersPath;

    @Value("${chat.content-path:content/}")
    private String contentPath;

    @Value("${chat.active-days-key:task.activeDays}")
    private String activeDaysKey;

    @Value("${chat.first-active-date-anchor-key:task.startDate}")
    private String firstActiveDateAnchorKey;

    @Bean
    public ChatEngineSettings chatEngineSettings() {
        return ChatEngineSettings.builder()
                .initialSequenceId(initialSequenceId)
                .initialMessageId(initialMessageId)
                .maxTraversalDepth(maxTraversalDepth)
                .maxProcessingCycles(maxProcessingCycles)
                .multiTextSeparator(multiTextSeparator)
                .sequencesPath(sequencesPath)
                .formattersPath(formattersPath)
                .contentPath(contentPath)
                .activeDaysKey(activeDaysKey)
                .firstActiveDateAnchorKey(firstActiveDateAnchorKey)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
