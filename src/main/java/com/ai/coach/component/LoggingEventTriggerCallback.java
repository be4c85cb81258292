package com.ai.coach.component;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Default sink for flow events when nothing else is registered.
 */
@Component
public class LoggingEventTriggerCallback implements EventTriggerCallback {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventTriggerCallback.class);

    @Override
    public void onEvent(String event, Map<String, Object> data) {
        log.info("Flow event '{}' fired with {}", event, data);
    }
}
