package com.ai.coach.component;

import java.util.Map;

/**
 * Receives {@code trigger} data actions. Failures thrown from here are logged and discarded
 * by the data action processor.
 */
@FunctionalInterface
public interface EventTriggerCallback {

    void onEvent(String event, Map<String, Object> data) throws Exception;
}
