package com.ai.coach.store;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session-scoped store kept in memory. Backs every chat session created by
 * {@link com.ai.coach.service.ChatSessionService}.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryKeyValueStore.class);

    private final Map<String, StoreValue> values = new ConcurrentHashMap<>();

    @Override
    public StoreValue get(String key) {
        if (StringUtils.isBlank(key)) return StoreValue.NULL;
        StoreValue value = values.get(key);
        if (value == null) {
            log.debug("get: key \"{}\" not found", key);
            return StoreValue.NULL;
        }
        return value;
    }

    @Override
    public void set(String key, StoreValue value) {
        if (StringUtils.isBlank(key)) {
            throw new IllegalArgumentException("Store key must not be blank");
        }
        if (value == null || value.isNull()) {
            log.debug("set: removing key \"{}\"", key);
            values.remove(key);
            return;
        }
        log.debug("set: key=\"{}\" value={} type={}", key, value, value.getType());
        values.put(key, value);
    }

    @Override
    public Map<String, StoreValue> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(values));
    }

    @Override
    public void clear() {
        values.clear();
    }
}
