package com.ai.coach.store;

import java.util.Map;

/**
 * Dot-namespaced key/value collaborator ({@code user.}, {@code session.}, {@code task.}, {@code debug.}).
 * Values are dynamically typed; no schema is enforced.
 */
public interface KeyValueStore {

    /**
     * @return the stored value, or {@link StoreValue#NULL} when the key is absent
     */
    StoreValue get(String key);

    /**
     * Overwrites the key. Writing {@link StoreValue#NULL} removes it.
     */
    void set(String key, StoreValue value);

    default void set(String key, Object raw) {
        set(key, StoreValue.of(raw));
    }

    default boolean contains(String key) {
        return !get(key).isNull();
    }

    Map<String, StoreValue> snapshot();

    void clear();
}
