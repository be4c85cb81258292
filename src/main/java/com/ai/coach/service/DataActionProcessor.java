package com.ai.coach.service;

import com.ai.coach.component.EventTriggerCallback;
import com.ai.coach.conversation.DataAction;
import com.ai.coach.store.KeyValueStore;
import com.ai.coach.store.StoreValue;
import com.ai.coach.store.ValueConversions;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Applies the data actions of a {@code dataAction} node to the store, one after another in
 * document order. A failing action is logged and skipped; the rest of the batch still runs.
 */
public class DataActionProcessor {

    private static final Logger log = LoggerFactory.getLogger(DataActionProcessor.class);

    static final List<String> NAMESPACES = Arrays.asList("user", "session", "task", "debug");

    private final KeyValueStore store;
    private final TemplateFunctionResolver functionResolver;
    private final TextTemplatingService templatingService;
    private final EventTriggerCallback eventCallback;

    public DataActionProcessor(KeyValueStore store,
                               TemplateFunctionResolver functionResolver,
                               TextTemplatingService templatingService,
                               EventTriggerCallback eventCallback) {
        this.store = store;
        this.functionResolver = functionResolver;
        this.templatingService = templatingService;
        this.eventCallback = eventCallback;
    }

    public void processActions(List<DataAction> actions) {
        if (actions == null || actions.isEmpty()) return;
        for (DataAction action : actions) {
            try {
                process(action);
            } catch (RuntimeException e) {
                log.warn("Skipping data action {} after failure", action, e);
            }
        }
    }

    private void process(DataAction action) {
        if (action.getType() == null) {
            log.warn("Data action without type skipped: {}", action);
            return;
        }
        switch (action.getType()) {
            case SET:
                set(action);
                break;
            case INCREMENT:
                add(action, 1);
                break;
            case DECREMENT:
                add(action, -1);
                break;
            case RESET:
                reset(action);
                break;
            case APPEND:
                append(action);
                break;
            case REMOVE:
                remove(action);
                break;
            case TRIGGER:
                trigger(action);
                break;
            default:
                log.warn("Unsupported data action type {}", action.getType());
        }
    }

    private void set(DataAction action) {
        if (!hasKey(action)) return;
        StoreValue value = functionResolver.resolve(action.getValue());
        store.set(action.getKey(), value);
        log.debug("set {} = {}", action.getKey(), value);
    }

    private void add(DataAction action, int sign) {
        if (!hasKey(action)) return;
        long step = 1;
        if (action.getValue() != null) {
            Optional<Long> parsed = ValueConversions.toLong(StoreValue.of(action.getValue()));
            if (parsed.isEmpty()) {
                log.warn("{} of {} skipped, amount {} is not an integer",
                        action.getType(), action.getKey(), action.getValue());
                return;
            }
            step = parsed.get();
        }
        long current = ValueConversions.toLong(store.get(action.getKey())).orElse(0L);
        long updated;
        try {
            updated = Math.addExact(current, Math.multiplyExact(sign, step));
        } catch (ArithmeticException e) {
            log.warn("{} of {} skipped, {} by {} overflows", action.getType(), action.getKey(), current, step);
            return;
        }
        store.set(action.getKey(), StoreValue.ofInt(updated));
        log.debug("{} {}: {} -> {}", action.getType(), action.getKey(), current, updated);
    }

    private void reset(DataAction action) {
        if (!hasKey(action)) return;
        StoreValue value = action.getValue() == null ? StoreValue.ofInt(0) : StoreValue.of(action.getValue());
        store.set(action.getKey(), value);
        log.debug("reset {} = {}", action.getKey(), value);
    }

    private void append(DataAction action) {
        if (!hasKey(action)) return;
        StoreValue existing = store.get(action.getKey());
        StoreValue value = resolveListOperand(action.getValue());
        if (value.isNull()) {
            log.warn("append to {} skipped, value resolved to null", action.getKey());
            return;
        }

        List<StoreValue> list;
        if (existing.isNull()) {
            list = new ArrayList<>();
        } else {
            Optional<List<StoreValue>> current = ValueConversions.toListLike(existing);
            if (current.isEmpty()) {
                log.warn("append to {} skipped, existing value {} is not a list", action.getKey(), existing);
                return;
            }
            list = new ArrayList<>(current.get());
        }

        StoreValue coerced = ValueConversions.coerceToElementType(value, list);
        if (list.contains(coerced)) {
            log.debug("append to {} skipped, {} already present", action.getKey(), coerced);
            return;
        }
        list.add(coerced);
        store.set(action.getKey(), StoreValue.ofList(list));
        log.debug("append {} to {} -> {}", coerced, action.getKey(), list);
    }

    private void remove(DataAction action) {
        if (!hasKey(action)) return;
        StoreValue existing = store.get(action.getKey());
        if (existing.isNull()) {
            log.warn("remove from {} skipped, key is not set", action.getKey());
            return;
        }
        Optional<List<StoreValue>> current = ValueConversions.toListLike(existing);
        if (current.isEmpty()) {
            log.warn("remove from {} skipped, existing value {} is not a list", action.getKey(), existing);
            return;
        }
        List<StoreValue> list = new ArrayList<>(current.get());
        StoreValue coerced = ValueConversions.coerceToElementType(resolveListOperand(action.getValue()), list);
        if (!list.removeIf(coerced::equals)) {
            log.debug("remove from {}: {} not present", action.getKey(), coerced);
            return;
        }
        store.set(action.getKey(), StoreValue.ofList(list));
        log.debug("remove {} from {} -> {}", coerced, action.getKey(), list);
    }

    private void trigger(DataAction action) {
        if (StringUtils.isBlank(action.getEvent())) {
            log.warn("trigger without event skipped");
            return;
        }
        if (eventCallback == null) {
            log.info("No event callback registered, event '{}' dropped", action.getEvent());
            return;
        }
        try {
            eventCallback.onEvent(action.getEvent(), action.getData());
            log.debug("Triggered event '{}'", action.getEvent());
        } catch (Exception e) {
            log.warn("Event callback for '{}' failed, continuing", action.getEvent(), e);
        }
    }

    /**
     * Append/remove operands: a date token, a template such as {@code {session.timeOfDay}}, a bare store path
     * such as {@code session.timeOfDay} that currently holds a value, or a literal.
     */
    private StoreValue resolveListOperand(Object raw) {
        if (!(raw instanceof String)) {
            return StoreValue.of(raw);
        }
        String text = ((String) raw).trim();
        if (TemplateFunctionResolver.isFunction(text)) {
            return functionResolver.resolve(text);
        }
        if (TextTemplatingService.hasPlaceholders(text)) {
            return StoreValue.ofString(templatingService.process(text));
        }
        if (looksLikeStorePath(text)) {
            StoreValue stored = store.get(text);
            if (!stored.isNull()) {
                return stored;
            }
        }
        return StoreValue.ofString(text);
    }

    private static boolean looksLikeStorePath(String text) {
        int dot = text.indexOf('.');
        return dot > 0 && dot < text.length() - 1
                && NAMESPACES.contains(text.substring(0, dot))
                && !StringUtils.containsWhitespace(text);
    }

    private static boolean hasKey(DataAction action) {
        if (StringUtils.isBlank(action.getKey())) {
            log.warn("{} action without key skipped", action.getType());
            return false;
        }
        return true;
    }
}
