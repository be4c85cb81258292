package com.ai.coach.service;

import com.ai.coach.store.StoreValue;
import com.ai.coach.utils.ActiveDateCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands the reserved value tokens of {@code set} actions. Any other value passes through.
 */
public class TemplateFunctionResolver {

    private static final Logger log = LoggerFactory.getLogger(TemplateFunctionResolver.class);

    public static final String TODAY_DATE = "TODAY_DATE";
    public static final String NEXT_ACTIVE_DATE = "NEXT_ACTIVE_DATE";
    public static final String NEXT_ACTIVE_WEEKDAY = "NEXT_ACTIVE_WEEKDAY";
    public static final String FIRST_ACTIVE_DATE = "FIRST_ACTIVE_DATE";

    private final ActiveDateCalculator dates;

    public TemplateFunctionResolver(ActiveDateCalculator dates) {
        this.dates = dates;
    }

    public static boolean isFunction(Object value) {
        if (!(value instanceof String)) return false;
        String s = ((String) value).trim();
        return TODAY_DATE.equals(s) || NEXT_ACTIVE_DATE.equals(s)
                || NEXT_ACTIVE_WEEKDAY.equals(s) || FIRST_ACTIVE_DATE.equals(s);
    }

    public StoreValue resolve(Object value) {
        if (!isFunction(value)) {
            return StoreValue.of(value);
        }
        String token = ((String) value).trim();
        StoreValue resolved;
        switch (token) {
            case TODAY_DATE:
                resolved = StoreValue.ofString(dates.todayDate());
                break;
            case NEXT_ACTIVE_DATE:
                resolved = StoreValue.ofString(dates.nextActiveDate());
                break;
            case NEXT_ACTIVE_WEEKDAY:
                resolved = StoreValue.ofInt(dates.nextActiveWeekday());
                break;
            case FIRST_ACTIVE_DATE:
                resolved = StoreValue.ofString(dates.firstActiveDate());
                break;
            default:
                resolved = StoreValue.of(value);
        }
        log.debug("Template function {} resolved to {}", token, resolved);
        return resolved;
    }
}
