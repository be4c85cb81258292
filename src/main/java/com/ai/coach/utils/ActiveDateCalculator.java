package com.ai.coach.utils;

import com.ai.coach.config.ChatEngineSettings;
import com.ai.coach.store.KeyValueStore;
import com.ai.coach.store.StoreValue;
import com.ai.coach.store.ValueConversions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Date arithmetic over the user's active weekdays (ISO numbering, Monday = 1).
 * Dates are rendered as {@code yyyy-MM-dd}.
 */
public class ActiveDateCalculator {

    private static final Logger log = LoggerFactory.getLogger(ActiveDateCalculator.class);

    public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    static final int MAX_LOOKAHEAD_DAYS = 366;

    private final KeyValueStore store;
    private final Clock clock;
    private final String activeDaysKey;
    private final String anchorKey;

    public ActiveDateCalculator(KeyValueStore store, Clock clock, ChatEngineSettings settings) {
        this.store = store;
        this.clock = clock;
        this.activeDaysKey = settings.getActiveDaysKey();
        this.anchorKey = settings.getFirstActiveDateAnchorKey();
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public String todayDate() {
        return format(today());
    }

    /**
     * First active day strictly after today. Tomorrow when no active days are configured.
     */
    public String nextActiveDate() {
        return format(nextActiveLocalDate());
    }

    public int nextActiveWeekday() {
        return nextActiveLocalDate().getDayOfWeek().getValue();
    }

    /**
     * First active day on or after the anchor date (today when the anchor key holds no date).
     */
    public String firstActiveDate() {
        LocalDate anchor = anchorDate().orElseGet(this::today);
        Set<Integer> activeDays = activeDays();
        if (activeDays.isEmpty()) {
            return format(anchor);
        }
        return format(scan(anchor, 0, activeDays).orElse(anchor));
    }

    /**
     * Whether {@code date} falls on an active weekday. Every day is active when none are configured.
     */
    public boolean isActiveDay(LocalDate date) {
        Set<Integer> activeDays = activeDays();
        return activeDays.isEmpty() || activeDays.contains(date.getDayOfWeek().getValue());
    }

    private LocalDate nextActiveLocalDate() {
        LocalDate tomorrow = today().plusDays(1);
        Set<Integer> activeDays = activeDays();
        if (activeDays.isEmpty()) {
            return tomorrow;
        }
        return scan(today(), 1, activeDays).orElseGet(() -> {
            log.warn("No active day found in {} within {} days, using tomorrow", activeDays, MAX_LOOKAHEAD_DAYS);
            return tomorrow;
        });
    }

    private static Optional<LocalDate> scan(LocalDate from, int firstOffset, Set<Integer> activeDays) {
        for (int i = firstOffset; i <= MAX_LOOKAHEAD_DAYS; i++) {
            LocalDate candidate = from.plusDays(i);
            if (activeDays.contains(candidate.getDayOfWeek().getValue())) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Active weekdays from the store: a list, a JSON array string or a comma-separated string.
     * Anything unparseable counts as "no configuration".
     */
    Set<Integer> activeDays() {
        StoreValue raw = store.get(activeDaysKey);
        Optional<List<StoreValue>> items = ValueConversions.toListLike(raw);
        if (items.isEmpty()) {
            if (!raw.isNull()) {
                log.debug("Ignoring unparseable {} value {}", activeDaysKey, raw);
            }
            return Collections.emptySet();
        }
        Set<Integer> days = new LinkedHashSet<>();
        for (StoreValue item : items.get()) {
            ValueConversions.toLong(item)
                    .filter(d -> d >= 1 && d <= 7)
                    .ifPresent(d -> days.add(d.intValue()));
        }
        return days;
    }

    private Optional<LocalDate> anchorDate() {
        StoreValue raw = store.get(anchorKey);
        if (!raw.is(StoreValue.Type.STRING)) return Optional.empty();
        try {
            return Optional.of(LocalDate.parse(raw.asString().trim(), DATE_FORMAT));
        } catch (DateTimeParseException e) {
            log.debug("Anchor {} holds '{}', not a date; using today", anchorKey, raw.asString());
            return Optional.empty();
        }
    }

    public static String format(LocalDate date) {
        return date.format(DATE_FORMAT);
    }
}
