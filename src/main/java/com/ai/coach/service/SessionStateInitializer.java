package com.ai.coach.service;

import com.ai.coach.config.ChatEngineSettings;
import com.ai.coach.store.KeyValueStore;
import com.ai.coach.store.StoreValue;
import com.ai.coach.store.ValueConversions;
import com.ai.coach.utils.ActiveDateCalculator;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Refreshes the {@code session.*} and derived {@code task.*} keys at the start of a visit, so
 * authored conditions can branch on visit counts, time of day, weekends and the task's day.
 */
@Service
public class SessionStateInitializer {

    private static final Logger log = LoggerFactory.getLogger(SessionStateInitializer.class);

    public static final String VISIT_COUNT = "session.visitCount";
    public static final String TOTAL_VISIT_COUNT = "session.totalVisitCount";
    public static final String TIME_OF_DAY = "session.timeOfDay";
    public static final String LAST_VISIT_DATE = "session.lastVisitDate";
    public static final String FIRST_VISIT_DATE = "session.firstVisitDate";
    public static final String DAYS_SINCE_FIRST_VISIT = "session.daysSinceFirstVisit";
    public static final String IS_WEEKEND = "session.isWeekend";

    public static final String USER_TASK = "user.task";
    public static final String TASK_CURRENT_DATE = "task.currentDate";
    public static final String TASK_CURRENT_STATUS = "task.currentStatus";
    public static final String TASK_START_TIMING = "task.startTiming";
    public static final String TASK_DEADLINE_TIME = "task.deadlineTime";
    public static final String TASK_PREVIOUS_DATE = "task.previousDate";
    public static final String TASK_PREVIOUS_STATUS = "task.previousStatus";
    public static final String TASK_PREVIOUS_TASK = "task.previousTask";
    public static final String TASK_IS_ACTIVE_DAY = "task.isActiveDay";
    public static final String TASK_IS_PAST_DEADLINE = "task.isPastDeadline";

    static final int MORNING = 1;
    static final int AFTERNOON = 2;
    static final int EVENING = 3;
    static final int NIGHT = 4;

    static final String PENDING = "pending";
    static final String OVERDUE = "overdue";
    static final String FAILED = "failed";

    static final LocalTime DEFAULT_DEADLINE = LocalTime.of(21, 0);

    private final Clock clock;
    private final ChatEngineSettings settings;

    public SessionStateInitializer(Clock clock, ChatEngineSettings settings) {
        this.clock = clock;
        this.settings = settings;
    }

    public void initialize(String sessionId, KeyValueStore store) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDate today = now.toLocalDate();
        String todayText = ActiveDateCalculator.format(today);
        ActiveDateCalculator dates = new ActiveDateCalculator(store, clock, settings);

        boolean newDay = !todayText.equals(stringOrNull(store.get(LAST_VISIT_DATE)));
        updateVisitCounts(store, newDay);
        store.set(TIME_OF_DAY, StoreValue.ofInt(timeOfDay(now.getHour())));
        updateDateInfo(store, today, todayText, newDay);
        updateTaskInfo(store, now, todayText, dates);

        log.info("[{}] Session state refreshed: visit {} today, {} in total, timeOfDay {}", sessionId,
                store.get(VISIT_COUNT), store.get(TOTAL_VISIT_COUNT), store.get(TIME_OF_DAY));
    }

    private static void updateVisitCounts(KeyValueStore store, boolean newDay) {
        long visits = newDay ? 1 : ValueConversions.toLong(store.get(VISIT_COUNT)).orElse(0L) + 1;
        store.set(VISIT_COUNT, StoreValue.ofInt(visits));
        long total = ValueConversions.toLong(store.get(TOTAL_VISIT_COUNT)).orElse(0L) + 1;
        store.set(TOTAL_VISIT_COUNT, StoreValue.ofInt(total));
    }

    private static void updateDateInfo(KeyValueStore store, LocalDate today, String todayText, boolean newDay) {
        if (newDay) {
            store.set(LAST_VISIT_DATE, StoreValue.ofString(todayText));
        }
        LocalDate firstVisit = parseDate(stringOrNull(store.get(FIRST_VISIT_DATE)));
        if (firstVisit == null) {
            firstVisit = today;
            store.set(FIRST_VISIT_DATE, StoreValue.ofString(todayText));
        }
        store.set(DAYS_SINCE_FIRST_VISIT, StoreValue.ofInt(ChronoUnit.DAYS.between(firstVisit, today)));
        int weekday = today.getDayOfWeek().getValue();
        store.set(IS_WEEKEND, StoreValue.ofBool(weekday >= 6));
    }

    private void updateTaskInfo(KeyValueStore store, LocalDateTime now, String todayText, ActiveDateCalculator dates) {
        String lastTaskDate = stringOrNull(store.get(TASK_CURRENT_DATE));
        boolean newTaskDay = !todayText.equals(lastTaskDate);

        if (newTaskDay && lastTaskDate != null) {
            archivePreviousDay(store, lastTaskDate);
            expirePreviousDay(store, now);
        }

        store.set(TASK_CURRENT_DATE, StoreValue.ofString(currentTaskDate(store, todayText, newTaskDay, dates)));
        if (newTaskDay || store.get(TASK_CURRENT_STATUS).isNull()) {
            store.set(TASK_CURRENT_STATUS, StoreValue.ofString(PENDING));
        }

        store.set(TASK_IS_ACTIVE_DAY, StoreValue.ofBool(dates.isActiveDay(now.toLocalDate())));
        boolean pastDeadline = now.toLocalTime().isAfter(deadline(store));
        store.set(TASK_IS_PAST_DEADLINE, StoreValue.ofBool(pastDeadline));

        if (pastDeadline && PENDING.equals(stringOrNull(store.get(TASK_CURRENT_STATUS)))
                && !store.get(USER_TASK).isNull()) {
            store.set(TASK_CURRENT_STATUS, StoreValue.ofString(OVERDUE));
            log.debug("Task of {} is past its deadline, now {}", todayText, OVERDUE);
        }
    }

    private static String currentTaskDate(KeyValueStore store, String todayText, boolean newTaskDay,
                                          ActiveDateCalculator dates) {
        String timing = stringOrNull(store.get(TASK_START_TIMING));
        if (newTaskDay && "next_active".equals(timing)) {
            return dates.nextActiveDate();
        }
        return todayText;
    }

    private static void archivePreviousDay(KeyValueStore store, String lastTaskDate) {
        String lastTask = stringOrNull(store.get(USER_TASK));
        if (lastTask != null && PENDING.equals(stringOrNull(store.get(TASK_CURRENT_STATUS)))) {
            store.set(TASK_PREVIOUS_DATE, StoreValue.ofString(lastTaskDate));
            store.set(TASK_PREVIOUS_STATUS, StoreValue.ofString(PENDING));
            store.set(TASK_PREVIOUS_TASK, StoreValue.ofString(lastTask));
        }
    }

    private void expirePreviousDay(KeyValueStore store, LocalDateTime now) {
        if (PENDING.equals(stringOrNull(store.get(TASK_PREVIOUS_STATUS))) && now.toLocalTime().isAfter(deadline(store))) {
            store.set(TASK_PREVIOUS_STATUS, StoreValue.ofString(FAILED));
            log.debug("Grace period for {} expired, previous task {}", store.get(TASK_PREVIOUS_DATE), FAILED);
        }
    }

    /**
     * Deadline from {@code task.deadlineTime}: {@code HH:mm}, or a time-of-day number 1..4.
     */
    LocalTime deadline(KeyValueStore store) {
        StoreValue raw = store.get(TASK_DEADLINE_TIME);
        if (raw.is(StoreValue.Type.STRING) && raw.asString().contains(":")) {
            try {
                return LocalTime.parse(StringUtils.leftPad(raw.asString().trim(), 5, '0'));
            } catch (DateTimeParseException e) {
                log.warn("Ignoring unparseable {} '{}'", TASK_DEADLINE_TIME, raw.asString());
                return DEFAULT_DEADLINE;
            }
        }
        switch (ValueConversions.toLong(raw).orElse(0L).intValue()) {
            case MORNING:
                return LocalTime.of(11, 0);
            case AFTERNOON:
                return LocalTime.of(17, 0);
            case EVENING:
                return LocalTime.of(21, 0);
            case NIGHT:
                return LocalTime.of(6, 0);
            default:
                return DEFAULT_DEADLINE;
        }
    }

    static int timeOfDay(int hour) {
        if (hour >= 5 && hour < 12) return MORNING;
        if (hour >= 12 && hour < 17) return AFTERNOON;
        if (hour >= 17 && hour < 21) return EVENING;
        return NIGHT;
    }

    private static String stringOrNull(StoreValue value) {
        return value.is(StoreValue.Type.STRING) ? value.asString() : null;
    }

    private static LocalDate parseDate(String text) {
        if (text == null) return null;
        try {
            return LocalDate.parse(text.trim(), ActiveDateCalculator.DATE_FORMAT);
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable {} '{}'", FIRST_VISIT_DATE, text);
            return null;
        }
    }
}
