package com.ai.coach.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import com.ai.coach.component.EventTriggerCallback;
import com.ai.coach.config.ChatEngineSettings;
import com.ai.coach.conversation.DataAction;
import com.ai.coach.conversation.DataActionType;
import com.ai.coach.store.InMemoryKeyValueStore;
import com.ai.coach.store.StoreValue;
import com.ai.coach.utils.ActiveDateCalculator;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

@ExtendWith({MockitoExtension.class, OutputCaptureExtension.class})
class DataActionProcessorTest {

    private static final Clock WEDNESDAY = Clock.fixed(Instant.parse("2024-01-03T08:00:00Z"), ZoneOffset.UTC);

    @Mock private EventTriggerCallback callback;

    private InMemoryKeyValueStore store;
    private DataActionProcessor processor;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        ChatEngineSettings settings = ChatEngineSettings.defaults();
        TemplateFunctionResolver functions =
                new TemplateFunctionResolver(new ActiveDateCalculator(store, WEDNESDAY, settings));
        TextTemplatingService templating =
                new TextTemplatingService(store, new FormatterService(new ObjectMapper(), settings));
        processor = new DataActionProcessor(store, functions, templating, callback);
    }

    private static DataAction action(DataActionType type, String key, Object value) {
        return DataAction.builder().type(type).key(key).value(value).build();
    }

    private void run(DataAction... actions) {
        processor.processActions(Arrays.asList(actions));
    }

    @Nested
    class Counters {

        @Test
        void shouldSetUnconditionally() {
            store.set("user.name", StoreValue.ofString("old"));

            run(action(DataActionType.SET, "user.name", "Ana"));

            assertThat(store.get("user.name")).isEqualTo(StoreValue.ofString("Ana"));
        }

        @Test
        void shouldSkipIncrementThatWouldOverflow(CapturedOutput output) {
            store.set("user.streak", StoreValue.ofInt(Long.MAX_VALUE));
            store.set("user.debt", StoreValue.ofInt(Long.MIN_VALUE));

            run(action(DataActionType.INCREMENT, "user.streak", null),
                    action(DataActionType.DECREMENT, "user.debt", 1),
                    action(DataActionType.INCREMENT, "user.after", null));

            assertThat(store.get("user.streak")).isEqualTo(StoreValue.ofInt(Long.MAX_VALUE));
            assertThat(store.get("user.debt")).isEqualTo(StoreValue.ofInt(Long.MIN_VALUE));
            assertThat(store.get("user.after")).isEqualTo(StoreValue.ofInt(1));
            assertThat(output).contains("INCREMENT of user.streak skipped");
        }

        @Test
        void shouldSkipActionWithoutTypeAndRunTheRest() {
            run(action(null, "user.typo", "x"),
                    action(DataActionType.SET, "user.after", "yes"));

            assertThat(store.contains("user.typo")).isFalse();
            assertThat(store.get("user.after")).isEqualTo(StoreValue.ofString("yes"));
        }

        @Test
        void shouldIncrementFromZeroWhenAbsent() {
            run(action(DataActionType.INCREMENT, "user.streak", null));

            assertThat(store.get("user.streak")).isEqualTo(StoreValue.ofInt(1));
        }

        @Test
        void shouldIncrementAndDecrementByAmount() {
            store.set("user.points", StoreValue.ofInt(10));

            run(action(DataActionType.INCREMENT, "user.points", 5),
                    action(DataActionType.DECREMENT, "user.points", 3));

            assertThat(store.get("user.points")).isEqualTo(StoreValue.ofInt(12));
        }

        @Test
        void shouldTreatWrongTypedCounterAsZero() {
            store.set("user.points", StoreValue.ofString("lots"));

            run(action(DataActionType.DECREMENT, "user.points", null));

            assertThat(store.get("user.points")).isEqualTo(StoreValue.ofInt(-1));
        }

        @Test
        void shouldResetToZeroByDefault() {
            store.set("user.streak", StoreValue.ofInt(9));

            run(action(DataActionType.RESET, "user.streak", null));

            assertThat(store.get("user.streak")).isEqualTo(StoreValue.ofInt(0));
        }

        @Test
        void shouldLetLaterActionsSeeEarlierWrites() {
            run(action(DataActionType.SET, "user.streak", 2),
                    action(DataActionType.INCREMENT, "user.streak", null),
                    action(DataActionType.INCREMENT, "user.streak", null));

            assertThat(store.get("user.streak")).isEqualTo(StoreValue.ofInt(4));
        }

        @Test
        void shouldSkipOnlyTheBadActionInABatch() {
            run(action(DataActionType.INCREMENT, "user.streak", "many"),
                    action(DataActionType.SET, "user.after", true));

            assertThat(store.contains("user.streak")).isFalse();
            assertThat(store.get("user.after")).isEqualTo(StoreValue.TRUE);
        }
    }

    @Nested
    class Lists {

        @Test
        void shouldAppendIdempotently() {
            store.set("user.days", Arrays.asList(1, 2));

            run(action(DataActionType.APPEND, "user.days", "3"));
            run(action(DataActionType.APPEND, "user.days", "3"));

            List<StoreValue> days = store.get("user.days").asList();
            assertThat(days).containsExactly(StoreValue.ofInt(1), StoreValue.ofInt(2), StoreValue.ofInt(3));
        }

        @Test
        void shouldStartNewListWhenKeyIsAbsent() {
            run(action(DataActionType.APPEND, "user.tags", "focus"));

            assertThat(store.get("user.tags").asList()).containsExactly(StoreValue.ofString("focus"));
        }

        @Test
        void shouldAppendToCommaSeparatedString() {
            store.set("user.slots", StoreValue.ofString("morning, evening"));

            run(action(DataActionType.APPEND, "user.slots", "morning"));
            run(action(DataActionType.APPEND, "user.slots", "night"));

            assertThat(store.get("user.slots").asList()).containsExactly(
                    StoreValue.ofString("morning"), StoreValue.ofString("evening"), StoreValue.ofString("night"));
        }

        @Test
        void shouldLeaveNonListUntouchedOnAppend() {
            store.set("user.name", StoreValue.ofString("Ana"));

            run(action(DataActionType.APPEND, "user.name", "Bo"));

            assertThat(store.get("user.name")).isEqualTo(StoreValue.ofString("Ana"));
        }

        @Test
        void shouldResolveTemplateAndStorePathOperands() {
            store.set("session.timeOfDay", StoreValue.ofInt(2));
            store.set("user.times", Arrays.asList(1));

            run(action(DataActionType.APPEND, "user.times", "{session.timeOfDay}"));
            run(action(DataActionType.APPEND, "user.times", "session.timeOfDay"));

            assertThat(store.get("user.times").asList()).containsExactly(StoreValue.ofInt(1), StoreValue.ofInt(2));
        }

        @Test
        void shouldRemoveEveryMatchingElement() {
            store.set("user.days", StoreValue.ofString("[1, 2, 1, 3]"));

            run(action(DataActionType.REMOVE, "user.days", "1"));

            assertThat(store.get("user.days").asList()).containsExactly(StoreValue.ofInt(2), StoreValue.ofInt(3));
        }

        @Test
        void shouldWarnAndIgnoreRemoveOnAbsentKey(CapturedOutput output) {
            run(action(DataActionType.REMOVE, "user.missing", "x"));

            assertThat(store.contains("user.missing")).isFalse();
            assertThat(output).contains("remove from user.missing skipped, key is not set");
        }
    }

    @Nested
    class DateTokensAndTriggers {

        @Test
        void shouldResolveDateTokensOnSet() {
            store.set("task.activeDays", Arrays.asList(5));

            run(action(DataActionType.SET, "user.today", "TODAY_DATE"),
                    action(DataActionType.SET, "task.nextDate", "NEXT_ACTIVE_DATE"),
                    action(DataActionType.SET, "task.nextWeekday", "NEXT_ACTIVE_WEEKDAY"),
                    action(DataActionType.SET, "task.firstDate", "FIRST_ACTIVE_DATE"),
                    action(DataActionType.SET, "user.plain", "TOMORROW"));

            assertThat(store.get("user.today")).isEqualTo(StoreValue.ofString("2024-01-03"));
            assertThat(store.get("task.nextDate")).isEqualTo(StoreValue.ofString("2024-01-05"));
            assertThat(store.get("task.nextWeekday")).isEqualTo(StoreValue.ofInt(5));
            assertThat(store.get("task.firstDate")).isEqualTo(StoreValue.ofString("2024-01-05"));
            assertThat(store.get("user.plain")).isEqualTo(StoreValue.ofString("TOMORROW"));
        }

        @Test
        void shouldInvokeCallbackWithEventAndPayload() throws Exception {
            Map<String, Object> payload = Collections.singletonMap("step", "name");

            run(DataAction.builder().type(DataActionType.TRIGGER).event("milestone").data(payload).build());

            verify(callback).onEvent("milestone", payload);
        }

        @Test
        void shouldContinueBatchWhenCallbackFails() throws Exception {
            doThrow(new IllegalStateException("sink down")).when(callback).onEvent(eq("boom"), anyMap());

            run(DataAction.builder().type(DataActionType.TRIGGER).event("boom").build(),
                    action(DataActionType.SET, "user.after", "yes"));

            assertThat(store.get("user.after")).isEqualTo(StoreValue.ofString("yes"));
        }
    }
}
