package com.ai.coach.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ai.coach.store.InMemoryKeyValueStore;
import com.ai.coach.store.KeyValueStore;
import com.ai.coach.store.StoreValue;
import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ConditionEvaluatorTest {

    private KeyValueStore store;
    private ConditionEvaluator evaluator;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        evaluator = new ConditionEvaluator(store);
    }

    @Nested
    class SingleConditions {

        @Test
        void shouldIgnoreOperatorsInsideQuotes() {
            store.set("user.note", StoreValue.ofString("a>b"));

            assertThat(evaluator.evaluate("user.note == 'a>b'")).isTrue();
            assertThat(evaluator.evaluate("user.note != \"a>b\"")).isFalse();
        }

        @Test
        void shouldMatchUnsetKeyAgainstNull() {
            assertThat(evaluator.evaluate("task.activeDays == null")).isTrue();
            assertThat(evaluator.evaluate("task.activeDays != null")).isFalse();
        }

        @Test
        void shouldPreferTwoCharacterOperators() {
            store.set("user.age", StoreValue.ofInt(18));

            assertThat(evaluator.evaluate("user.age >= 18")).isTrue();
            assertThat(evaluator.evaluate("user.age<=17")).isFalse();
        }

        @ParameterizedTest
        @CsvSource({
                "user.streak > 2, true",
                "user.streak < 2, false",
                "user.streak == 3, true",
                "user.streak == 3.0, true",
                "user.streak != 4, true",
                "user.streak > abc, false"
        })
        void shouldCompareNumbersWithCoercion(String condition, boolean expected) {
            store.set("user.streak", StoreValue.ofString("3"));

            assertThat(evaluator.evaluate(condition)).isEqualTo(expected);
        }

        @Test
        void shouldFailSafeOnNonNumericRelationalComparison() {
            store.set("user.name", StoreValue.ofString("Ana"));

            assertThat(evaluator.evaluate("user.name > 3")).isFalse();
            assertThat(evaluator.evaluate("user.missing < 3")).isFalse();
        }

        @Test
        void shouldTestBareKeyForTruthiness() {
            store.set("user.isOnboarded", StoreValue.TRUE);
            store.set("user.tags", StoreValue.of(Arrays.asList()));
            store.set("user.count", StoreValue.ofInt(0));

            assertThat(evaluator.evaluate("user.isOnboarded")).isTrue();
            assertThat(evaluator.evaluate("user.tags")).isFalse();
            assertThat(evaluator.evaluate("user.count")).isFalse();
            assertThat(evaluator.evaluate("user.unknown")).isFalse();
        }

        @Test
        void shouldTreatKeyWithoutNamespaceAsNull() {
            store.set("streak", StoreValue.ofInt(5));

            assertThat(evaluator.evaluate("streak == null")).isTrue();
        }

        @Test
        void shouldCompareBooleansAndStrings() {
            store.set("user.subscribed", StoreValue.FALSE);
            store.set("session.timeOfDay", StoreValue.ofString("morning"));

            assertThat(evaluator.evaluate("user.subscribed == false")).isTrue();
            assertThat(evaluator.evaluate("session.timeOfDay == morning")).isTrue();
            assertThat(evaluator.evaluate("session.timeOfDay == 'evening'")).isFalse();
        }

        @Test
        void shouldReturnFalseForBlankCondition() {
            assertThat(evaluator.evaluate("  ")).isFalse();
            assertThat(evaluator.evaluateCompound("")).isFalse();
        }
    }

    @Nested
    class CompoundConditions {

        @BeforeEach
        void seed() {
            store.set("user.streak", StoreValue.ofInt(5));
            store.set("user.name", StoreValue.ofString("Ana"));
        }

        @Test
        void shouldShortCircuitOr() {
            assertThat(evaluator.evaluateCompound("user.streak > 10 || user.name == 'Ana'")).isTrue();
            assertThat(evaluator.evaluateCompound("user.streak > 10 || user.name == 'Bo'")).isFalse();
        }

        @Test
        void shouldRequireAllAndParts() {
            assertThat(evaluator.evaluateCompound("user.streak >= 5 && user.name == 'Ana'")).isTrue();
            assertThat(evaluator.evaluateCompound("user.streak >= 5 && user.name == 'Bo'")).isFalse();
        }

        @Test
        void shouldSplitOrBeforeAnd() {
            // reads as (false && true) || true
            assertThat(evaluator.evaluateCompound("user.streak > 10 && user.name == 'Ana' || user.streak == 5")).isTrue();
            // reads as false || (true && false)
            assertThat(evaluator.evaluateCompound("user.streak > 10 || user.name == 'Ana' && user.streak == 4")).isFalse();
        }

        @Test
        void shouldNotSplitInsideQuotes() {
            store.set("user.note", StoreValue.ofString("a||b"));

            assertThat(evaluator.evaluateCompound("user.note == 'a||b'")).isTrue();
            assertThat(evaluator.evaluateCompound("user.note == 'a||b' && user.streak == 5")).isTrue();
        }
    }
}
