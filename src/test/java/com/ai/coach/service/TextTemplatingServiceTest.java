package com.ai.coach.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ai.coach.config.ChatEngineSettings;
import com.ai.coach.store.InMemoryKeyValueStore;
import com.ai.coach.store.StoreValue;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TextTemplatingServiceTest {

    private InMemoryKeyValueStore store;
    private TextTemplatingService templating;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        templating = new TextTemplatingService(store,
                new FormatterService(new ObjectMapper(), ChatEngineSettings.defaults()));
    }

    @Test
    void shouldSubstituteStoredValues() {
        store.set("user.name", StoreValue.ofString("Ana"));
        store.set("user.streak", StoreValue.ofInt(4));

        assertThat(templating.process("Hi {user.name}, streak {user.streak}!")).isEqualTo("Hi Ana, streak 4!");
    }

    @Test
    void shouldPreferStoredValueOverFallback() {
        store.set("user.name", StoreValue.ofString("Ana"));

        assertThat(templating.process("Hi {user.name|friend}")).isEqualTo("Hi Ana");
        assertThat(templating.process("Hi {user.nickname|friend}")).isEqualTo("Hi friend");
        assertThat(templating.process("Hi {user.nickname|}")).isEqualTo("Hi ");
    }

    @Test
    void shouldLeavePlaceholderWithoutValueOrFallback() {
        assertThat(templating.process("Hi {user.name}")).isEqualTo("Hi {user.name}");
    }

    @Test
    void shouldNotTreatDollarSignsAsGroupReferences() {
        store.set("user.price", StoreValue.ofString("$5"));

        assertThat(templating.process("Costs {user.price}")).isEqualTo("Costs $5");
    }

    @Test
    void shouldFormatThroughTable() {
        store.set("session.timeOfDay", StoreValue.ofInt(1));

        assertThat(templating.process("Good {session.timeOfDay:timeOfDay|day}")).isEqualTo("Good morning");
    }

    @Test
    void shouldUseFallbackWhenTableHasNoEntry() {
        store.set("session.timeOfDay", StoreValue.ofInt(9));

        assertThat(templating.process("Good {session.timeOfDay:timeOfDay|day}")).isEqualTo("Good day");
        assertThat(templating.process("Good {session.timeOfDay:timeOfDay}")).isEqualTo("Good {session.timeOfDay:timeOfDay}");
    }

    @Test
    void shouldJoinListsWithGrammar() {
        store.set("task.activeDays", Arrays.asList(1, 3, 5));
        store.set("task.weekend", StoreValue.ofString("6,7"));
        store.set("task.single", StoreValue.ofString("[2]"));

        assertThat(templating.process("{task.activeDays:activeDays:join}")).isEqualTo("Monday, Wednesday and Friday");
        assertThat(templating.process("{task.weekend:activeDays:join}")).isEqualTo("weekends");
        assertThat(templating.process("{task.single:activeDays:join}")).isEqualTo("Tuesday");
    }

    @Test
    void shouldApplyCaseFlags() {
        store.set("user.name", StoreValue.ofString("ana maria"));
        store.set("session.timeOfDay", StoreValue.ofInt(3));

        assertThat(templating.process("{user.name:upper}")).isEqualTo("ANA MARIA");
        assertThat(templating.process("{user.name:proper}")).isEqualTo("Ana Maria");
        assertThat(templating.process("{session.timeOfDay:timeOfDay:sentence}")).isEqualTo("Evening");
        assertThat(templating.process("{user.missing:upper|friend}")).isEqualTo("FRIEND");
    }

    @Test
    void shouldDetectPlaceholders() {
        assertThat(TextTemplatingService.hasPlaceholders("{user.name}")).isTrue();
        assertThat(TextTemplatingService.hasPlaceholders("no braces")).isFalse();
    }
}
