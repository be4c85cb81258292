package com.ai.coach.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.ai.coach.conversation.ChatMessage;
import com.ai.coach.conversation.ChatSequence;
import com.ai.coach.conversation.MessageType;
import com.ai.coach.conversation.RouteCondition;
import com.ai.coach.conversation.RouteDecision;
import com.ai.coach.store.InMemoryKeyValueStore;
import com.ai.coach.store.StoreValue;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RouteProcessorTest {

    @Mock private SequenceTransitionManager transitionManager;

    private InMemoryKeyValueStore store;
    private RouteProcessor routeProcessor;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        routeProcessor = new RouteProcessor("test", new ConditionEvaluator(store), transitionManager);
    }

    private static RouteCondition rule(String condition, int target) {
        return RouteCondition.builder().condition(condition).nextMessageId(target).build();
    }

    private static RouteCondition fallback(int target) {
        return RouteCondition.builder().defaultRoute(true).nextMessageId(target).build();
    }

    private static ChatMessage autoroute(Integer next, RouteCondition... routes) {
        return ChatMessage.builder()
                .id(2)
                .type(MessageType.AUTOROUTE)
                .nextMessageId(next)
                .routes(Arrays.asList(routes))
                .build();
    }

    @Test
    void shouldPickFirstMatchingConditionOverDefault() {
        store.set("user.x", StoreValue.ofInt(2));

        RouteDecision decision = routeProcessor.processAutoRoute(
                autoroute(null, rule("user.x == 1", 5), rule("user.x == 2", 6), fallback(7)));

        assertThat(decision.getNextMessageId()).isEqualTo(6);
        verifyNoInteractions(transitionManager);
    }

    @Test
    void shouldNotLetLeadingDefaultShadowLaterMatch() {
        store.set("user.x", StoreValue.ofInt(2));

        RouteDecision decision = routeProcessor.processAutoRoute(
                autoroute(null, fallback(7), rule("user.x == 1", 5), rule("user.x == 2", 6)));

        assertThat(decision.getNextMessageId()).isEqualTo(6);
    }

    @Test
    void shouldTakeDefaultWhenNothingMatches() {
        store.set("user.x", StoreValue.ofInt(9));

        RouteDecision decision = routeProcessor.processAutoRoute(
                autoroute(null, rule("user.x == 1", 5), fallback(7), rule("user.x == 2", 6)));

        assertThat(decision.getNextMessageId()).isEqualTo(7);
    }

    @Test
    void shouldFallBackToNodeSuccessorWithoutDefault() {
        RouteDecision decision = routeProcessor.processAutoRoute(autoroute(42, rule("user.x == 1", 5)));

        assertThat(decision.getNextMessageId()).isEqualTo(42);
        assertThat(decision.isSequenceSwitch()).isFalse();
    }

    @Test
    void shouldEndWhenNothingMatchesAndNoSuccessor() {
        RouteDecision decision = routeProcessor.processAutoRoute(autoroute(null, rule("user.x == 1", 5)));

        assertThat(decision.isEnd()).isTrue();
    }

    @Test
    void shouldSwitchSequenceAndResumeAtItsEntryMessage() {
        ChatSequence target = new ChatSequence("checkin", null, null, Collections.singletonList(
                ChatMessage.builder().id(10).text("hi").build()));
        when(transitionManager.transitionToSequence("checkin")).thenReturn(target);
        when(transitionManager.entryMessageId(target)).thenReturn(10);

        RouteDecision decision = routeProcessor.processAutoRoute(autoroute(null,
                RouteCondition.builder().defaultRoute(true).sequenceId("checkin").build()));

        verify(transitionManager).transitionToSequence("checkin");
        assertThat(decision.isSequenceSwitch()).isTrue();
        assertThat(decision.getSwitchedToSequenceId()).isEqualTo("checkin");
        assertThat(decision.getNextMessageId()).isEqualTo(10);
    }
}
