package com.ai.coach.controller;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ai.coach.conversation.ChatMessage;
import com.ai.coach.conversation.FlowResult;
import com.ai.coach.conversation.MessageType;
import com.ai.coach.dto.FlowResponse;
import com.ai.coach.exception.FlowTraversalException;
import com.ai.coach.exception.InputNotAwaitedException;
import com.ai.coach.exception.SequenceLoadException;
import com.ai.coach.exception.SessionNotFoundException;
import com.ai.coach.service.ChatSessionService;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ChatController.class)
class ChatControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private ChatSessionService sessionService;

    private static FlowResponse awaitingChoice() {
        ChatMessage prompt = ChatMessage.builder().id(2).type(MessageType.CHOICE).text("Ready?").build();
        return FlowResponse.of("s-1", FlowResult.awaitingInput(List.of(prompt), 2, "onboarding"));
    }

    @Test
    void shouldStartSessionWithoutBody() throws Exception {
        when(sessionService.startSession(null)).thenReturn(awaitingChoice());

        mvc.perform(post("/api/chat/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value("s-1"))
                .andExpect(jsonPath("$.awaitingInput").value(true))
                .andExpect(jsonPath("$.interactionMessageId").value(2))
                .andExpect(jsonPath("$.sequenceId").value("onboarding"))
                .andExpect(jsonPath("$.messages[0].type").value("choice"))
                .andExpect(jsonPath("$.messages[0].text").value("Ready?"));
    }

    @Test
    void shouldStartRequestedSequence() throws Exception {
        when(sessionService.startSession("checkin")).thenReturn(awaitingChoice());

        mvc.perform(post("/api/chat/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sequenceId\":\"checkin\"}"))
                .andExpect(status().isOk());

        verify(sessionService).startSession("checkin");
    }

    @Test
    void shouldForwardChoice() throws Exception {
        when(sessionService.respondWithChoice("s-1", 2, 1))
                .thenReturn(FlowResponse.of("s-1", FlowResult.completed(Collections.emptyList(), "onboarding")));

        mvc.perform(post("/api/chat/sessions/s-1/choice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"messageId\":2,\"choiceIndex\":1}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.awaitingInput").value(false));
    }

    @Test
    void shouldRejectChoiceWithoutIndex() throws Exception {
        mvc.perform(post("/api/chat/sessions/s-1/choice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"messageId\":2}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_RESPONSE"));
    }

    @Test
    void shouldMapWrongMessageToBadRequest() throws Exception {
        when(sessionService.respondWithText(eq("s-1"), anyInt(), any()))
                .thenThrow(new InputNotAwaitedException(7, 3));

        mvc.perform(post("/api/chat/sessions/s-1/text")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"messageId\":7,\"text\":\"hello\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Message 7 is not awaiting input (awaiting 3)"));
    }

    @Test
    void shouldNotReportInternalStateErrorsAsBadResponse() {
        when(sessionService.getSessionData("s-1")).thenThrow(new IllegalStateException("Expected LIST but value is INT"));

        assertThatThrownBy(() -> mvc.perform(get("/api/chat/sessions/s-1/data")))
                .hasRootCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldMapUnknownSessionToNotFound() throws Exception {
        when(sessionService.getSessionData("nope")).thenThrow(new SessionNotFoundException("nope"));

        mvc.perform(get("/api/chat/sessions/nope/data"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("SESSION_NOT_FOUND"));
    }

    @Test
    void shouldMapEngineFailuresToUnprocessable() throws Exception {
        when(sessionService.startSession("missing"))
                .thenThrow(new SequenceLoadException("missing", "Sequence 'missing' not found"));
        when(sessionService.respondWithChoice("s-1", 1, 0))
                .thenThrow(new FlowTraversalException("Traversal exceeded 100 messages starting at 1"));

        mvc.perform(post("/api/chat/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sequenceId\":\"missing\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("SEQUENCE_LOAD_FAILED"));
        mvc.perform(post("/api/chat/sessions/s-1/choice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"messageId\":1,\"choiceIndex\":0}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("FLOW_TRAVERSAL_FAILED"));
    }

    @Test
    void shouldReturnSessionData() throws Exception {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("user.name", "Ana");
        data.put("user.streak", 3L);
        when(sessionService.getSessionData("s-1")).thenReturn(data);

        mvc.perform(get("/api/chat/sessions/s-1/data"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['user.name']").value("Ana"))
                .andExpect(jsonPath("$['user.streak']").value(3));
    }

    @Test
    void shouldEndSession() throws Exception {
        mvc.perform(delete("/api/chat/sessions/s-1")).andExpect(status().isNoContent());
        verify(sessionService).endSession("s-1");

        doThrow(new SessionNotFoundException("gone")).when(sessionService).endSession("gone");
        mvc.perform(delete("/api/chat/sessions/gone")).andExpect(status().isNotFound());
    }
}
