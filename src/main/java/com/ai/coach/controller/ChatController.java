package com.ai.coach.controller;

import com.ai.coach.dto.ChoiceResponseRequest;
import com.ai.coach.dto.FlowResponse;
import com.ai.coach.dto.StartSessionRequest;
import com.ai.coach.dto.TextResponseRequest;
import com.ai.coach.service.ChatSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/chat/sessions")
public class ChatController {

    private static final Logger log = LoggerFactory.getLogger(ChatController.class);

    static final String MDC_SESSION = "chatSession";

    private final ChatSessionService sessionService;

    public ChatController(ChatSessionService sessionService) {
        this.sessionService = sessionService;
    }

    @PostMapping
    public ResponseEntity<FlowResponse> start(@RequestBody(required = false) StartSessionRequest request) {
        String sequenceId = request != null ? request.getSequenceId() : null;
        FlowResponse response = sessionService.startSession(sequenceId);
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_SESSION, response.getSessionId())) {
            log.info("Started session on '{}' with {} messages", response.getSequenceId(), response.getMessages().size());
        }
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{sessionId}/choice")
    public ResponseEntity<FlowResponse> choice(@PathVariable String sessionId,
                                               @RequestBody ChoiceResponseRequest request) {
        if (request.getMessageId() == null || request.getChoiceIndex() == null) {
            throw new IllegalArgumentException("messageId and choiceIndex are required");
        }
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_SESSION, sessionId)) {
            log.debug("Choice {} on message {}", request.getChoiceIndex(), request.getMessageId());
            return ResponseEntity.ok(sessionService.respondWithChoice(sessionId, request.getMessageId(), request.getChoiceIndex()));
        }
    }

    @PostMapping("/{sessionId}/text")
    public ResponseEntity<FlowResponse> text(@PathVariable String sessionId,
                                             @RequestBody TextResponseRequest request) {
        if (request.getMessageId() == null) {
            throw new IllegalArgumentException("messageId is required");
        }
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_SESSION, sessionId)) {
            log.debug("Text answer on message {}", request.getMessageId());
            return ResponseEntity.ok(sessionService.respondWithText(sessionId, request.getMessageId(), request.getText()));
        }
    }

    @GetMapping("/{sessionId}/data")
    public ResponseEntity<Map<String, Object>> data(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.getSessionData(sessionId));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> end(@PathVariable String sessionId) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_SESSION, sessionId)) {
            sessionService.endSession(sessionId);
        }
        return ResponseEntity.noContent().build();
    }
}
