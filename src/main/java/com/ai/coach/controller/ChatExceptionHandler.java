package com.ai.coach.controller;

import com.ai.coach.dto.ErrorResponse;
import com.ai.coach.exception.FlowTraversalException;
import com.ai.coach.exception.InputNotAwaitedException;
import com.ai.coach.exception.SequenceLoadException;
import com.ai.coach.exception.SequenceTransitionException;
import com.ai.coach.exception.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ChatExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ChatExceptionHandler.class);

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> sessionNotFound(SessionNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse("SESSION_NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(SequenceLoadException.class)
    public ResponseEntity<ErrorResponse> sequenceLoad(SequenceLoadException e) {
        log.warn("Sequence load failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(new ErrorResponse("SEQUENCE_LOAD_FAILED", e.getMessage()));
    }

    @ExceptionHandler(SequenceTransitionException.class)
    public ResponseEntity<ErrorResponse> sequenceTransition(SequenceTransitionException e) {
        if (e.isInconsistent()) {
            log.error("Sequence transition left session inconsistent: {}", e.getMessage());
        } else {
            log.warn("Sequence transition failed: {}", e.getMessage());
        }
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(new ErrorResponse("SEQUENCE_TRANSITION_FAILED", e.getMessage()));
    }

    @ExceptionHandler(FlowTraversalException.class)
    public ResponseEntity<ErrorResponse> traversal(FlowTraversalException e) {
        log.warn("Flow traversal failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(new ErrorResponse("FLOW_TRAVERSAL_FAILED", e.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, InputNotAwaitedException.class})
    public ResponseEntity<ErrorResponse> badResponse(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ErrorResponse("BAD_RESPONSE", e.getMessage()));
    }
}
