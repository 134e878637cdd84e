package com.memberassist.orchestrator.controller;

import com.memberassist.orchestrator.model.InvocationRequest;
import com.memberassist.orchestrator.model.InvocationResponse;
import com.memberassist.orchestrator.service.workflow.InvalidInvocationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.List;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    static final String INVALID_REQUEST_MESSAGE =
            "I couldn't process that request. Please check your message and try again.";

    @ExceptionHandler(InvalidInvocationException.class)
    public ResponseEntity<InvocationResponse> handleInvalidInvocation(InvalidInvocationException exception) {
        log.debug("Rejected invocation: {}", exception.errors());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(InvocationResponse.rejected(exception.sessionId(), INVALID_REQUEST_MESSAGE, exception.errors()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<InvocationResponse> handleBindException(WebExchangeBindException exception) {
        List<String> errors = exception.getFieldErrors().stream()
                .map(this::describe)
                .toList();
        String sessionId = exception.getTarget() instanceof InvocationRequest request ? request.sessionId() : null;
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(InvocationResponse.rejected(sessionId, INVALID_REQUEST_MESSAGE, errors));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<InvocationResponse> handleUnreadableBody(ServerWebInputException exception) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(InvocationResponse.rejected(null, INVALID_REQUEST_MESSAGE,
                        List.of(exception.getReason() == null ? "request body is malformed" : exception.getReason())));
    }

    private String describe(FieldError error) {
        return error.getField() + " " + error.getDefaultMessage();
    }
}
