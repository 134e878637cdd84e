package com.memberassist.orchestrator.service.workflow;

import java.util.List;

/**
 * Raised before a turn starts when the inbound request is malformed. Never enters the turn graph.
 */
public class InvalidInvocationException extends RuntimeException {

    private final String sessionId;
    private final List<String> errors;

    public InvalidInvocationException(String sessionId, List<String> errors) {
        super("Invalid invocation: " + String.join("; ", errors));
        this.sessionId = sessionId;
        this.errors = List.copyOf(errors);
    }

    public String sessionId() {
        return sessionId;
    }

    public List<String> errors() {
        return errors;
    }
}
