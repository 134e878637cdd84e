package com.memberassist.orchestrator.service.session;

public class ConcurrentSessionModificationException extends RuntimeException {

    private final String sessionId;

    public ConcurrentSessionModificationException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public ConcurrentSessionModificationException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
