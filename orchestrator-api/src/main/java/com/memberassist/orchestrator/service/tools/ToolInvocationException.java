package com.memberassist.orchestrator.service.tools;

/**
 * One failed attempt against a tool endpoint. The invocation engine decides whether to retry.
 */
public class ToolInvocationException extends RuntimeException {

    private final String toolName;

    public ToolInvocationException(String toolName, String message) {
        super(message);
        this.toolName = toolName;
    }

    public ToolInvocationException(String toolName, String message, Throwable cause) {
        super(message, cause);
        this.toolName = toolName;
    }

    public String toolName() {
        return toolName;
    }
}
