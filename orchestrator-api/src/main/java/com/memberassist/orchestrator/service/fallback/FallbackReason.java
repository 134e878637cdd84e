package com.memberassist.orchestrator.service.fallback;

/**
 * Machine-readable reason codes and the fixed member-facing text for each of them.
 */
public enum FallbackReason {
    NO_TOOL_FOUND("no_tool_found",
            "I'm sorry, I couldn't find the right resource to help with your question. Please try rephrasing your query or contact our support team for assistance."),
    LOW_CONFIDENCE("low_confidence",
            "I'm not entirely sure I understand your question. Could you please provide more details or rephrase your request?"),
    SERVICE_UNAVAILABLE("service_unavailable",
            "I'm currently experiencing technical difficulties. Please try again in a few moments or contact support if the issue persists."),
    TOOL_FAILURE("tool_failure",
            "I wasn't able to retrieve that information right now. Please try again in a few moments or contact support if the issue persists."),
    CLARIFICATION_EXHAUSTED("clarification_exhausted",
            "I'm still not sure how to help with that request. Please contact our support team so someone can assist you directly."),
    CONVERSATIONAL("conversational",
            "Hello! I'm here to help you with your insurance benefits and claims. What can I assist you with today?"),
    SESSION_CONFLICT("session_conflict",
            "Your conversation was updated from another request while I was working on this one. Please send your message again.");

    private final String code;
    private final String message;

    FallbackReason(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String code() {
        return code;
    }

    public String message() {
        return message;
    }
}
