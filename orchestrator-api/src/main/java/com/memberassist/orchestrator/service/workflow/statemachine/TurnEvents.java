package com.memberassist.orchestrator.service.workflow.statemachine;

public enum TurnEvents {
    CLASSIFY,
    CLASSIFIED,
    CLASSIFICATION_FAILED,
    ROUTE_EXECUTE,
    ROUTE_CLARIFY,
    ROUTE_FALLBACK,
    CLARIFICATION_EXHAUSTED,
    TOOLS_SUCCEEDED,
    TOOLS_EXHAUSTED,
    CLARIFICATION_ISSUED,
    FALLBACK_ISSUED,
    COMPOSED
}
