package com.memberassist.orchestrator.service.workflow.statemachine;

public enum TurnStates {
    START,
    CLASSIFYING,
    ROUTING,
    EXECUTING,
    CLARIFYING,
    FALLING_BACK,
    COMPOSING,
    COMPLETED
}
