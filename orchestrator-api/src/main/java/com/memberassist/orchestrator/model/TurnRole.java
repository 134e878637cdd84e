package com.memberassist.orchestrator.model;

public enum TurnRole {
    USER,
    ASSISTANT
}
