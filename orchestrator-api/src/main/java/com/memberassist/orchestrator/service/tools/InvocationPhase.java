package com.memberassist.orchestrator.service.tools;

public enum InvocationPhase {
    PENDING,
    RETRYING,
    ADVANCING,
    SUCCEEDED,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == EXHAUSTED;
    }
}
