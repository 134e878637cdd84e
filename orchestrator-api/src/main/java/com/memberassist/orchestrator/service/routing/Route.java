package com.memberassist.orchestrator.service.routing;

public enum Route {
    EXECUTE,
    CLARIFY,
    FALLBACK
}
