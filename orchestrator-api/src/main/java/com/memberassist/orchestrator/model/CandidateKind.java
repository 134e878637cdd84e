package com.memberassist.orchestrator.model;

/**
 * What a classifier candidate points at. The two sentinels never resolve to a catalog entry.
 */
public enum CandidateKind {
    CATALOG_TOOL,
    NO_TOOL,
    CONVERSATIONAL;

    public static CandidateKind of(String toolName) {
        if (NO_TOOL.name().equals(toolName)) {
            return NO_TOOL;
        }
        if (CONVERSATIONAL.name().equals(toolName)) {
            return CONVERSATIONAL;
        }
        return CATALOG_TOOL;
    }

    public boolean isSentinel() {
        return this != CATALOG_TOOL;
    }
}
