package com.memberassist.orchestrator.service.tools;

/**
 * Position of the invocation loop.
 *
 * @param toolIndex index into the execution plan
 * @param retries   retries already spent on {@code toolIndex}; the attempt about to run is {@code retries + 1}
 */
public record InvocationStep(InvocationPhase phase, int toolIndex, int retries) {

    public InvocationStep {
        if (toolIndex < 0 || retries < 0) {
            throw new IllegalArgumentException("toolIndex and retries must not be negative");
        }
    }

    public static InvocationStep pending(int toolIndex, int retries) {
        return new InvocationStep(InvocationPhase.PENDING, toolIndex, retries);
    }

    public int attempt() {
        return retries + 1;
    }
}
