package com.memberassist.orchestrator.service.tools;

/**
 * Transition function of the tool invocation loop. Free of I/O so the retry bound can be checked in isolation.
 */
public final class InvocationTransitions {

    private final int planSize;
    private final int maxAttempts;

    public InvocationTransitions(int planSize, int maxAttempts) {
        if (planSize < 1) {
            throw new IllegalArgumentException("An execution plan needs at least one tool");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.planSize = planSize;
        this.maxAttempts = maxAttempts;
    }

    public InvocationStep start() {
        return InvocationStep.pending(0, 0);
    }

    public InvocationStep onSuccess(InvocationStep step) {
        require(step, InvocationPhase.PENDING);
        if (step.toolIndex() == planSize - 1) {
            return new InvocationStep(InvocationPhase.SUCCEEDED, step.toolIndex(), step.retries());
        }
        return new InvocationStep(InvocationPhase.ADVANCING, step.toolIndex() + 1, 0);
    }

    public InvocationStep onFailure(InvocationStep step) {
        require(step, InvocationPhase.PENDING);
        if (step.attempt() >= maxAttempts) {
            return new InvocationStep(InvocationPhase.EXHAUSTED, step.toolIndex(), step.retries());
        }
        return new InvocationStep(InvocationPhase.RETRYING, step.toolIndex(), step.retries() + 1);
    }

    /**
     * {@code RETRYING(i, n)} and {@code ADVANCING(i)} both resume at {@code PENDING(i)}.
     */
    public InvocationStep resume(InvocationStep step) {
        if (step.phase() != InvocationPhase.RETRYING && step.phase() != InvocationPhase.ADVANCING) {
            throw new IllegalStateException("Cannot resume from " + step.phase());
        }
        return InvocationStep.pending(step.toolIndex(), step.retries());
    }

    private static void require(InvocationStep step, InvocationPhase expected) {
        if (step.phase() != expected) {
            throw new IllegalStateException("Expected %s but was %s".formatted(expected, step.phase()));
        }
    }
}
