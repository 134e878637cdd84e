package com.memberassist.orchestrator.service.workflow.statemachine;

import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.config.StateMachineBuilder;
import org.springframework.stereotype.Component;

import java.util.EnumSet;

/**
 * Builds the per-turn node graph. Every edge is taken at most once per turn; the tool retry cycle lives inside
 * the {@link TurnStates#EXECUTING} node.
 */
@Component
public class TurnStateMachineFactory {

    public TurnGraph create(String sessionId) {
        try {
            return new TurnGraph(build(sessionId));
        } catch (Exception e) {
            throw new IllegalStateException("Unable to build turn state machine", e);
        }
    }

    private StateMachine<TurnStates, TurnEvents> build(String sessionId) throws Exception {
        StateMachineBuilder.Builder<TurnStates, TurnEvents> builder = StateMachineBuilder.builder();
        builder.configureConfiguration()
                .withConfiguration()
                    .machineId("turn-" + sessionId)
                    .autoStartup(false);
        builder.configureStates()
                .withStates()
                    .initial(TurnStates.START)
                    .states(EnumSet.allOf(TurnStates.class));
        builder.configureTransitions()
                .withExternal()
                    .source(TurnStates.START)
                    .target(TurnStates.CLASSIFYING)
                    .event(TurnEvents.CLASSIFY)
                .and()
                .withExternal()
                    .source(TurnStates.CLASSIFYING)
                    .target(TurnStates.ROUTING)
                    .event(TurnEvents.CLASSIFIED)
                .and()
                .withExternal()
                    .source(TurnStates.CLASSIFYING)
                    .target(TurnStates.FALLING_BACK)
                    .event(TurnEvents.CLASSIFICATION_FAILED)
                .and()
                .withExternal()
                    .source(TurnStates.ROUTING)
                    .target(TurnStates.EXECUTING)
                    .event(TurnEvents.ROUTE_EXECUTE)
                .and()
                .withExternal()
                    .source(TurnStates.ROUTING)
                    .target(TurnStates.CLARIFYING)
                    .event(TurnEvents.ROUTE_CLARIFY)
                .and()
                .withExternal()
                    .source(TurnStates.ROUTING)
                    .target(TurnStates.FALLING_BACK)
                    .event(TurnEvents.ROUTE_FALLBACK)
                .and()
                .withExternal()
                    .source(TurnStates.ROUTING)
                    .target(TurnStates.FALLING_BACK)
                    .event(TurnEvents.CLARIFICATION_EXHAUSTED)
                .and()
                .withExternal()
                    .source(TurnStates.EXECUTING)
                    .target(TurnStates.COMPOSING)
                    .event(TurnEvents.TOOLS_SUCCEEDED)
                .and()
                .withExternal()
                    .source(TurnStates.EXECUTING)
                    .target(TurnStates.FALLING_BACK)
                    .event(TurnEvents.TOOLS_EXHAUSTED)
                .and()
                .withExternal()
                    .source(TurnStates.CLARIFYING)
                    .target(TurnStates.COMPOSING)
                    .event(TurnEvents.CLARIFICATION_ISSUED)
                .and()
                .withExternal()
                    .source(TurnStates.FALLING_BACK)
                    .target(TurnStates.COMPOSING)
                    .event(TurnEvents.FALLBACK_ISSUED)
                .and()
                .withExternal()
                    .source(TurnStates.COMPOSING)
                    .target(TurnStates.COMPLETED)
                    .event(TurnEvents.COMPOSED);
        return builder.build();
    }
}
