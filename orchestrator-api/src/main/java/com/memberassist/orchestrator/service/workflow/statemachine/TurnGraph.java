package com.memberassist.orchestrator.service.workflow.statemachine;

import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.listener.StateMachineListenerAdapter;
import org.springframework.statemachine.state.State;

import java.util.ArrayList;
import java.util.List;

/**
 * One started turn machine plus the nodes it has visited.
 */
public final class TurnGraph {

    private final StateMachine<TurnStates, TurnEvents> machine;
    private final List<TurnStates> path = new ArrayList<>();

    TurnGraph(StateMachine<TurnStates, TurnEvents> machine) {
        this.machine = machine;
        this.machine.addStateListener(new StateMachineListenerAdapter<>() {
            @Override
            public void stateChanged(State<TurnStates, TurnEvents> from, State<TurnStates, TurnEvents> to) {
                if (to != null) {
                    path.add(to.getId());
                }
            }
        });
        this.machine.start();
    }

    /**
     * @throws IllegalStateException when the current node has no edge for {@code event}
     */
    public void fire(TurnEvents event) {
        TurnStates before = current();
        if (!machine.sendEvent(event)) {
            throw new IllegalStateException("Event %s not accepted in state %s".formatted(event, before));
        }
    }

    public TurnStates current() {
        return machine.getState().getId();
    }

    public List<TurnStates> path() {
        return List.copyOf(path);
    }

    public void stop() {
        machine.stop();
    }
}
