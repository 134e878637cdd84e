package com.memberassist.orchestrator.service.routing;

import com.memberassist.orchestrator.model.SelectedTool;
import com.memberassist.orchestrator.service.fallback.FallbackReason;

/**
 * @param reason  set only when {@code route} is {@link Route#FALLBACK}
 * @param primary top-ranked candidate, {@code null} when the classifier returned none
 */
public record RoutingDecision(Route route, FallbackReason reason, SelectedTool primary) {

    public static RoutingDecision execute(SelectedTool primary) {
        return new RoutingDecision(Route.EXECUTE, null, primary);
    }

    public static RoutingDecision clarify(SelectedTool primary) {
        return new RoutingDecision(Route.CLARIFY, null, primary);
    }

    public static RoutingDecision fallback(FallbackReason reason, SelectedTool primary) {
        return new RoutingDecision(Route.FALLBACK, reason, primary);
    }
}
