package com.memberassist.orchestrator.service.routing;

import com.memberassist.orchestrator.config.WorkflowSettings;
import com.memberassist.orchestrator.model.SelectedTool;
import com.memberassist.orchestrator.service.classifier.ClassificationResult;
import com.memberassist.orchestrator.service.fallback.FallbackReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class ConfidenceRouter {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceRouter.class);

    private final double highThreshold;
    private final double lowThreshold;

    public ConfidenceRouter(WorkflowSettings settings) {
        this.highThreshold = settings.highThreshold();
        this.lowThreshold = settings.lowThreshold();
    }

    public RoutingDecision route(ClassificationResult result) {
        return route(result.confidence(), result.candidates());
    }

    /**
     * Sentinel candidates always fall back; otherwise the overall confidence picks the route.
     */
    public RoutingDecision route(double confidence, List<SelectedTool> candidates) {
        Optional<SelectedTool> top = new ClassificationResult(candidates, confidence, null).top();
        if (top.isEmpty()) {
            return RoutingDecision.fallback(FallbackReason.NO_TOOL_FOUND, null);
        }
        SelectedTool primary = top.get();
        RoutingDecision decision = switch (primary.kind()) {
            case NO_TOOL -> RoutingDecision.fallback(FallbackReason.NO_TOOL_FOUND, primary);
            case CONVERSATIONAL -> RoutingDecision.fallback(FallbackReason.CONVERSATIONAL, primary);
            case CATALOG_TOOL -> byConfidence(confidence, primary);
        };
        log.debug("Routed {} at confidence {} to {}", primary.toolName(), confidence, decision.route());
        return decision;
    }

    private RoutingDecision byConfidence(double confidence, SelectedTool primary) {
        if (confidence >= highThreshold) {
            return RoutingDecision.execute(primary);
        }
        if (confidence >= lowThreshold) {
            return RoutingDecision.clarify(primary);
        }
        return RoutingDecision.fallback(FallbackReason.LOW_CONFIDENCE, primary);
    }
}
