package com.memberassist.orchestrator.service.classifier;

import com.memberassist.orchestrator.config.WorkflowSettings;
import com.memberassist.orchestrator.model.CandidateKind;
import com.memberassist.orchestrator.model.SelectedTool;
import com.memberassist.orchestrator.service.catalog.ToolCatalog;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Schema checks applied to every classifier answer before it reaches the router.
 */
public final class ClassificationValidator {

    private ClassificationValidator() {
    }

    public static ClassificationResult validate(ClassificationResult result, ToolCatalog catalog) {
        if (result == null || result.candidates().isEmpty()) {
            throw new MalformedClassificationException("Classifier returned no candidates");
        }
        checkConfidence(result.confidence(), "overall confidence");
        Map<String, SelectedTool> plan = new HashMap<>();
        for (SelectedTool candidate : result.candidates()) {
            if (candidate == null || candidate.toolName() == null || candidate.toolName().isBlank()) {
                throw new MalformedClassificationException("Candidate without a tool name");
            }
            checkConfidence(candidate.confidence(), "confidence of " + candidate.toolName());
            if (candidate.kind() == CandidateKind.CATALOG_TOOL && !catalog.contains(candidate.toolName())) {
                throw new MalformedClassificationException("Unknown tool '%s'".formatted(candidate.toolName()));
            }
            plan.putIfAbsent(candidate.toolName(), candidate);
        }
        for (SelectedTool candidate : result.candidates()) {
            String dependency = candidate.dependsOn();
            if (dependency == null) {
                continue;
            }
            if (dependency.equals(candidate.toolName())) {
                throw new MalformedClassificationException("Tool '%s' depends on itself".formatted(dependency));
            }
            if (!plan.containsKey(dependency)) {
                throw new MalformedClassificationException(
                        "Tool '%s' depends on '%s' which is not part of the plan".formatted(candidate.toolName(), dependency));
            }
            checkAcyclic(candidate, plan);
        }
        return result;
    }

    private static void checkAcyclic(SelectedTool start, Map<String, SelectedTool> plan) {
        Set<String> visited = new HashSet<>();
        SelectedTool current = start;
        while (current != null && current.dependsOn() != null) {
            if (!visited.add(current.toolName())) {
                throw new MalformedClassificationException("Dependency cycle through '%s'".formatted(current.toolName()));
            }
            current = plan.get(current.dependsOn());
        }
    }

    private static void checkConfidence(double confidence, String label) {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > WorkflowSettings.MAX_CONFIDENCE) {
            throw new MalformedClassificationException("%s %s is outside 0-10".formatted(label, confidence));
        }
    }
}
