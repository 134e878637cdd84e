package com.memberassist.orchestrator.service.tools;

import com.memberassist.orchestrator.model.SelectedTool;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Catalog tools of a classification in execution order: classifier order, except that a tool never runs
 * before the tool it depends on.
 */
public record ExecutionPlan(List<SelectedTool> steps) {

    public ExecutionPlan {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static ExecutionPlan from(List<SelectedTool> candidates) {
        Map<String, SelectedTool> byName = new LinkedHashMap<>();
        for (SelectedTool candidate : candidates) {
            if (!candidate.kind().isSentinel()) {
                byName.putIfAbsent(candidate.toolName(), candidate);
            }
        }
        List<SelectedTool> remaining = new ArrayList<>(byName.values());
        List<SelectedTool> ordered = new ArrayList<>(remaining.size());
        Set<String> placed = new HashSet<>();
        while (!remaining.isEmpty()) {
            SelectedTool next = null;
            for (SelectedTool candidate : remaining) {
                String dependency = candidate.dependsOn();
                if (dependency == null || !byName.containsKey(dependency) || placed.contains(dependency)) {
                    next = candidate;
                    break;
                }
            }
            if (next == null) {
                // unresolvable dependencies keep classifier order
                next = remaining.get(0);
            }
            remaining.remove(next);
            ordered.add(next);
            placed.add(next.toolName());
        }
        return new ExecutionPlan(ordered);
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public int size() {
        return steps.size();
    }

    public SelectedTool get(int index) {
        return steps.get(index);
    }

    public List<String> toolNames() {
        return steps.stream().map(SelectedTool::toolName).toList();
    }
}
