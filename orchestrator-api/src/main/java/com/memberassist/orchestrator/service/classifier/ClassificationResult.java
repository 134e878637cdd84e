package com.memberassist.orchestrator.service.classifier;

import com.memberassist.orchestrator.model.SelectedTool;

import java.util.List;
import java.util.Optional;

/**
 * Ranked candidates in classifier order plus the overall confidence for the turn.
 */
public record ClassificationResult(List<SelectedTool> candidates,
                                   double confidence,
                                   String directResponse) {

    public ClassificationResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static ClassificationResult of(double confidence, SelectedTool... candidates) {
        return new ClassificationResult(List.of(candidates), confidence, null);
    }

    /**
     * Highest-confidence candidate; the earliest one wins a tie.
     */
    public Optional<SelectedTool> top() {
        SelectedTool best = null;
        for (SelectedTool candidate : candidates) {
            if (best == null || candidate.confidence() > best.confidence()) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    public Optional<String> directResponseText() {
        return Optional.ofNullable(directResponse).filter(text -> !text.isBlank());
    }
}
