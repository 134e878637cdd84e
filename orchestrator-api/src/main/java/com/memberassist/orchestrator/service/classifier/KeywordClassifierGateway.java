package com.memberassist.orchestrator.service.classifier;

import com.memberassist.orchestrator.config.WorkflowSettings;
import com.memberassist.orchestrator.model.CandidateKind;
import com.memberassist.orchestrator.model.ConversationTurn;
import com.memberassist.orchestrator.model.SelectedTool;
import com.memberassist.orchestrator.service.catalog.ToolCatalog;
import com.memberassist.orchestrator.service.catalog.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Offline classifier that scores catalog capabilities against the words of the query. Used for local
 * development where no model endpoint is available.
 */
@Component
@Profile("template")
public class KeywordClassifierGateway implements ClassifierGateway {

    private static final Logger log = LoggerFactory.getLogger(KeywordClassifierGateway.class);
    private static final Pattern GREETING = Pattern.compile("(?i)^\\s*(hi|hello|hey|thanks|thank you|good (morning|afternoon|evening)|bye|goodbye)\\b.*");
    private static final Pattern WORD_SPLIT = Pattern.compile("[^a-z0-9]+");
    private static final int MAX_ALTERNATIVES = 3;
    private static final Set<String> STOP_WORDS = Set.of("a", "an", "and", "the", "my", "of", "for", "to", "is",
            "are", "what", "how", "do", "i", "me", "can", "you", "with", "in", "on", "about");

    private final WorkflowSettings settings;

    public KeywordClassifierGateway(WorkflowSettings settings) {
        this.settings = settings;
    }

    @Override
    public ClassificationResult classify(String query, List<ConversationTurn> history, ToolCatalog catalog, Duration timeout) {
        if (GREETING.matcher(query).matches()) {
            return new ClassificationResult(
                    List.of(SelectedTool.of(CandidateKind.CONVERSATIONAL.name(), 10.0, "Greeting or small talk")),
                    10.0,
                    "Hello! I can help with your benefits, claims, documents and account questions.");
        }
        Set<String> words = words(query);
        List<SelectedTool> candidates = new ArrayList<>();
        for (ToolDefinition tool : catalog.all()) {
            long hits = keywords(tool).stream().filter(words::contains).count();
            if (hits > 0) {
                double confidence = Math.min(10.0, 4.0 + 2.5 * hits);
                candidates.add(SelectedTool.of(tool.name(), confidence, "Matched %d capability keywords".formatted(hits)));
            }
        }
        if (candidates.isEmpty()) {
            return ClassificationResult.of(8.0, SelectedTool.of(CandidateKind.NO_TOOL.name(), 8.0, "No capability keyword matched"));
        }
        // stable sort: the earlier catalog entry wins a tie
        candidates.sort(Comparator.comparingDouble(SelectedTool::confidence).reversed());
        SelectedTool best = candidates.get(0);
        log.debug("Keyword classifier picked {} at {} out of {} matches", best.toolName(), best.confidence(), candidates.size());
        // runner-ups only matter when the turn will be clarified; a confident turn executes the best match alone
        List<SelectedTool> ranked = best.confidence() >= settings.highThreshold()
                ? List.of(best)
                : candidates.subList(0, Math.min(MAX_ALTERNATIVES, candidates.size()));
        return ClassificationValidator.validate(new ClassificationResult(ranked, best.confidence(), null), catalog);
    }

    private Set<String> keywords(ToolDefinition tool) {
        return tool.capabilities().stream()
                .flatMap(capability -> Arrays.stream(WORD_SPLIT.split(capability.toLowerCase(Locale.ROOT))))
                .filter(word -> word.length() > 2 && !STOP_WORDS.contains(word))
                .collect(Collectors.toSet());
    }

    private Set<String> words(String query) {
        return Arrays.stream(WORD_SPLIT.split(query.toLowerCase(Locale.ROOT)))
                .filter(word -> !word.isBlank() && !STOP_WORDS.contains(word))
                .collect(Collectors.toSet());
    }
}
