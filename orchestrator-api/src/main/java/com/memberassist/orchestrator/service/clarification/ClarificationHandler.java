package com.memberassist.orchestrator.service.clarification;

import com.memberassist.orchestrator.model.SelectedTool;
import com.memberassist.orchestrator.service.catalog.ToolCatalog;
import com.memberassist.orchestrator.service.catalog.ToolDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds the disambiguation question for an ambiguous turn. The question only ever names catalog tools; the
 * session flag is set by the workflow engine when it writes the turn back.
 */
@Component
public class ClarificationHandler {

    private static final int MAX_OPTIONS = 3;

    public String question(List<SelectedTool> candidates, ToolCatalog catalog) {
        Set<String> options = new LinkedHashSet<>();
        for (SelectedTool candidate : candidates) {
            if (candidate.kind().isSentinel()) {
                continue;
            }
            catalog.lookup(candidate.toolName())
                    .map(ClarificationHandler::topic)
                    .ifPresent(options::add);
            if (options.size() == MAX_OPTIONS) {
                break;
            }
        }
        List<String> topics = new ArrayList<>(options);
        if (topics.isEmpty()) {
            return "Could you tell me a little more about what you need help with?";
        }
        if (topics.size() == 1) {
            return "Just to make sure I help with the right thing: is your question about %s? Please add any details that might help."
                    .formatted(topics.get(0));
        }
        String last = topics.remove(topics.size() - 1);
        return "I want to make sure I point you in the right direction. Is your question about %s, or %s?"
                .formatted(String.join(", ", topics), last);
    }

    /**
     * First sentence of the tool description, lower-cased at the start and without the trailing period.
     */
    static String topic(ToolDefinition tool) {
        String description = tool.description().trim();
        int end = description.indexOf('.');
        String sentence = end > 0 ? description.substring(0, end) : description;
        if (sentence.length() > 1 && Character.isUpperCase(sentence.charAt(0)) && !Character.isUpperCase(sentence.charAt(1))) {
            sentence = sentence.substring(0, 1).toLowerCase(Locale.ROOT) + sentence.substring(1);
        }
        return sentence;
    }
}
