package com.memberassist.orchestrator.service.classifier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memberassist.orchestrator.config.OrchestratorProperties;
import com.memberassist.orchestrator.model.ConversationTurn;
import com.memberassist.orchestrator.model.SelectedTool;
import com.memberassist.orchestrator.model.TurnRole;
import com.memberassist.orchestrator.service.catalog.ToolCatalog;
import com.memberassist.orchestrator.service.catalog.ToolDefinition;
import com.memberassist.orchestrator.service.catalog.ToolExample;
import com.memberassist.orchestrator.service.classifier.openai.ChatCompletionClient;
import com.memberassist.orchestrator.service.classifier.openai.LlmClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Asks a chat-completion model to pick tools from the catalog and score its certainty on a 0-10 scale.
 */
@Component
@Profile("!template")
public class LlmClassifierGateway implements ClassifierGateway {

    private static final Logger log = LoggerFactory.getLogger(LlmClassifierGateway.class);

    private final ChatCompletionClient chatClient;
    private final ObjectMapper objectMapper;
    private final String model;
    private final double temperature;
    private final int maxTokens;

    public LlmClassifierGateway(ChatCompletionClient chatClient,
                                ObjectMapper objectMapper,
                                OrchestratorProperties properties) {
        this.chatClient = chatClient;
        this.objectMapper = objectMapper;
        this.model = properties.getLlm().getModel();
        this.temperature = properties.getLlm().getTemperature();
        this.maxTokens = Math.max(128, properties.getLlm().getMaxOutputTokens());
    }

    @Override
    public ClassificationResult classify(String query, List<ConversationTurn> history, ToolCatalog catalog, Duration timeout) {
        List<ChatCompletionClient.Message> messages = buildMessages(query, history, catalog);
        Map<String, Object> params = Map.of("response_format", Map.of("type", "json_object"));

        ChatCompletionClient.ChatCompletionResponse response;
        try {
            response = chatClient.complete(
                    new ChatCompletionClient.Request(model, messages, temperature, maxTokens, params), timeout);
        } catch (LlmClientException ex) {
            throw new ClassifierUnavailableException("Classifier unavailable: " + ex.getMessage(), ex);
        }
        ChatCompletionClient.Choice choice = response == null ? null : response.firstChoice();
        if (choice == null || choice.message() == null || choice.message().content() == null) {
            throw new MalformedClassificationException("Classifier returned an empty completion");
        }
        ClassificationResult result = ClassificationValidator.validate(parse(choice.message().content()), catalog);
        log.debug("Classified query with confidence {} into {}", result.confidence(),
                result.candidates().stream().map(SelectedTool::toolName).toList());
        return result;
    }

    ClassificationResult parse(String content) {
        JsonNode node;
        try {
            node = objectMapper.readTree(sanitize(content));
        } catch (JsonProcessingException ex) {
            throw new MalformedClassificationException("Classifier answer is not valid JSON", ex);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedClassificationException("Classifier answer must be a JSON object");
        }
        List<SelectedTool> candidates = new ArrayList<>();
        JsonNode candidatesNode = node.path("candidates");
        if (candidatesNode.isArray()) {
            for (JsonNode candidate : candidatesNode) {
                candidates.add(toCandidate(candidate));
            }
        } else if (node.hasNonNull("selected_tool")) {
            // single-selection answer: {selected_tool, confidence_score, reasoning}
            candidates.add(new SelectedTool(
                    node.path("selected_tool").asText(),
                    requireNumber(node, "confidence_score"),
                    node.path("reasoning").asText(""),
                    Map.of(), null, List.of()));
        } else {
            throw new MalformedClassificationException("Classifier answer has no candidates");
        }
        if (candidates.isEmpty()) {
            throw new MalformedClassificationException("Classifier answer has no candidates");
        }
        double confidence = node.has("confidence")
                ? requireNumber(node, "confidence")
                : new ClassificationResult(candidates, 0.0, null).top().map(SelectedTool::confidence).orElse(0.0);
        String directResponse = node.hasNonNull("direct_response") ? node.get("direct_response").asText() : null;
        return new ClassificationResult(candidates, confidence, directResponse);
    }

    private SelectedTool toCandidate(JsonNode candidate) {
        if (!candidate.isObject() || !candidate.path("tool_name").isTextual()) {
            throw new MalformedClassificationException("Candidate is missing tool_name");
        }
        Map<String, Object> parameters = new LinkedHashMap<>();
        JsonNode parametersNode = candidate.path("parameters");
        if (parametersNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = parametersNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                parameters.put(field.getKey(), objectMapper.convertValue(field.getValue(), Object.class));
            }
        }
        List<String> contextNeeded = new ArrayList<>();
        candidate.path("context_needed").forEach(field -> {
            if (field.isTextual() && !field.asText().isBlank()) {
                contextNeeded.add(field.asText());
            }
        });
        String dependsOn = candidate.hasNonNull("depends_on") ? candidate.get("depends_on").asText() : null;
        return new SelectedTool(
                candidate.get("tool_name").asText(),
                requireNumber(candidate, "confidence"),
                candidate.path("reasoning").asText(""),
                parameters,
                dependsOn == null || dependsOn.isBlank() ? null : dependsOn,
                contextNeeded);
    }

    private double requireNumber(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new MalformedClassificationException("Field '%s' must be a number".formatted(field));
        }
        return value.asDouble();
    }

    private List<ChatCompletionClient.Message> buildMessages(String query, List<ConversationTurn> history, ToolCatalog catalog) {
        List<ChatCompletionClient.Message> messages = new ArrayList<>();
        messages.add(new ChatCompletionClient.Message("system", systemPrompt(catalog)));
        for (ConversationTurn turn : history) {
            if (turn.content() == null || turn.content().isBlank()) {
                continue;
            }
            String role = turn.role() == TurnRole.ASSISTANT ? "assistant" : "user";
            messages.add(new ChatCompletionClient.Message(role, turn.content().trim()));
        }
        messages.add(new ChatCompletionClient.Message("user", query));
        return List.copyOf(messages);
    }

    String systemPrompt(ToolCatalog catalog) {
        return """
                You are a tool selection agent for a health insurance member assistant.

                Available tools and their capabilities:
                %s

                Classify the latest user message:
                - TOOL REQUIRED: choose one or more catalog tools. List them in the order they must run.
                  When a tool needs data produced by an earlier tool, set depends_on to that tool and list the
                  fields the earlier tool passes on in its context_needed.
                - CONVERSATIONAL: greetings, thanks, goodbyes and small talk. Use tool_name "CONVERSATIONAL",
                  confidence 10.0 and put a short friendly reply in direct_response.
                - OUT OF SCOPE: anything unrelated to insurance or healthcare. Use tool_name "NO_TOOL".

                Score confidence from 0 to 10. Use a score between 5 and 7 when the request could reasonably
                mean more than one tool, and list the plausible tools as candidates.

                Reply with a single JSON object:
                {"candidates":[{"tool_name":"...","confidence":0.0,"reasoning":"...","parameters":{},"depends_on":null,"context_needed":[]}],
                 "confidence":0.0,
                 "direct_response":null}
                """.formatted(toolsContext(catalog));
    }

    private String toolsContext(ToolCatalog catalog) {
        if (catalog.size() == 0) {
            return "No tools available";
        }
        StringBuilder builder = new StringBuilder();
        for (ToolDefinition tool : catalog.all()) {
            builder.append("Tool: ").append(tool.name()).append('\n')
                    .append("Description: ").append(tool.description()).append('\n')
                    .append("Capabilities: ").append(String.join(", ", tool.capabilities())).append('\n')
                    .append("Parameters (Required): ").append(listOrNone(tool.parameters().required())).append('\n')
                    .append("Parameters (Optional): ").append(listOrNone(tool.parameters().optional())).append('\n');
            for (ToolExample example : tool.examples()) {
                builder.append("Example: \"").append(example.prompt()).append("\" -> ").append(tool.name());
                if (example.reasoning() != null && !example.reasoning().isBlank()) {
                    builder.append(" (").append(example.reasoning()).append(')');
                }
                builder.append('\n');
            }
            builder.append('\n');
        }
        return builder.toString().trim();
    }

    private String listOrNone(List<String> values) {
        return values.isEmpty() ? "None" : String.join(", ", values);
    }

    private String sanitize(String raw) {
        String trimmed = raw.trim();
        if (trimmed.startsWith("```") && trimmed.endsWith("```") && trimmed.length() >= 6) {
            trimmed = trimmed.substring(3, trimmed.length() - 3).trim();
            if (trimmed.startsWith("json")) {
                trimmed = trimmed.substring(4).trim();
            }
        }
        return trimmed;
    }
}
