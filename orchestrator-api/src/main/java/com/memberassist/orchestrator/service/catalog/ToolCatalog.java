package com.memberassist.orchestrator.service.catalog;

import com.memberassist.orchestrator.model.CandidateKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only registry of tool definitions. There is no mutation API: a reload builds a new catalog
 * and swaps the reference, so a classification call never sees a half-updated set.
 */
public final class ToolCatalog {

    private final List<ToolDefinition> tools;
    private final Map<String, ToolDefinition> byName;

    public ToolCatalog(List<ToolDefinition> tools) {
        if (tools == null) {
            throw new CatalogConfigurationException("Tool catalog requires a list of tools");
        }
        Map<String, ToolDefinition> indexed = new LinkedHashMap<>();
        for (int i = 0; i < tools.size(); i++) {
            ToolDefinition tool = tools.get(i);
            validate(tool, i);
            if (indexed.putIfAbsent(tool.name(), tool) != null) {
                throw new CatalogConfigurationException("Duplicate tool name '%s' at index %d".formatted(tool.name(), i));
            }
        }
        this.tools = List.copyOf(indexed.values());
        this.byName = Collections.unmodifiableMap(indexed);
    }

    public Optional<ToolDefinition> lookup(String name) {
        return Optional.ofNullable(name).map(byName::get);
    }

    public List<ToolDefinition> all() {
        return tools;
    }

    public boolean contains(String name) {
        return name != null && byName.containsKey(name);
    }

    public List<String> names() {
        return List.copyOf(byName.keySet());
    }

    public Map<String, List<String>> capabilities() {
        Map<String, List<String>> capabilities = new LinkedHashMap<>();
        tools.forEach(tool -> capabilities.put(tool.name(), tool.capabilities()));
        return Collections.unmodifiableMap(capabilities);
    }

    public int size() {
        return tools.size();
    }

    private static void validate(ToolDefinition tool, int index) {
        if (tool == null) {
            throw invalid(index, "entry is empty");
        }
        if (isBlank(tool.name())) {
            throw invalid(index, "name is required");
        }
        if (CandidateKind.of(tool.name()).isSentinel()) {
            throw invalid(index, "name '%s' is reserved".formatted(tool.name()));
        }
        if (isBlank(tool.description())) {
            throw invalid(index, "description is required for tool " + tool.name());
        }
        if (tool.endpoint() == null || !tool.endpoint().isAbsolute()) {
            throw invalid(index, "an absolute endpoint is required for tool " + tool.name());
        }
        String scheme = tool.endpoint().getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw invalid(index, "endpoint of tool %s must be http or https".formatted(tool.name()));
        }
        if (tool.capabilities().isEmpty() || tool.capabilities().stream().anyMatch(ToolCatalog::isBlank)) {
            throw invalid(index, "capabilities must be a non-empty list for tool " + tool.name());
        }
        if (tool.parameters() == null) {
            throw invalid(index, "parameters are required for tool " + tool.name());
        }
        validateParameters(tool, index);
    }

    private static void validateParameters(ToolDefinition tool, int index) {
        List<String> all = new ArrayList<>(tool.parameters().required());
        all.addAll(tool.parameters().optional());
        Set<String> seen = new HashSet<>();
        for (String parameter : all) {
            if (isBlank(parameter)) {
                throw invalid(index, "blank parameter name in tool " + tool.name());
            }
            if (!seen.add(parameter)) {
                throw invalid(index, "parameter '%s' declared more than once in tool %s".formatted(parameter, tool.name()));
            }
        }
    }

    private static CatalogConfigurationException invalid(int index, String detail) {
        return new CatalogConfigurationException("Invalid tool at index %d: %s".formatted(index, detail));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public String toString() {
        return "ToolCatalog" + names();
    }
}
