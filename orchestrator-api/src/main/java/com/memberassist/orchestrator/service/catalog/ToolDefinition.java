package com.memberassist.orchestrator.service.catalog;

import java.net.URI;
import java.util.List;

/**
 * One capability handler the classifier may select. Instances are immutable once the catalog is built.
 */
public record ToolDefinition(String name,
                             String description,
                             URI endpoint,
                             List<String> capabilities,
                             ToolParameters parameters,
                             List<ToolExample> examples) {

    public ToolDefinition {
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        examples = examples == null ? List.of() : List.copyOf(examples);
    }
}
