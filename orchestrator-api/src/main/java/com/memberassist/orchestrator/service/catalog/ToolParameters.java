package com.memberassist.orchestrator.service.catalog;

import java.util.List;

public record ToolParameters(List<String> required, List<String> optional) {

    public ToolParameters {
        required = required == null ? List.of() : List.copyOf(required);
        optional = optional == null ? List.of() : List.copyOf(optional);
    }
}
