package com.memberassist.orchestrator.service.catalog;

public record ToolExample(String prompt, String reasoning) {
}
