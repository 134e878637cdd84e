package com.memberassist.orchestrator.service.tools;

import com.memberassist.orchestrator.config.WorkflowSettings;
import com.memberassist.orchestrator.model.SelectedTool;
import com.memberassist.orchestrator.model.ToolResult;
import com.memberassist.orchestrator.service.TurnBudget;
import com.memberassist.orchestrator.service.catalog.ToolCatalog;
import com.memberassist.orchestrator.service.catalog.ToolDefinition;
import com.memberassist.orchestrator.service.fallback.FallbackReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs an execution plan tool by tool. Each tool gets up to {@code maxRetries} attempts with exponential
 * backoff between them; the fields a tool lists in {@code context_needed} are copied from its own payload into
 * the execution context seen by every later tool.
 */
@Component
public class ToolInvocationEngine {

    private static final Logger log = LoggerFactory.getLogger(ToolInvocationEngine.class);

    private final ToolEndpointClient endpointClient;
    private final ToolAuditLogger auditLogger;
    private final WorkflowSettings settings;
    private final BackoffSleeper sleeper;

    @Autowired
    public ToolInvocationEngine(ToolEndpointClient endpointClient,
                                ToolAuditLogger auditLogger,
                                WorkflowSettings settings) {
        this(endpointClient, auditLogger, settings, BackoffSleeper.THREAD);
    }

    public ToolInvocationEngine(ToolEndpointClient endpointClient,
                                ToolAuditLogger auditLogger,
                                WorkflowSettings settings,
                                BackoffSleeper sleeper) {
        this.endpointClient = endpointClient;
        this.auditLogger = auditLogger;
        this.settings = settings;
        this.sleeper = sleeper;
    }

    public InvocationOutcome execute(ExecutionPlan plan,
                                     ToolCatalog catalog,
                                     String sessionId,
                                     String query,
                                     Map<String, String> callerContext,
                                     TurnBudget budget) {
        InvocationTransitions transitions = new InvocationTransitions(plan.size(), settings.maxRetries());
        Map<String, Object> executionContext = new LinkedHashMap<>();
        List<ToolResult> results = new ArrayList<>();
        String lastError = null;

        InvocationStep step = transitions.start();
        while (!step.phase().isTerminal()) {
            SelectedTool selected = plan.get(step.toolIndex());
            switch (step.phase()) {
                case PENDING -> {
                    if (budget.exhausted()) {
                        return timedOut(selected, step, results, executionContext, lastError);
                    }
                    try {
                        Map<String, Object> payload = attempt(catalog, selected, sessionId, query, callerContext,
                                executionContext, budget);
                        auditLogger.attempt(selected.toolName(), sessionId, step.attempt(), true, null);
                        results.add(ToolResult.success(selected.toolName(), payload, step.attempt()));
                        propagate(selected, payload, executionContext);
                        lastError = null;
                        step = transitions.onSuccess(step);
                    } catch (ToolInvocationException ex) {
                        lastError = ex.getMessage();
                        auditLogger.attempt(selected.toolName(), sessionId, step.attempt(), false, lastError);
                        step = transitions.onFailure(step);
                    }
                }
                case RETRYING -> {
                    Duration delay = settings.backoffFor(step.retries());
                    if (budget.remaining().compareTo(delay) <= 0) {
                        return timedOut(selected, step, results, executionContext, lastError);
                    }
                    try {
                        sleeper.sleep(delay);
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                        log.warn("Backoff for tool {} interrupted", selected.toolName());
                        return timedOut(selected, step, results, executionContext, lastError);
                    }
                    step = transitions.resume(step);
                }
                case ADVANCING -> step = transitions.resume(step);
                default -> throw new IllegalStateException("Unexpected phase " + step.phase());
            }
        }

        if (step.phase() == InvocationPhase.EXHAUSTED) {
            SelectedTool failed = plan.get(step.toolIndex());
            auditLogger.exhausted(failed.toolName(), sessionId, step.attempt());
            results.add(ToolResult.failure(failed.toolName(), lastError, step.attempt()));
            return new InvocationOutcome(results, executionContext, InvocationPhase.EXHAUSTED, FallbackReason.TOOL_FAILURE);
        }
        log.debug("Plan {} completed for session {}", plan.toolNames(), sessionId);
        return new InvocationOutcome(results, executionContext, InvocationPhase.SUCCEEDED, null);
    }

    private Map<String, Object> attempt(ToolCatalog catalog,
                                        SelectedTool selected,
                                        String sessionId,
                                        String query,
                                        Map<String, String> callerContext,
                                        Map<String, Object> executionContext,
                                        TurnBudget budget) {
        ToolDefinition definition = catalog.lookup(selected.toolName())
                .orElseThrow(() -> new ToolInvocationException(selected.toolName(),
                        "Tool %s is not in the catalog".formatted(selected.toolName())));
        ToolCall call = new ToolCall(query, callerContext, executionContext, selected.parameters());
        log.debug("Invoking {} for session {} with context keys {}", selected.toolName(), sessionId, executionContext.keySet());
        try {
            Map<String, Object> payload = endpointClient.invoke(definition, call, budget.cap(settings.toolTimeout()));
            return payload == null ? Map.of() : payload;
        } catch (ToolInvocationException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new ToolInvocationException(selected.toolName(), "Tool %s call failed: %s".formatted(selected.toolName(), ex.getMessage()), ex);
        }
    }

    /**
     * Absent fields are left out rather than mapped to {@code null}.
     */
    private void propagate(SelectedTool completed, Map<String, Object> payload, Map<String, Object> executionContext) {
        for (String field : completed.contextNeeded()) {
            Object value = payload.get(field);
            if (value != null) {
                executionContext.put(field, value);
            }
        }
    }

    private InvocationOutcome timedOut(SelectedTool selected,
                                       InvocationStep step,
                                       List<ToolResult> results,
                                       Map<String, Object> executionContext,
                                       String lastError) {
        log.warn("Turn deadline reached while running tool {}", selected.toolName());
        List<ToolResult> finished = new ArrayList<>(results);
        finished.add(ToolResult.failure(selected.toolName(),
                lastError == null ? "Request deadline exceeded" : lastError, step.retries()));
        return new InvocationOutcome(finished, executionContext, InvocationPhase.EXHAUSTED, FallbackReason.SERVICE_UNAVAILABLE);
    }
}
