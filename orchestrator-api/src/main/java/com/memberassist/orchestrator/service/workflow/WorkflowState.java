package com.memberassist.orchestrator.service.workflow;

import com.memberassist.orchestrator.model.SelectedTool;
import com.memberassist.orchestrator.model.ToolResult;
import com.memberassist.orchestrator.service.fallback.FallbackReason;
import com.memberassist.orchestrator.service.routing.Route;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Working data of one turn. Created per request, owned by the engine thread running the turn and discarded
 * once the session has been written back.
 */
public class WorkflowState {

    private final String sessionId;
    private final String query;
    private final Map<String, String> callerContext;
    private final Instant startedAt;

    private String effectiveQuery;
    private final List<SelectedTool> selectedTools = new ArrayList<>();
    private final List<ToolResult> toolResults = new ArrayList<>();
    private final Map<String, Integer> retryCounts = new HashMap<>();
    private final Map<String, Object> executionContext = new LinkedHashMap<>();
    private double confidence;
    private boolean clarificationRequested;
    private String clarificationQuestion;
    private String responseText;
    private Route route;
    private FallbackReason fallbackReason;
    private boolean completed;
    private Instant completedAt;

    public WorkflowState(String sessionId, String query, Map<String, String> callerContext, Instant startedAt) {
        this.sessionId = sessionId;
        this.query = query;
        this.effectiveQuery = query;
        this.callerContext = callerContext == null ? Map.of() : Map.copyOf(callerContext);
        this.startedAt = startedAt;
    }

    public String sessionId() {
        return sessionId;
    }

    public String query() {
        return query;
    }

    /**
     * Query sent to the classifier; differs from {@link #query()} when this turn answers a clarification.
     */
    public String effectiveQuery() {
        return effectiveQuery;
    }

    public void effectiveQuery(String effectiveQuery) {
        this.effectiveQuery = effectiveQuery;
    }

    public Map<String, String> callerContext() {
        return callerContext;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public List<SelectedTool> selectedTools() {
        return List.copyOf(selectedTools);
    }

    public void selectedTools(List<SelectedTool> tools) {
        selectedTools.clear();
        selectedTools.addAll(tools);
    }

    public List<ToolResult> toolResults() {
        return List.copyOf(toolResults);
    }

    public void recordToolResults(List<ToolResult> results) {
        toolResults.addAll(results);
        for (ToolResult result : results) {
            retryCounts.merge(result.toolName(), Math.max(0, result.attempts() - 1), Integer::sum);
        }
    }

    public Map<String, Integer> retryCounts() {
        return Map.copyOf(retryCounts);
    }

    public Map<String, Object> executionContext() {
        return Map.copyOf(executionContext);
    }

    public void executionContext(Map<String, Object> context) {
        executionContext.clear();
        executionContext.putAll(context);
    }

    public double confidence() {
        return confidence;
    }

    public void confidence(double confidence) {
        this.confidence = confidence;
    }

    public boolean clarificationRequested() {
        return clarificationRequested;
    }

    public String clarificationQuestion() {
        return clarificationQuestion;
    }

    public void requestClarification(String question) {
        this.clarificationRequested = true;
        this.clarificationQuestion = question;
        this.responseText = question;
    }

    public String responseText() {
        return responseText;
    }

    public void responseText(String responseText) {
        this.responseText = responseText;
    }

    public Route route() {
        return route;
    }

    public void route(Route route) {
        this.route = route;
    }

    public FallbackReason fallbackReason() {
        return fallbackReason;
    }

    public void fallbackReason(FallbackReason reason) {
        this.fallbackReason = reason;
    }

    public boolean completed() {
        return completed;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public void complete(Instant at) {
        if (!completed) {
            this.completed = true;
            this.completedAt = at;
        }
    }

    /**
     * Route reported to the caller and used as metric tag.
     */
    public String outcomeTag() {
        return route == null ? "none" : route.name().toLowerCase(Locale.ROOT);
    }
}
