package com.memberassist.orchestrator.service.workflow;

import com.memberassist.orchestrator.config.WorkflowSettings;
import com.memberassist.orchestrator.model.ConversationTurn;
import com.memberassist.orchestrator.model.InvocationRequest;
import com.memberassist.orchestrator.model.InvocationResponse;
import com.memberassist.orchestrator.model.SelectedTool;
import com.memberassist.orchestrator.model.TurnRole;
import com.memberassist.orchestrator.service.TurnBudget;
import com.memberassist.orchestrator.service.catalog.ToolCatalog;
import com.memberassist.orchestrator.service.clarification.ClarificationHandler;
import com.memberassist.orchestrator.service.classifier.ClassificationResult;
import com.memberassist.orchestrator.service.classifier.ClassifierGateway;
import com.memberassist.orchestrator.service.fallback.FallbackHandler;
import com.memberassist.orchestrator.service.fallback.FallbackReason;
import com.memberassist.orchestrator.service.response.ResponseComposer;
import com.memberassist.orchestrator.service.routing.ConfidenceRouter;
import com.memberassist.orchestrator.service.routing.Route;
import com.memberassist.orchestrator.service.routing.RoutingDecision;
import com.memberassist.orchestrator.service.session.ConcurrentSessionModificationException;
import com.memberassist.orchestrator.service.session.Session;
import com.memberassist.orchestrator.service.session.SessionLocks;
import com.memberassist.orchestrator.service.session.SessionStore;
import com.memberassist.orchestrator.service.tools.ExecutionPlan;
import com.memberassist.orchestrator.service.tools.InvocationOutcome;
import com.memberassist.orchestrator.service.tools.ToolInvocationEngine;
import com.memberassist.orchestrator.service.workflow.statemachine.TurnEvents;
import com.memberassist.orchestrator.service.workflow.statemachine.TurnGraph;
import com.memberassist.orchestrator.service.workflow.statemachine.TurnStateMachineFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Drives one turn through classify, route, execute/clarify/fallback and compose, then writes the session back
 * once. Turns for the same session id are serialized through {@link SessionLocks}.
 */
@Service
public class GraphWorkflowEngine implements WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(GraphWorkflowEngine.class);
    static final String CLARIFICATION_SEPARATOR = "\nClarification: ";

    private final SessionStore sessionStore;
    private final SessionLocks sessionLocks;
    private final ClassifierGateway classifier;
    private final ToolCatalog catalog;
    private final ConfidenceRouter router;
    private final ToolInvocationEngine toolEngine;
    private final ClarificationHandler clarificationHandler;
    private final FallbackHandler fallbackHandler;
    private final ResponseComposer composer;
    private final TurnStateMachineFactory graphFactory;
    private final WorkflowSettings settings;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public GraphWorkflowEngine(SessionStore sessionStore,
                               SessionLocks sessionLocks,
                               ClassifierGateway classifier,
                               ToolCatalog catalog,
                               ConfidenceRouter router,
                               ToolInvocationEngine toolEngine,
                               ClarificationHandler clarificationHandler,
                               FallbackHandler fallbackHandler,
                               ResponseComposer composer,
                               TurnStateMachineFactory graphFactory,
                               WorkflowSettings settings,
                               Clock clock,
                               MeterRegistry meterRegistry) {
        this.sessionStore = sessionStore;
        this.sessionLocks = sessionLocks;
        this.classifier = classifier;
        this.catalog = catalog;
        this.router = router;
        this.toolEngine = toolEngine;
        this.clarificationHandler = clarificationHandler;
        this.fallbackHandler = fallbackHandler;
        this.composer = composer;
        this.graphFactory = graphFactory;
        this.settings = settings;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public InvocationResponse handle(InvocationRequest request) {
        List<String> errors = validate(request);
        if (!errors.isEmpty()) {
            throw new InvalidInvocationException(request == null ? null : request.sessionId(), errors);
        }
        Timer.Sample sample = Timer.start(meterRegistry);
        TurnBudget budget = TurnBudget.start(clock, settings.requestTimeout());
        WorkflowState state = new WorkflowState(request.sessionId(), request.query().trim(), request.context(), clock.instant());

        InvocationResponse response;
        Optional<SessionLocks.Lease> lease = acquire(request.sessionId(), budget);
        if (lease.isEmpty()) {
            log.warn("Session {} is busy; no lock within {}", request.sessionId(), settings.requestTimeout());
            response = abort(state, FallbackReason.SERVICE_UNAVAILABLE);
        } else {
            try (SessionLocks.Lease ignored = lease.get()) {
                response = runTurn(state, budget);
            } catch (RuntimeException ex) {
                log.error("Turn for session {} failed unexpectedly", request.sessionId(), ex);
                response = abort(state, FallbackReason.SERVICE_UNAVAILABLE);
            }
        }
        sample.stop(meterRegistry.timer("orchestrator.turn", "route", state.outcomeTag()));
        log.info("Session {} turn finished route={} reason={} tools={} retries={} in {} ms",
                state.sessionId(), response.route(), response.reasonCode(),
                state.selectedTools().stream().map(SelectedTool::toolName).toList(), state.retryCounts(),
                response.processingTimeMs());
        return response;
    }

    private InvocationResponse runTurn(WorkflowState state, TurnBudget budget) {
        Session session = sessionStore.getOrCreate(state.sessionId());
        if (session.awaitingClarification() && session.pendingQuery() != null) {
            state.effectiveQuery(session.pendingQuery() + CLARIFICATION_SEPARATOR + state.query());
            log.debug("Session {} answers clarification round {}", state.sessionId(), session.clarificationRounds());
        }

        TurnGraph graph = graphFactory.create(state.sessionId());
        try {
            graph.fire(TurnEvents.CLASSIFY);
            Optional<ClassificationResult> classification = classify(state, session, budget);
            if (classification.isEmpty()) {
                graph.fire(TurnEvents.CLASSIFICATION_FAILED);
                fallback(state, graph, FallbackReason.SERVICE_UNAVAILABLE, null);
            } else {
                graph.fire(TurnEvents.CLASSIFIED);
                route(state, session, classification.get(), graph, budget);
            }

            state.complete(clock.instant());
            InvocationResponse response = composer.compose(state);
            graph.fire(TurnEvents.COMPOSED);
            log.debug("Session {} visited {}", state.sessionId(), graph.path());

            return persist(state, session) ? response : conflict(state);
        } finally {
            graph.stop();
        }
    }

    private Optional<ClassificationResult> classify(WorkflowState state, Session session, TurnBudget budget) {
        if (budget.exhausted()) {
            log.warn("Request deadline reached before classification for session {}", state.sessionId());
            return Optional.empty();
        }
        try {
            return Optional.of(classifier.classify(state.effectiveQuery(), session.history(), catalog, budget.remaining()));
        } catch (RuntimeException ex) {
            log.warn("Classification failed for session {}: {}", state.sessionId(), ex.getMessage());
            return Optional.empty();
        }
    }

    private void route(WorkflowState state,
                       Session session,
                       ClassificationResult classification,
                       TurnGraph graph,
                       TurnBudget budget) {
        state.confidence(classification.confidence());
        state.selectedTools(classification.candidates());
        RoutingDecision decision = router.route(classification);
        meterRegistry.counter("orchestrator.routes", "route", decision.route().name().toLowerCase(Locale.ROOT)).increment();

        switch (decision.route()) {
            case EXECUTE -> {
                graph.fire(TurnEvents.ROUTE_EXECUTE);
                execute(state, classification, graph, budget);
            }
            case CLARIFY -> {
                if (session.clarificationRounds() >= settings.maxClarificationRounds()) {
                    graph.fire(TurnEvents.CLARIFICATION_EXHAUSTED);
                    fallback(state, graph, FallbackReason.CLARIFICATION_EXHAUSTED, null);
                } else {
                    graph.fire(TurnEvents.ROUTE_CLARIFY);
                    state.route(Route.CLARIFY);
                    state.requestClarification(clarificationHandler.question(classification.candidates(), catalog));
                    graph.fire(TurnEvents.CLARIFICATION_ISSUED);
                }
            }
            case FALLBACK -> {
                graph.fire(TurnEvents.ROUTE_FALLBACK);
                fallback(state, graph, decision.reason(), classification.directResponseText().orElse(null));
            }
        }
    }

    private void execute(WorkflowState state, ClassificationResult classification, TurnGraph graph, TurnBudget budget) {
        state.route(Route.EXECUTE);
        ExecutionPlan plan = ExecutionPlan.from(classification.candidates());
        state.selectedTools(plan.steps());
        InvocationOutcome outcome = toolEngine.execute(plan, catalog, state.sessionId(), state.effectiveQuery(),
                state.callerContext(), budget);
        state.recordToolResults(outcome.results());
        state.executionContext(outcome.executionContext());
        if (outcome.succeeded()) {
            graph.fire(TurnEvents.TOOLS_SUCCEEDED);
            return;
        }
        graph.fire(TurnEvents.TOOLS_EXHAUSTED);
        fallback(state, graph, outcome.failureReason(), null);
    }

    private void fallback(WorkflowState state, TurnGraph graph, FallbackReason reason, String directResponse) {
        state.route(Route.FALLBACK);
        state.fallbackReason(reason);
        state.responseText(fallbackHandler.messageFor(reason, directResponse));
        graph.fire(TurnEvents.FALLBACK_ISSUED);
    }

    /**
     * Writes the turn onto the session. A lost race is retried once against a freshly read session.
     *
     * @return {@code false} when the retry lost as well
     */
    private boolean persist(WorkflowState state, Session readAtStart) {
        try {
            sessionStore.save(state.sessionId(), applyTurn(readAtStart, state));
            return true;
        } catch (ConcurrentSessionModificationException first) {
            log.warn("Session {} changed during the turn, re-applying once: {}", state.sessionId(), first.getMessage());
        }
        try {
            Session fresh = sessionStore.getOrCreate(state.sessionId());
            sessionStore.save(state.sessionId(), applyTurn(fresh, state));
            return true;
        } catch (ConcurrentSessionModificationException second) {
            log.warn("Session {} still conflicting after retry", state.sessionId());
            return false;
        }
    }

    private Session applyTurn(Session base, WorkflowState state) {
        Session updated = base
                .append(new ConversationTurn(TurnRole.USER, state.query(), state.startedAt()), settings.maxHistory())
                .append(new ConversationTurn(TurnRole.ASSISTANT, responseOf(state), state.completedAt()), settings.maxHistory());
        if (state.clarificationRequested()) {
            return updated.awaitClarification(state.effectiveQuery(), state.clarificationQuestion());
        }
        return updated.resetClarification();
    }

    private String responseOf(WorkflowState state) {
        if (state.responseText() != null) {
            return state.responseText();
        }
        String composed = composer.compose(state).responseText();
        return composed == null ? "" : composed;
    }

    private InvocationResponse conflict(WorkflowState state) {
        state.route(Route.FALLBACK);
        state.fallbackReason(FallbackReason.SESSION_CONFLICT);
        state.responseText(fallbackHandler.messageFor(FallbackReason.SESSION_CONFLICT));
        return composer.compose(state);
    }

    private InvocationResponse abort(WorkflowState state, FallbackReason reason) {
        state.route(Route.FALLBACK);
        state.fallbackReason(reason);
        state.responseText(fallbackHandler.messageFor(reason));
        state.complete(clock.instant());
        return composer.compose(state);
    }

    private Optional<SessionLocks.Lease> acquire(String sessionId, TurnBudget budget) {
        try {
            return sessionLocks.tryAcquire(sessionId, budget.remaining());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    static List<String> validate(InvocationRequest request) {
        List<String> errors = new ArrayList<>();
        if (request == null) {
            errors.add("request body is required");
            return errors;
        }
        if (request.sessionId() == null || request.sessionId().isBlank()) {
            errors.add("sessionId must not be blank");
        } else if (request.sessionId().length() > InvocationRequest.MAX_SESSION_ID_LENGTH) {
            errors.add("sessionId must be at most %d characters".formatted(InvocationRequest.MAX_SESSION_ID_LENGTH));
        }
        if (request.query() == null || request.query().isBlank()) {
            errors.add("query must not be blank");
        } else if (request.query().length() > InvocationRequest.MAX_QUERY_LENGTH) {
            errors.add("query must be at most %d characters".formatted(InvocationRequest.MAX_QUERY_LENGTH));
        }
        for (Map.Entry<String, String> entry : request.context().entrySet()) {
            if (entry.getKey().isBlank()) {
                errors.add("context keys must not be blank");
                break;
            }
        }
        return errors;
    }
}
