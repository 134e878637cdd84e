package com.memberassist.orchestrator.service.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.memberassist.orchestrator.MutableClock;
import com.memberassist.orchestrator.config.WorkflowSettings;
import com.memberassist.orchestrator.model.ConversationTurn;
import com.memberassist.orchestrator.model.InvocationRequest;
import com.memberassist.orchestrator.model.InvocationResponse;
import com.memberassist.orchestrator.model.SelectedTool;
import com.memberassist.orchestrator.model.TurnRole;
import com.memberassist.orchestrator.service.catalog.ToolCatalog;
import com.memberassist.orchestrator.service.catalog.ToolDefinition;
import com.memberassist.orchestrator.service.catalog.ToolParameters;
import com.memberassist.orchestrator.service.clarification.ClarificationHandler;
import com.memberassist.orchestrator.service.classifier.ClassificationResult;
import com.memberassist.orchestrator.service.classifier.ClassifierGateway;
import com.memberassist.orchestrator.service.classifier.ClassifierUnavailableException;
import com.memberassist.orchestrator.service.fallback.FallbackHandler;
import com.memberassist.orchestrator.service.fallback.FallbackReason;
import com.memberassist.orchestrator.service.response.ResponseComposer;
import com.memberassist.orchestrator.service.routing.ConfidenceRouter;
import com.memberassist.orchestrator.service.session.ConcurrentSessionModificationException;
import com.memberassist.orchestrator.service.session.InMemorySessionStore;
import com.memberassist.orchestrator.service.session.Session;
import com.memberassist.orchestrator.service.session.SessionLocks;
import com.memberassist.orchestrator.service.tools.ToolAuditLogger;
import com.memberassist.orchestrator.service.tools.ToolEndpointClient;
import com.memberassist.orchestrator.service.tools.ToolInvocationEngine;
import com.memberassist.orchestrator.service.tools.ToolInvocationException;
import com.memberassist.orchestrator.service.workflow.statemachine.TurnStateMachineFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class GraphWorkflowEngineTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final WorkflowSettings settings = WorkflowSettings.defaults();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final ClassifierGateway classifier = mock(ClassifierGateway.class);
    private final ToolEndpointClient toolClient = mock(ToolEndpointClient.class);
    private final InMemorySessionStore sessionStore = spy(new InMemorySessionStore(settings, clock));
    private final ToolCatalog catalog = new ToolCatalog(List.of(
            tool("IBTAgent", "Insurance benefits and coverage questions."),
            tool("ClaimsAgent", "Claim status and history.")));

    private final GraphWorkflowEngine engine = engine(new SessionLocks());

    @Test
    void confidentDentalQueryRunsBenefitsTool() {
        classifyAs(9.0, SelectedTool.of("IBTAgent", 9.0, "dental benefits"));
        when(toolClient.invoke(any(), any(), any())).thenReturn(Map.of("response", "Preventive dental care is covered at 100%."));

        InvocationResponse response = engine.handle(request("s-1", "Does my plan cover dental cleanings?"));

        assertThat(response.success()).isTrue();
        assertThat(response.route()).isEqualTo("EXECUTE");
        assertThat(response.selectedTool()).extracting(SelectedTool::toolName).containsExactly("IBTAgent");
        assertThat(response.responseText()).isEqualTo("Preventive dental care is covered at 100%.");
        assertThat(response.confidence()).isEqualTo(9.0);
        Session session = sessionStore.find("s-1").orElseThrow();
        assertThat(session.history()).extracting(ConversationTurn::role).containsExactly(TurnRole.USER, TurnRole.ASSISTANT);
        assertThat(session.awaitingClarification()).isFalse();
        assertThat(meterRegistry.timer("orchestrator.turn", "route", "execute").count()).isEqualTo(1L);
    }

    @Test
    void toolWithEmptyPayloadStillAnswers() {
        classifyAs(9.0, SelectedTool.of("IBTAgent", 9.0, "dental benefits"));
        when(toolClient.invoke(any(), any(), any())).thenReturn(Map.of());

        InvocationResponse response = engine.handle(request("s-1b", "What are my dental benefits?"));

        assertThat(response.success()).isTrue();
        assertThat(response.responseText())
                .isEqualTo("Tool 'IBTAgent' executed successfully for: What are my dental benefits?");
    }

    @Test
    void midConfidenceAsksForClarificationAndMergesTheAnswer() {
        classifyAs(6.0, SelectedTool.of("IBTAgent", 6.0, "maybe benefits"));

        InvocationResponse first = engine.handle(request("s-2", "Is this covered?"));

        assertThat(first.route()).isEqualTo("CLARIFY");
        assertThat(first.success()).isTrue();
        assertThat(first.responseText()).contains("insurance benefits and coverage questions");
        Session waiting = sessionStore.find("s-2").orElseThrow();
        assertThat(waiting.awaitingClarification()).isTrue();
        assertThat(waiting.clarificationRounds()).isEqualTo(1);
        assertThat(waiting.pendingQuery()).isEqualTo("Is this covered?");
        verifyNoInteractions(toolClient);

        classifyAs(9.0, SelectedTool.of("IBTAgent", 9.0, "dental benefits"));
        when(toolClient.invoke(any(), any(), any())).thenReturn(Map.of("response", "Yes."));

        InvocationResponse second = engine.handle(request("s-2", "dental cleanings"));

        verify(classifier).classify(eq("Is this covered?\nClarification: dental cleanings"), anyList(), any(), any());
        assertThat(second.route()).isEqualTo("EXECUTE");
        Session answered = sessionStore.find("s-2").orElseThrow();
        assertThat(answered.awaitingClarification()).isFalse();
        assertThat(answered.clarificationRounds()).isZero();
        assertThat(answered.history()).hasSize(4);
    }

    @Test
    void lowConfidenceReturnsFixedMessage() {
        classifyAs(3.0, SelectedTool.of("IBTAgent", 3.0, "unclear"));

        InvocationResponse response = engine.handle(request("s-3", "hmm"));

        assertThat(response.route()).isEqualTo("FALLBACK");
        assertThat(response.reasonCode()).isEqualTo("low_confidence");
        assertThat(response.success()).isFalse();
        assertThat(response.responseText()).isEqualTo(
                "I'm not entirely sure I understand your question. Could you please provide more details or rephrase your request?");
        verifyNoInteractions(toolClient);
    }

    @Test
    void noToolSentinelFallsBack() {
        classifyAs(9.5, SelectedTool.of("NO_TOOL", 9.5, "weather question"));

        InvocationResponse response = engine.handle(request("s-4", "What's the weather?"));

        assertThat(response.reasonCode()).isEqualTo(FallbackReason.NO_TOOL_FOUND.code());
        assertThat(response.responseText()).isEqualTo(FallbackReason.NO_TOOL_FOUND.message());
    }

    @Test
    void greetingUsesDirectResponse() {
        when(classifier.classify(anyString(), anyList(), any(), any())).thenReturn(new ClassificationResult(
                List.of(SelectedTool.of("CONVERSATIONAL", 10.0, "greeting")), 10.0, "Hi! How can I help today?"));

        InvocationResponse response = engine.handle(request("s-5", "hello"));

        assertThat(response.success()).isTrue();
        assertThat(response.reasonCode()).isEqualTo("conversational");
        assertThat(response.responseText()).isEqualTo("Hi! How can I help today?");
    }

    @Test
    void exhaustedToolFallsBackAndNextTurnStartsClean() {
        classifyAs(9.0, SelectedTool.of("IBTAgent", 9.0, "benefits"));
        when(toolClient.invoke(any(), any(), any()))
                .thenThrow(new ToolInvocationException("IBTAgent", "HTTP 503"))
                .thenThrow(new ToolInvocationException("IBTAgent", "HTTP 503"))
                .thenThrow(new ToolInvocationException("IBTAgent", "HTTP 503"))
                .thenReturn(Map.of("response", "Covered."));

        InvocationResponse failed = engine.handle(request("s-6", "Is dental covered?"));

        verify(toolClient, times(3)).invoke(any(), any(), any());
        assertThat(failed.reasonCode()).isEqualTo("tool_failure");
        assertThat(failed.responseText()).isEqualTo(FallbackReason.TOOL_FAILURE.message());

        InvocationResponse next = engine.handle(request("s-6", "Is dental covered?"));

        verify(toolClient, times(4)).invoke(any(), any(), any());
        assertThat(next.success()).isTrue();
        assertThat(next.responseText()).isEqualTo("Covered.");
    }

    @Test
    void clarificationRoundsAreCapped() {
        classifyAs(6.0, SelectedTool.of("IBTAgent", 6.0, "maybe"));

        assertThat(engine.handle(request("s-7", "coverage?")).route()).isEqualTo("CLARIFY");
        assertThat(engine.handle(request("s-7", "the thing")).route()).isEqualTo("CLARIFY");
        InvocationResponse third = engine.handle(request("s-7", "you know"));

        assertThat(third.route()).isEqualTo("FALLBACK");
        assertThat(third.reasonCode()).isEqualTo("clarification_exhausted");
        Session session = sessionStore.find("s-7").orElseThrow();
        assertThat(session.awaitingClarification()).isFalse();
        assertThat(session.clarificationRounds()).isZero();
    }

    @Test
    void expiredSessionStartsOver() {
        classifyAs(6.0, SelectedTool.of("IBTAgent", 6.0, "maybe"));
        engine.handle(request("s-8", "coverage?"));

        clock.advance(settings.sessionTtl().plusMinutes(1));
        engine.handle(request("s-8", "dental"));

        verify(classifier).classify(eq("dental"), eq(List.of()), any(), any());
        assertThat(sessionStore.find("s-8").orElseThrow().history()).hasSize(2);
    }

    @Test
    void classifierOutageIsServiceUnavailable() {
        when(classifier.classify(anyString(), anyList(), any(), any()))
                .thenThrow(new ClassifierUnavailableException("connection refused"));

        InvocationResponse response = engine.handle(request("s-9", "Is dental covered?"));

        assertThat(response.reasonCode()).isEqualTo("service_unavailable");
        assertThat(response.responseText()).isEqualTo(FallbackReason.SERVICE_UNAVAILABLE.message());
        assertThat(response.route()).isEqualTo("FALLBACK");
        assertThat(sessionStore.find("s-9")).isPresent();
    }

    @Test
    void lostSaveRaceIsReappliedOnceWithoutCallingToolsAgain() {
        classifyAs(9.0, SelectedTool.of("IBTAgent", 9.0, "benefits"));
        when(toolClient.invoke(any(), any(), any())).thenReturn(Map.of("response", "Covered."));
        doThrow(new ConcurrentSessionModificationException("s-10", "modified"))
                .doCallRealMethod()
                .when(sessionStore).save(eq("s-10"), any());

        InvocationResponse response = engine.handle(request("s-10", "Is dental covered?"));

        assertThat(response.success()).isTrue();
        verify(toolClient, times(1)).invoke(any(), any(), any());
        verify(sessionStore, times(2)).getOrCreate("s-10");
        assertThat(sessionStore.find("s-10").orElseThrow().history()).hasSize(2);
    }

    @Test
    void secondLostRaceReportsSessionConflict() {
        classifyAs(9.0, SelectedTool.of("IBTAgent", 9.0, "benefits"));
        when(toolClient.invoke(any(), any(), any())).thenReturn(Map.of("response", "Covered."));
        doThrow(new ConcurrentSessionModificationException("s-11", "modified"))
                .when(sessionStore).save(eq("s-11"), any());

        InvocationResponse response = engine.handle(request("s-11", "Is dental covered?"));

        assertThat(response.success()).isFalse();
        assertThat(response.reasonCode()).isEqualTo("session_conflict");
        assertThat(response.responseText()).isEqualTo(FallbackReason.SESSION_CONFLICT.message());
        verify(toolClient, times(1)).invoke(any(), any(), any());
    }

    @Test
    void concurrentTurnsOnOneSessionRunOneAtATime() throws Exception {
        int turns = 8;
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        when(classifier.classify(anyString(), anyList(), any(), any())).thenAnswer(invocation -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                Thread.sleep(20);
                return ClassificationResult.of(9.0, SelectedTool.of("IBTAgent", 9.0, "benefits"));
            } finally {
                inFlight.decrementAndGet();
            }
        });
        when(toolClient.invoke(any(), any(), any())).thenReturn(Map.of("response", "Covered."));

        ExecutorService executor = Executors.newFixedThreadPool(turns);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<InvocationResponse>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < turns; i++) {
                String query = "question " + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    return engine.handle(request("shared", query));
                }));
            }
            start.countDown();
            for (Future<InvocationResponse> future : futures) {
                InvocationResponse response = future.get(10, TimeUnit.SECONDS);
                assertThat(response.success()).isTrue();
                assertThat(response.reasonCode()).isNull();
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(maxInFlight.get()).isEqualTo(1);
        verify(classifier, times(turns)).classify(anyString(), anyList(), any(), any());
        assertThat(sessionStore.find("shared").orElseThrow().history())
                .hasSize(Math.min(2 * turns, settings.maxHistory()));
    }

    @Test
    void busySessionIsServiceUnavailable() throws Exception {
        SessionLocks locks = mock(SessionLocks.class);
        when(locks.tryAcquire(eq("s-12"), any())).thenReturn(Optional.empty());

        InvocationResponse response = engine(locks).handle(request("s-12", "Is dental covered?"));

        assertThat(response.reasonCode()).isEqualTo("service_unavailable");
        verifyNoInteractions(classifier);
        verify(sessionStore, never()).getOrCreate(any());
    }

    @Test
    void invalidRequestIsRejectedBeforeAnyWork() {
        InvalidInvocationException rejected = catchThrowableOfType(
                () -> engine.handle(new InvocationRequest(" ", "", Map.of())), InvalidInvocationException.class);

        assertThat(rejected.errors()).containsExactly("sessionId must not be blank", "query must not be blank");
        assertThatThrownBy(() -> engine.handle(request("s-13", "x".repeat(InvocationRequest.MAX_QUERY_LENGTH + 1))))
                .isInstanceOf(InvalidInvocationException.class);
        verifyNoInteractions(classifier);
    }

    private void classifyAs(double confidence, SelectedTool... candidates) {
        when(classifier.classify(anyString(), anyList(), any(), any()))
                .thenReturn(ClassificationResult.of(confidence, candidates));
    }

    private GraphWorkflowEngine engine(SessionLocks locks) {
        ToolInvocationEngine toolEngine = new ToolInvocationEngine(toolClient, new ToolAuditLogger(meterRegistry),
                settings, delay -> { });
        return new GraphWorkflowEngine(sessionStore, locks, classifier, catalog, new ConfidenceRouter(settings),
                toolEngine, new ClarificationHandler(), new FallbackHandler(meterRegistry),
                new ResponseComposer(new ObjectMapper()), new TurnStateMachineFactory(), settings, clock, meterRegistry);
    }

    private static InvocationRequest request(String sessionId, String query) {
        return new InvocationRequest(sessionId, query, Map.of());
    }

    private static ToolDefinition tool(String name, String description) {
        return new ToolDefinition(name, description, URI.create("http://tools.local/" + name), List.of("general"),
                new ToolParameters(List.of(), List.of()), List.of());
    }
}
