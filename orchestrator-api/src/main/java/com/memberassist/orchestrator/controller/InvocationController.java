package com.memberassist.orchestrator.controller;

import com.memberassist.orchestrator.model.InvocationRequest;
import com.memberassist.orchestrator.model.InvocationResponse;
import com.memberassist.orchestrator.service.workflow.WorkflowEngine;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.OffsetDateTime;
import java.util.Map;

@RestController
public class InvocationController {

    private final WorkflowEngine workflowEngine;

    public InvocationController(WorkflowEngine workflowEngine) {
        this.workflowEngine = workflowEngine;
    }

    @PostMapping(path = "/invocations", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<InvocationResponse> invoke(@Valid @RequestBody InvocationRequest request) {
        return Mono.fromCallable(() -> workflowEngine.handle(request))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping(path = "/ping", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> ping() {
        return Map.of("status", "ok", "timestamp", OffsetDateTime.now().toString());
    }

    @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> health() {
        return Map.of("status", "healthy", "service", "orchestrator-agent");
    }
}
