package com.memberassist.orchestrator.service.workflow;

import com.memberassist.orchestrator.model.InvocationRequest;
import com.memberassist.orchestrator.model.InvocationResponse;

public interface WorkflowEngine {

    /**
     * Runs one conversational turn. Always returns a well-formed response.
     *
     * @throws InvalidInvocationException when the request fails validation
     */
    InvocationResponse handle(InvocationRequest request);
}
