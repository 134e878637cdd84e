package com.memberassist.orchestrator.service.classifier;

import com.memberassist.orchestrator.model.ConversationTurn;
import com.memberassist.orchestrator.service.catalog.ToolCatalog;

import java.time.Duration;
import java.util.List;

public interface ClassifierGateway {

    /**
     * @param timeout time left in the current turn; the call must give up once it elapses
     * @throws ClassifierUnavailableException when the oracle cannot be reached in time
     * @throws MalformedClassificationException when the oracle answer fails validation
     */
    ClassificationResult classify(String query, List<ConversationTurn> history, ToolCatalog catalog, Duration timeout);
}
