package com.memberassist.orchestrator.model;

import java.time.Instant;

public record ConversationTurn(
        TurnRole role,
        String content,
        Instant timestamp
) {
}
