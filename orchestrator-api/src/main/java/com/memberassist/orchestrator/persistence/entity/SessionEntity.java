package com.memberassist.orchestrator.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

import java.time.Instant;

@Entity
@Table(name = "sessions")
public class SessionEntity {

    @Id
    @Column(name = "session_id", nullable = false, updatable = false, length = 128)
    private String sessionId;

    @Column(name = "history_json", columnDefinition = "text")
    private String historyJson;

    @Column(name = "awaiting_clarification", nullable = false)
    private boolean awaitingClarification;

    @Column(name = "clarification_rounds", nullable = false)
    private int clarificationRounds;

    @Column(name = "pending_query", columnDefinition = "text")
    private String pendingQuery;

    @Column(name = "pending_question", columnDefinition = "text")
    private String pendingQuestion;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "last_accessed_at", nullable = false)
    private Instant lastAccessedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected SessionEntity() {
    }

    public SessionEntity(String sessionId, Instant createdAt) {
        this.sessionId = sessionId;
        this.createdAt = createdAt;
        this.lastAccessedAt = createdAt;
        this.historyJson = "[]";
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getHistoryJson() {
        return historyJson;
    }

    public void setHistoryJson(String historyJson) {
        this.historyJson = historyJson;
    }

    public boolean isAwaitingClarification() {
        return awaitingClarification;
    }

    public void setAwaitingClarification(boolean awaitingClarification) {
        this.awaitingClarification = awaitingClarification;
    }

    public int getClarificationRounds() {
        return clarificationRounds;
    }

    public void setClarificationRounds(int clarificationRounds) {
        this.clarificationRounds = clarificationRounds;
    }

    public String getPendingQuery() {
        return pendingQuery;
    }

    public void setPendingQuery(String pendingQuery) {
        this.pendingQuery = pendingQuery;
    }

    public String getPendingQuestion() {
        return pendingQuestion;
    }

    public void setPendingQuestion(String pendingQuestion) {
        this.pendingQuestion = pendingQuestion;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastAccessedAt() {
        return lastAccessedAt;
    }

    public void setLastAccessedAt(Instant lastAccessedAt) {
        this.lastAccessedAt = lastAccessedAt;
    }

    public long getVersion() {
        return version;
    }
}
