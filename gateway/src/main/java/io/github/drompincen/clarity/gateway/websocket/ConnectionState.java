package io.github.drompincen.clarity.gateway.websocket;

import io.github.drompincen.clarity.persistence.document.RecallSetDocument;
import io.github.drompincen.clarity.persistence.document.SessionDocument;
import io.github.drompincen.clarity.runtime.session.SessionOrchestrator;

import java.time.Instant;

/**
 * Per-connection bookkeeping. Owned by exactly one connection; callers synchronize on the instance.
 */
public class ConnectionState {

    private final String connectionId;
    private final String sessionId;
    private ConnectionPhase phase = ConnectionPhase.CONNECTING;
    private SessionDocument session;
    private RecallSetDocument recallSet;
    private SessionOrchestrator orchestrator;
    private boolean initialized;
    private Instant lastMessageTime;
    private int consecutiveErrors;
    private boolean overlayShown;

    public ConnectionState(String connectionId, String sessionId, Instant openedAt) {
        this.connectionId = connectionId;
        this.sessionId = sessionId;
        this.lastMessageTime = openedAt;
    }

    public void moveTo(ConnectionPhase next) {
        if (!phase.canMoveTo(next)) {
            throw new IllegalStateException("Connection " + connectionId + " cannot move from " + phase + " to " + next);
        }
        phase = next;
    }

    public void attach(SessionDocument session, RecallSetDocument recallSet, SessionOrchestrator orchestrator) {
        this.session = session;
        this.recallSet = recallSet;
        this.orchestrator = orchestrator;
    }

    public void markInitialized() {
        initialized = true;
    }

    public int recordError() {
        return ++consecutiveErrors;
    }

    public void resetErrors() {
        consecutiveErrors = 0;
    }

    public void touch(Instant now) {
        lastMessageTime = now;
    }

    public boolean isIdleSince(Instant cutoff) {
        return lastMessageTime.isBefore(cutoff);
    }

    public boolean isClosingOrClosed() {
        return phase == ConnectionPhase.CLOSING || phase == ConnectionPhase.CLOSED;
    }

    public String getConnectionId() { return connectionId; }
    public String getSessionId() { return sessionId; }
    public ConnectionPhase getPhase() { return phase; }
    public SessionDocument getSession() { return session; }
    public RecallSetDocument getRecallSet() { return recallSet; }
    public SessionOrchestrator getOrchestrator() { return orchestrator; }
    public boolean isInitialized() { return initialized; }
    public Instant getLastMessageTime() { return lastMessageTime; }
    public int getConsecutiveErrors() { return consecutiveErrors; }

    public boolean isOverlayShown() { return overlayShown; }
    public void setOverlayShown(boolean overlayShown) { this.overlayShown = overlayShown; }
}
