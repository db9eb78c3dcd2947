package io.github.drompincen.clarity.gateway.websocket;

import io.github.drompincen.clarity.persistence.document.RecallSetDocument;
import io.github.drompincen.clarity.persistence.document.SessionDocument;
import io.github.drompincen.clarity.persistence.repository.RecallSetRepository;
import io.github.drompincen.clarity.persistence.repository.SessionRepository;
import io.github.drompincen.clarity.protocol.api.SessionCompletionSummary;
import io.github.drompincen.clarity.protocol.api.SessionStatus;
import io.github.drompincen.clarity.protocol.ws.ClientMessage;
import io.github.drompincen.clarity.protocol.ws.CloseCode;
import io.github.drompincen.clarity.protocol.ws.ParseResult;
import io.github.drompincen.clarity.protocol.ws.ServerMessage;
import io.github.drompincen.clarity.protocol.ws.SessionIds;
import io.github.drompincen.clarity.protocol.ws.SessionProtocolCodec;
import io.github.drompincen.clarity.protocol.ws.WebSocketErrorCode;
import io.github.drompincen.clarity.runtime.analysis.RabbitholeEvent;
import io.github.drompincen.clarity.runtime.llm.LlmException;
import io.github.drompincen.clarity.runtime.session.ProcessMessageResult;
import io.github.drompincen.clarity.runtime.session.RabbitholeExit;
import io.github.drompincen.clarity.runtime.session.SessionEngineException;
import io.github.drompincen.clarity.runtime.session.SessionEngineFactory;
import io.github.drompincen.clarity.runtime.session.SessionEventListener;
import io.github.drompincen.clarity.runtime.session.SessionOrchestrator;
import io.github.drompincen.clarity.runtime.session.SessionState;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the recall session protocol for each live connection, independent of the socket library.
 * Every callback for a connection synchronizes on its {@link ConnectionState}, so a frame is fully
 * handled (LLM calls and chunk streaming included) before the next one on the same connection.
 */
@Component
public class SessionConnectionHandler {

    private static final Logger log = LoggerFactory.getLogger(SessionConnectionHandler.class);

    private final SessionRepository sessionRepository;
    private final RecallSetRepository recallSetRepository;
    private final SessionEngineFactory engineFactory;
    private final SessionProtocolCodec codec;
    private final ConnectionSettings settings;
    private final ConnectionRegistry registry;
    private final Clock clock;

    public SessionConnectionHandler(SessionRepository sessionRepository,
                                    RecallSetRepository recallSetRepository,
                                    SessionEngineFactory engineFactory,
                                    SessionProtocolCodec codec,
                                    ConnectionSettings settings,
                                    ConnectionRegistry registry,
                                    Clock clock) {
        this.sessionRepository = sessionRepository;
        this.recallSetRepository = recallSetRepository;
        this.engineFactory = engineFactory;
        this.codec = codec;
        this.settings = settings;
        this.registry = registry;
        this.clock = clock;
    }

    public void onOpen(SessionConnection connection, String sessionId) {
        ConnectionState state = new ConnectionState(connection.id(), sessionId, clock.instant());
        registry.register(connection, state);
        synchronized (state) {
            state.moveTo(ConnectionPhase.INITIALIZING);
            if (!SessionIds.isValid(sessionId)) {
                rejectOpen(connection, state, WebSocketErrorCode.INVALID_SESSION_ID, null);
                return;
            }
            try {
                SessionDocument session = sessionRepository.findById(sessionId).orElse(null);
                if (session == null) {
                    rejectOpen(connection, state, WebSocketErrorCode.SESSION_NOT_FOUND,
                            "Session not found: " + sessionId);
                    return;
                }
                if (session.getStatus() != SessionStatus.IN_PROGRESS) {
                    rejectOpen(connection, state, WebSocketErrorCode.SESSION_NOT_ACTIVE,
                            "Session " + sessionId + " is " + session.getStatus().value());
                    return;
                }
                RecallSetDocument recallSet = recallSetRepository.findById(session.getRecallSetId())
                        .orElseThrow(() -> new IllegalStateException(
                                "Recall set " + session.getRecallSetId() + " not found for session " + sessionId));

                SessionOrchestrator orchestrator = engineFactory.create();
                state.attach(session, recallSet, orchestrator);
                orchestrator.setEventListener(new ForwardingListener(connection, state));
                SessionDocument resumed = orchestrator.resumeSession(session, recallSet);
                String opening = orchestrator.getOpeningMessage();
                SessionState progress = orchestrator.getSessionState()
                        .orElseThrow(() -> new SessionEngineException("Session state unavailable after resume"));

                state.markInitialized();
                state.moveTo(ConnectionPhase.ACTIVE);
                send(connection, new ServerMessage.SessionStarted(resumed.getSessionId(), opening,
                        progress.totalPoints(), progress.recalledCount()));
                if (progress.allRecalled()) {
                    showOverlay(connection, state, progress.recalledCount(), progress.totalPoints());
                }
                log.info("Session {} opened on connection {} ({}/{} recalled)", sessionId, connection.id(),
                        progress.recalledCount(), progress.totalPoints());
            } catch (RuntimeException e) {
                log.error("Failed to initialize session {} on connection {}", sessionId, connection.id(), e);
                rejectOpen(connection, state, WebSocketErrorCode.INTERNAL_ERROR, "Failed to initialize session");
            }
        }
    }

    public void onMessage(SessionConnection connection, String raw) {
        ConnectionState state = stateOf(connection);
        if (state == null) {
            log.warn("Frame on unknown connection {}", connection.id());
            return;
        }
        synchronized (state) {
            if (state.isClosingOrClosed()) return;
            state.touch(clock.instant());

            ParseResult parsed = codec.parseClientMessage(raw);
            if (!parsed.isOk()) {
                int errors = state.recordError();
                log.debug("Rejected frame on {} ({} consecutive): {}", connection.id(), errors, parsed.error().message());
                send(connection, parsed.error());
                if (errors >= settings.maxConsecutiveErrors()) {
                    log.warn("Closing connection {}: {} consecutive errors", connection.id(), errors);
                    close(connection, state, CloseCode.TOO_MANY_ERRORS, "Too many consecutive errors");
                }
                return;
            }
            state.resetErrors();

            if (!state.isInitialized()) {
                send(connection, ServerMessage.ErrorPayload.of(WebSocketErrorCode.SESSION_NOT_ACTIVE,
                        "Session is not initialized yet"));
                return;
            }
            parsed.message().accept(new Dispatcher(connection, state));
        }
    }

    /** Releases connection-local state. Persistence already happened in the orchestrator. */
    public void onClose(SessionConnection connection, int statusCode) {
        ConnectionState state = registry.remove(connection.id()).map(ConnectionRegistry.Entry::state).orElse(null);
        if (state == null) return;
        synchronized (state) {
            if (state.getOrchestrator() != null) {
                state.getOrchestrator().close();
            }
            if (state.getPhase() != ConnectionPhase.CLOSED) {
                state.moveTo(ConnectionPhase.CLOSED);
            }
        }
        log.info("Connection {} for session {} closed ({})", connection.id(), state.getSessionId(), statusCode);
    }

    public void onError(SessionConnection connection, Throwable error) {
        log.error("Transport error on connection {}", connection.id(), error);
        ConnectionState state = stateOf(connection);
        if (state == null) return;
        synchronized (state) {
            if (!state.isClosingOrClosed() && connection.isOpen()) {
                send(connection, ServerMessage.ErrorPayload.fatal(WebSocketErrorCode.INTERNAL_ERROR,
                        "An unexpected error occurred"));
            }
        }
    }

    @Scheduled(fixedDelayString = "${clarity.ws.idle-sweep-interval-ms:30000}")
    public void closeIdleConnections() {
        Instant cutoff = clock.instant().minusMillis(settings.idleTimeoutMs());
        for (ConnectionRegistry.Entry entry : registry.snapshot()) {
            ConnectionState state = entry.state();
            synchronized (state) {
                if (state.isClosingOrClosed() || !state.isIdleSince(cutoff)) continue;
                log.info("Connection {} idle since {}, pausing session {}", state.getConnectionId(),
                        state.getLastMessageTime(), state.getSessionId());
                pauseQuietly(state);
                close(entry.connection(), state, CloseCode.IDLE_TIMEOUT, "Idle timeout");
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        List<ConnectionRegistry.Entry> entries = registry.snapshot();
        if (!entries.isEmpty()) {
            log.info("Shutting down, pausing {} live session(s)", entries.size());
        }
        for (ConnectionRegistry.Entry entry : entries) {
            ConnectionState state = entry.state();
            synchronized (state) {
                if (state.isClosingOrClosed()) continue;
                pauseQuietly(state);
                close(entry.connection(), state, CloseCode.SERVER_SHUTDOWN, "Server shutting down");
            }
        }
    }

    /** Splits {@code text} into pieces of at most {@code size} chars, never between a surrogate pair. */
    static List<String> chunks(String text, int size) {
        List<String> chunks = new ArrayList<>();
        if (text == null) return chunks;
        int start = 0;
        while (start < text.length()) {
            int end = Math.min(start + size, text.length());
            if (end < text.length() && Character.isHighSurrogate(text.charAt(end - 1))) {
                end++;
            }
            chunks.add(text.substring(start, end));
            start = end;
        }
        return chunks;
    }

    private void showOverlay(SessionConnection connection, ConnectionState state, int recalledCount, int totalPoints) {
        if (state.isOverlayShown()) return;
        state.setOverlayShown(true);
        send(connection, new ServerMessage.SessionCompleteOverlay(recalledCount, totalPoints,
                state.getSessionId(),
                "You've recalled all " + totalPoints + " points. Keep discussing, or leave to finish the session.",
                true));
    }

    private final class Dispatcher implements ClientMessage.Visitor<Void> {

        private final SessionConnection connection;
        private final ConnectionState state;
        private final SessionOrchestrator orchestrator;

        Dispatcher(SessionConnection connection, ConnectionState state) {
            this.connection = connection;
            this.state = state;
            this.orchestrator = state.getOrchestrator();
        }

        @Override
        public Void visitUserMessage(ClientMessage.UserMessage message) {
            guarded(() -> {
                ProcessMessageResult result = orchestrator.processUserMessage(message.content());
                streamReply(connection, state, result.response());
                List<String> recalled = result.pointsRecalledThisTurn();
                int before = result.recalledCount() - recalled.size();
                for (int i = 0; i < recalled.size(); i++) {
                    send(connection, new ServerMessage.PointRecalled(recalled.get(i), before + i + 1,
                            result.totalPoints()));
                }
                if (result.completionReached()) {
                    showOverlay(connection, state, result.recalledCount(), result.totalPoints());
                }
            });
            return null;
        }

        @Override
        public Void visitLeaveSession(ClientMessage.LeaveSession message) {
            guarded(() -> {
                SessionState progress = orchestrator.getSessionState()
                        .orElseThrow(() -> new SessionEngineException("No active session"));
                if (progress.allRecalled()) {
                    SessionCompletionSummary summary = orchestrator.completeSession();
                    send(connection, new ServerMessage.SessionComplete(summary));
                    close(connection, state, CloseCode.NORMAL, "Session completed");
                } else {
                    orchestrator.pauseSession();
                    send(connection, new ServerMessage.SessionPaused(progress.sessionId(),
                            progress.recalledCount(), progress.totalPoints()));
                    close(connection, state, CloseCode.SESSION_ENDED, "Session paused");
                }
            });
            return null;
        }

        @Override
        public Void visitPing(ClientMessage.Ping message) {
            send(connection, new ServerMessage.Pong(clock.millis()));
            return null;
        }

        @Override
        public Void visitEnterRabbithole(ClientMessage.EnterRabbithole message) {
            guarded(() -> {
                String opening = orchestrator.enterRabbithole(message.rabbitholeEventId(), message.topic());
                send(connection, new ServerMessage.RabbitholeEntered(message.topic()));
                streamReply(connection, state, opening);
            });
            return null;
        }

        @Override
        public Void visitExitRabbithole(ClientMessage.ExitRabbithole message) {
            guarded(() -> {
                RabbitholeExit exit = orchestrator.exitRabbithole();
                send(connection, new ServerMessage.RabbitholeExited(exit.label(), exit.pointsRecalledDuring(),
                        exit.completionPending()));
                if (exit.completionPending()) {
                    SessionState progress = orchestrator.getSessionState()
                            .orElseThrow(() -> new SessionEngineException("No active session"));
                    showOverlay(connection, state, progress.recalledCount(), progress.totalPoints());
                }
            });
            return null;
        }

        @Override
        public Void visitDeclineRabbithole(ClientMessage.DeclineRabbithole message) {
            guarded(orchestrator::declineRabbithole);
            return null;
        }

        @Override
        public Void visitDismissOverlay(ClientMessage.DismissOverlay message) {
            if (state.isOverlayShown()) {
                log.debug("Session {} continues after completion", state.getSessionId());
            }
            return null;
        }

        /** Orchestrator and LLM failures are reported as recoverable so the learner can retry the turn. */
        private void guarded(Runnable action) {
            try {
                action.run();
            } catch (LlmException e) {
                log.warn("LLM failure in session {}: {}", state.getSessionId(), e.getMessage());
                send(connection, ServerMessage.ErrorPayload.of(WebSocketErrorCode.LLM_ERROR, e.getMessage()));
            } catch (RuntimeException e) {
                log.warn("Session engine failure in session {}", state.getSessionId(), e);
                send(connection, ServerMessage.ErrorPayload.of(WebSocketErrorCode.SESSION_ENGINE_ERROR,
                        e.getMessage() != null ? e.getMessage() : WebSocketErrorCode.SESSION_ENGINE_ERROR.description()));
            }
        }
    }

    private final class ForwardingListener implements SessionEventListener {

        private final SessionConnection connection;
        private final ConnectionState state;

        ForwardingListener(SessionConnection connection, ConnectionState state) {
            this.connection = connection;
            this.state = state;
        }

        @Override
        public void onRabbitholeDetected(String sessionId, RabbitholeEvent event) {
            synchronized (state) {
                if (state.isClosingOrClosed()) return;
                send(connection, new ServerMessage.RabbitholeDetected(event.topic(), event.id()));
            }
        }
    }

    private void streamReply(SessionConnection connection, ConnectionState state, String text) {
        String reply = text != null ? text : "";
        List<String> chunks = chunks(reply, settings.chunkSize());
        state.moveTo(ConnectionPhase.STREAMING);
        try {
            Flux<ServerMessage> frames = Flux.range(0, chunks.size())
                    .map(i -> new ServerMessage.AssistantChunk(chunks.get(i), i));
            if (settings.chunkDelayMs() > 0) {
                frames = frames.delayElements(Duration.ofMillis(settings.chunkDelayMs()));
            }
            frames.doOnNext(frame -> send(connection, frame)).blockLast();
        } finally {
            if (state.getPhase() == ConnectionPhase.STREAMING) {
                state.moveTo(ConnectionPhase.ACTIVE);
            }
        }
        send(connection, new ServerMessage.AssistantComplete(reply, chunks.size()));
    }

    private void rejectOpen(SessionConnection connection, ConnectionState state, WebSocketErrorCode code, String message) {
        log.warn("Rejecting connection {} for session {}: {}", connection.id(), state.getSessionId(), code);
        send(connection, ServerMessage.ErrorPayload.fatal(code, message));
        close(connection, state, CloseCode.INVALID_SESSION, code.description());
    }

    private void pauseQuietly(ConnectionState state) {
        SessionOrchestrator orchestrator = state.getOrchestrator();
        if (orchestrator == null || !state.isInitialized()) return;
        try {
            orchestrator.pauseSession();
        } catch (RuntimeException e) {
            log.warn("Failed to pause session {}", state.getSessionId(), e);
        }
    }

    private void close(SessionConnection connection, ConnectionState state, CloseCode code, String reason) {
        if (state.isClosingOrClosed()) return;
        state.moveTo(ConnectionPhase.CLOSING);
        connection.close(code, reason);
    }

    private void send(SessionConnection connection, ServerMessage message) {
        connection.send(codec.serializeServerMessage(message));
    }

    private ConnectionState stateOf(SessionConnection connection) {
        return registry.get(connection.id()).map(ConnectionRegistry.Entry::state).orElse(null);
    }
}
