package io.github.drompincen.clarity.gateway.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.clarity.persistence.document.RecallSetDocument;
import io.github.drompincen.clarity.persistence.document.SessionDocument;
import io.github.drompincen.clarity.persistence.repository.RecallSetRepository;
import io.github.drompincen.clarity.persistence.repository.SessionRepository;
import io.github.drompincen.clarity.protocol.api.RabbitholeStatus;
import io.github.drompincen.clarity.protocol.api.SessionCompletionSummary;
import io.github.drompincen.clarity.protocol.api.SessionStatus;
import io.github.drompincen.clarity.protocol.ws.CloseCode;
import io.github.drompincen.clarity.protocol.ws.SessionProtocolCodec;
import io.github.drompincen.clarity.runtime.analysis.RabbitholeEvent;
import io.github.drompincen.clarity.runtime.llm.LlmException;
import io.github.drompincen.clarity.runtime.session.ProcessMessageResult;
import io.github.drompincen.clarity.runtime.session.RabbitholeExit;
import io.github.drompincen.clarity.runtime.session.SessionEngineException;
import io.github.drompincen.clarity.runtime.session.SessionEngineFactory;
import io.github.drompincen.clarity.runtime.session.SessionEventListener;
import io.github.drompincen.clarity.runtime.session.SessionOrchestrator;
import io.github.drompincen.clarity.runtime.session.SessionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionConnectionHandlerTest {

    private static final Instant T0 = Instant.parse("2025-06-01T10:00:00Z");
    private static final String SESSION_ID = "sess_abc123";

    @Mock private SessionRepository sessionRepository;
    @Mock private RecallSetRepository recallSetRepository;
    @Mock private SessionEngineFactory engineFactory;
    @Mock private SessionOrchestrator orchestrator;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MutableClock clock;
    private ConnectionRegistry registry;
    private SessionConnectionHandler handler;
    private RecordingConnection connection;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        registry = new ConnectionRegistry();
        handler = new SessionConnectionHandler(sessionRepository, recallSetRepository, engineFactory,
                new SessionProtocolCodec(), new ConnectionSettings(5, 60_000, 20, 0), registry, clock);
        connection = new RecordingConnection("conn-1");
    }

    private SessionDocument session(SessionStatus status) {
        SessionDocument session = new SessionDocument();
        session.setSessionId(SESSION_ID);
        session.setRecallSetId("set-1");
        session.setStatus(status);
        session.setTargetRecallPointIds(List.of("p1", "p2", "p3"));
        session.setRecalledPointIds(new ArrayList<>());
        session.setStartedAt(T0);
        return session;
    }

    private SessionState progress(int recalled, boolean inRabbithole) {
        return new SessionState(SESSION_ID, "set-1", SessionStatus.IN_PROGRESS, 3, recalled,
                List.of("p1", "p2", "p3").subList(0, recalled), "p1", 2, inRabbithole, null, T0);
    }

    private void open() {
        SessionDocument session = session(SessionStatus.IN_PROGRESS);
        RecallSetDocument recallSet = new RecallSetDocument();
        recallSet.setRecallSetId("set-1");
        recallSet.setName("Biology");
        when(sessionRepository.findById(SESSION_ID)).thenReturn(Optional.of(session));
        when(recallSetRepository.findById("set-1")).thenReturn(Optional.of(recallSet));
        when(engineFactory.create()).thenReturn(orchestrator);
        when(orchestrator.resumeSession(session, recallSet)).thenReturn(session);
        when(orchestrator.getOpeningMessage()).thenReturn("What do you remember about cells?");
        when(orchestrator.getSessionState()).thenReturn(Optional.of(progress(1, false)));

        handler.onOpen(connection, SESSION_ID);
        connection.frames.clear();
    }

    private List<JsonNode> frames() {
        return connection.frames.stream().map(frame -> {
            try {
                return objectMapper.readTree(frame);
            } catch (Exception e) {
                throw new AssertionError("Not JSON: " + frame, e);
            }
        }).collect(Collectors.toList());
    }

    private List<String> types() {
        return frames().stream().map(node -> node.path("type").asText()).collect(Collectors.toList());
    }

    @Test
    void openSendsSessionStarted() throws Exception {
        open();
        // open() clears frames, so replay the assertion against a fresh connection
        RecordingConnection second = new RecordingConnection("conn-2");
        handler.onOpen(second, SESSION_ID);

        JsonNode started = objectMapper.readTree(second.frames.get(0));
        assertThat(started.path("type").asText()).isEqualTo("session_started");
        assertThat(started.path("sessionId").asText()).isEqualTo(SESSION_ID);
        assertThat(started.path("openingMessage").asText()).isEqualTo("What do you remember about cells?");
        assertThat(started.path("totalPoints").asInt()).isEqualTo(3);
        assertThat(started.path("recalledCount").asInt()).isEqualTo(1);
        assertThat(second.closeCode).isNull();
        verify(orchestrator, times(2)).setEventListener(any());
    }

    @Test
    void unknownSessionIsRejectedWithInvalidSessionCode() {
        when(sessionRepository.findById(SESSION_ID)).thenReturn(Optional.empty());

        handler.onOpen(connection, SESSION_ID);

        List<JsonNode> frames = frames();
        assertThat(frames).hasSize(1);
        assertThat(frames.get(0).path("code").asText()).isEqualTo("SESSION_NOT_FOUND");
        assertThat(frames.get(0).path("recoverable").asBoolean()).isFalse();
        assertThat(connection.closeCode).isEqualTo(CloseCode.INVALID_SESSION);
        verifyNoInteractions(engineFactory);
    }

    @Test
    void pausedSessionIsRejectedAsNotActive() {
        when(sessionRepository.findById(SESSION_ID)).thenReturn(Optional.of(session(SessionStatus.PAUSED)));

        handler.onOpen(connection, SESSION_ID);

        assertThat(frames().get(0).path("code").asText()).isEqualTo("SESSION_NOT_ACTIVE");
        assertThat(connection.closeCode).isEqualTo(CloseCode.INVALID_SESSION);
    }

    @Test
    void malformedSessionIdIsRejectedWithoutLookup() {
        handler.onOpen(connection, "not-a-session");

        assertThat(frames().get(0).path("code").asText()).isEqualTo("INVALID_SESSION_ID");
        assertThat(connection.closeCode).isEqualTo(CloseCode.INVALID_SESSION);
        verifyNoInteractions(sessionRepository);
    }

    @Test
    void failureDuringOpenReportsInternalErrorAndReleasesEngine() {
        SessionDocument session = session(SessionStatus.IN_PROGRESS);
        RecallSetDocument recallSet = new RecallSetDocument();
        recallSet.setRecallSetId("set-1");
        when(sessionRepository.findById(SESSION_ID)).thenReturn(Optional.of(session));
        when(recallSetRepository.findById("set-1")).thenReturn(Optional.of(recallSet));
        when(engineFactory.create()).thenReturn(orchestrator);
        when(orchestrator.resumeSession(session, recallSet)).thenThrow(new IllegalStateException("db down"));

        handler.onOpen(connection, SESSION_ID);

        assertThat(frames().get(0).path("code").asText()).isEqualTo("INTERNAL_ERROR");
        assertThat(frames().get(0).path("recoverable").asBoolean()).isFalse();
        assertThat(connection.closeCode).isEqualTo(CloseCode.INVALID_SESSION);

        handler.onClose(connection, CloseCode.INVALID_SESSION.code());
        verify(orchestrator).close();
        assertThat(registry.size()).isZero();
    }

    @Test
    void pingGetsExactlyOnePong() {
        open();

        handler.onMessage(connection, "{\"type\":\"ping\"}");

        List<JsonNode> frames = frames();
        assertThat(frames).hasSize(1);
        assertThat(frames.get(0).path("type").asText()).isEqualTo("pong");
        assertThat(frames.get(0).path("timestamp").asLong()).isEqualTo(T0.toEpochMilli());
    }

    @Test
    void fifthConsecutiveMalformedFrameClosesWithTooManyErrors() {
        open();

        for (int i = 0; i < 4; i++) {
            handler.onMessage(connection, "{not json");
        }
        assertThat(connection.closeCode).isNull();

        handler.onMessage(connection, "{not json");

        assertThat(types()).hasSize(5).containsOnly("error");
        assertThat(connection.closeCode).isEqualTo(CloseCode.TOO_MANY_ERRORS);

        handler.onMessage(connection, "{\"type\":\"ping\"}");
        assertThat(types()).hasSize(5);
    }

    @Test
    void validFrameResetsErrorBudget() {
        open();

        for (int i = 0; i < 4; i++) handler.onMessage(connection, "{\"type\":\"bogus\"}");
        handler.onMessage(connection, "{\"type\":\"ping\"}");
        for (int i = 0; i < 4; i++) handler.onMessage(connection, "{\"type\":\"bogus\"}");

        assertThat(connection.closeCode).isNull();
        assertThat(frames().get(0).path("code").asText()).isEqualTo("UNKNOWN_MESSAGE_TYPE");
        assertThat(frames().get(0).path("recoverable").asBoolean()).isTrue();
    }

    @Test
    void userMessageStreamsChunksThenCompleteThenRecalledPoints() {
        open();
        String reply = "Mitochondria make ATP. What else happens there?";
        when(orchestrator.processUserMessage("mitochondria are the powerhouse"))
                .thenReturn(new ProcessMessageResult(reply, List.of("p2", "p3"), 3, 3, false));

        handler.onMessage(connection, "{\"type\":\"user_message\",\"content\":\"mitochondria are the powerhouse\"}");

        List<JsonNode> frames = frames();
        assertThat(types()).containsExactly("assistant_chunk", "assistant_chunk", "assistant_chunk",
                "assistant_complete", "point_recalled", "point_recalled");
        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < 3; i++) {
            assertThat(frames.get(i).path("chunkIndex").asInt()).isEqualTo(i);
            joined.append(frames.get(i).path("content").asText());
        }
        assertThat(frames.get(0).path("content").asText()).hasSize(20);
        assertThat(joined.toString()).isEqualTo(reply);
        assertThat(frames.get(3).path("fullContent").asText()).isEqualTo(reply);
        assertThat(frames.get(3).path("totalChunks").asInt()).isEqualTo(3);
        assertThat(frames.get(4).path("pointId").asText()).isEqualTo("p2");
        assertThat(frames.get(4).path("recalledCount").asInt()).isEqualTo(2);
        assertThat(frames.get(5).path("recalledCount").asInt()).isEqualTo(3);
    }

    @Test
    void completionShowsOverlayAndOnlyLeaveFinalizes() {
        open();
        when(orchestrator.processUserMessage(any()))
                .thenReturn(new ProcessMessageResult("All done!", List.of("p3"), 3, 3, true));

        handler.onMessage(connection, "{\"type\":\"user_message\",\"content\":\"the last one\"}");
        assertThat(types()).contains("session_complete_overlay").doesNotContain("session_complete");
        assertThat(connection.closeCode).isNull();

        handler.onMessage(connection, "{\"type\":\"dismiss_overlay\"}");
        handler.onMessage(connection, "{\"type\":\"user_message\",\"content\":\"one more thought\"}");
        assertThat(types().stream().filter("session_complete_overlay"::equals)).hasSize(1);

        when(orchestrator.getSessionState()).thenReturn(Optional.of(progress(3, false)));
        when(orchestrator.completeSession()).thenReturn(new SessionCompletionSummary(
                SESSION_ID, 3, 3, 1.0, 90_000, 0, List.of("p1", "p2", "p3")));

        handler.onMessage(connection, "{\"type\":\"leave_session\"}");

        List<String> types = types();
        assertThat(types.indexOf("session_complete_overlay")).isLessThan(types.indexOf("session_complete"));
        assertThat(frames().get(types.size() - 1).path("summary").path("recallRate").asDouble()).isEqualTo(1.0);
        assertThat(connection.closeCode).isEqualTo(CloseCode.NORMAL);
        verify(orchestrator, never()).pauseSession();
    }

    @Test
    void reconnectAtFullRecallShowsOverlayAfterSessionStarted() {
        SessionDocument session = session(SessionStatus.IN_PROGRESS);
        RecallSetDocument recallSet = new RecallSetDocument();
        recallSet.setRecallSetId("set-1");
        when(sessionRepository.findById(SESSION_ID)).thenReturn(Optional.of(session));
        when(recallSetRepository.findById("set-1")).thenReturn(Optional.of(recallSet));
        when(engineFactory.create()).thenReturn(orchestrator);
        when(orchestrator.resumeSession(session, recallSet)).thenReturn(session);
        when(orchestrator.getOpeningMessage()).thenReturn("Anything else before we wrap up?");
        when(orchestrator.getSessionState()).thenReturn(Optional.of(progress(3, false)));

        handler.onOpen(connection, SESSION_ID);

        assertThat(types()).containsExactly("session_started", "session_complete_overlay");
        JsonNode overlay = frames().get(1);
        assertThat(overlay.path("recalledCount").asInt()).isEqualTo(3);
        assertThat(overlay.path("totalPoints").asInt()).isEqualTo(3);
        assertThat(overlay.path("canContinue").asBoolean()).isTrue();
        assertThat(connection.closeCode).isNull();
    }

    @Test
    void leaveWithPendingPointsPausesSession() {
        open();

        handler.onMessage(connection, "{\"type\":\"leave_session\"}");

        verify(orchestrator).pauseSession();
        verify(orchestrator, never()).completeSession();
        JsonNode paused = frames().get(0);
        assertThat(paused.path("type").asText()).isEqualTo("session_paused");
        assertThat(paused.path("recalledCount").asInt()).isEqualTo(1);
        assertThat(paused.path("totalPoints").asInt()).isEqualTo(3);
        assertThat(connection.closeCode).isEqualTo(CloseCode.SESSION_ENDED);
    }

    @Test
    void llmFailureIsReportedAsRecoverable() {
        open();
        when(orchestrator.processUserMessage(any())).thenThrow(new LlmException("rate limited"));

        handler.onMessage(connection, "{\"type\":\"user_message\",\"content\":\"hello\"}");

        JsonNode error = frames().get(0);
        assertThat(error.path("code").asText()).isEqualTo("LLM_ERROR");
        assertThat(error.path("recoverable").asBoolean()).isTrue();
        assertThat(connection.closeCode).isNull();
    }

    @Test
    void engineFailureIsReportedAsSessionEngineError() {
        open();
        when(orchestrator.exitRabbithole()).thenThrow(new SessionEngineException("Not in a rabbithole"));

        handler.onMessage(connection, "{\"type\":\"exit_rabbithole\"}");

        assertThat(frames().get(0).path("code").asText()).isEqualTo("SESSION_ENGINE_ERROR");
        assertThat(frames().get(0).path("message").asText()).isEqualTo("Not in a rabbithole");
    }

    @Test
    void enterRabbitholeAnnouncesThenStreamsOpening() {
        open();
        when(orchestrator.enterRabbithole("rh_1", "Viruses")).thenReturn("Viruses are strange. Where to start?");

        handler.onMessage(connection, "{\"type\":\"enter_rabbithole\",\"rabbitholeEventId\":\"rh_1\",\"topic\":\"Viruses\"}");

        List<String> types = types();
        assertThat(types.get(0)).isEqualTo("rabbithole_entered");
        assertThat(frames().get(0).path("topic").asText()).isEqualTo("Viruses");
        assertThat(types.get(types.size() - 1)).isEqualTo("assistant_complete");
    }

    @Test
    void exitWithPendingCompletionShowsOverlay() {
        open();
        when(orchestrator.exitRabbithole()).thenReturn(new RabbitholeExit("Viruses", 2, true));
        when(orchestrator.getSessionState()).thenReturn(Optional.of(progress(3, false)));

        handler.onMessage(connection, "{\"type\":\"exit_rabbithole\"}");

        assertThat(types()).containsExactly("rabbithole_exited", "session_complete_overlay");
        JsonNode exited = frames().get(0);
        assertThat(exited.path("label").asText()).isEqualTo("Viruses");
        assertThat(exited.path("pointsRecalledDuring").asInt()).isEqualTo(2);
        assertThat(exited.path("completionPending").asBoolean()).isTrue();
    }

    @Test
    void declineSendsNoFrame() {
        open();

        handler.onMessage(connection, "{\"type\":\"decline_rabbithole\"}");

        verify(orchestrator).declineRabbithole();
        assertThat(connection.frames).isEmpty();
    }

    @Test
    void detectedTangentIsForwardedToClient() {
        ArgumentCaptor<SessionEventListener> listener = ArgumentCaptor.forClass(SessionEventListener.class);
        open();
        verify(orchestrator).setEventListener(listener.capture());

        listener.getValue().onRabbitholeDetected(SESSION_ID, new RabbitholeEvent("rh_9", "Viruses", 3, null, 1,
                List.of(), true, RabbitholeStatus.ACTIVE, T0));

        JsonNode detected = frames().get(0);
        assertThat(detected.path("type").asText()).isEqualTo("rabbithole_detected");
        assertThat(detected.path("topic").asText()).isEqualTo("Viruses");
        assertThat(detected.path("rabbitholeEventId").asText()).isEqualTo("rh_9");
    }

    @Test
    void closeReleasesEngineWithoutPersisting() {
        open();

        handler.onClose(connection, 1001);

        verify(orchestrator).close();
        verify(orchestrator, never()).pauseSession();
        assertThat(registry.size()).isZero();
    }

    @Test
    void idleConnectionIsPausedAndClosed() {
        open();
        clock.advance(Duration.ofSeconds(30));
        handler.closeIdleConnections();
        assertThat(connection.closeCode).isNull();

        clock.advance(Duration.ofSeconds(31));
        handler.closeIdleConnections();

        verify(orchestrator).pauseSession();
        assertThat(connection.closeCode).isEqualTo(CloseCode.IDLE_TIMEOUT);
    }

    @Test
    void shutdownPausesLiveSessions() {
        open();

        handler.shutdown();

        verify(orchestrator).pauseSession();
        assertThat(connection.closeCode).isEqualTo(CloseCode.SERVER_SHUTDOWN);
    }

    @Test
    void chunksNeverSplitSurrogatePairs() {
        String text = "ab😀cd";

        List<String> chunks = SessionConnectionHandler.chunks(text, 3);

        assertThat(String.join("", chunks)).isEqualTo(text);
        assertThat(chunks.get(0)).isEqualTo("ab😀");
        assertThat(SessionConnectionHandler.chunks("", 20)).isEmpty();
    }

    static final class RecordingConnection implements SessionConnection {
        private final String id;
        final List<String> frames = new ArrayList<>();
        CloseCode closeCode;
        private boolean open = true;

        RecordingConnection(String id) {
            this.id = id;
        }

        @Override public String id() { return id; }

        @Override
        public void send(String frame) {
            frames.add(frame);
        }

        @Override
        public void close(CloseCode code, String reason) {
            closeCode = code;
            open = false;
        }

        @Override public boolean isOpen() { return open; }
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
