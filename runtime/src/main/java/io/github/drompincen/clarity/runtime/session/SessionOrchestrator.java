package io.github.drompincen.clarity.runtime.session;

import io.github.drompincen.clarity.persistence.document.RecallSetDocument;
import io.github.drompincen.clarity.persistence.document.SessionDocument;
import io.github.drompincen.clarity.protocol.api.SessionCompletionSummary;

import java.util.Optional;

/**
 * Drives one recall session: what the tutor says, which points were recalled, and how the session
 * ends. One instance serves one connection at a time.
 */
public interface SessionOrchestrator extends AutoCloseable {

    /** Resumes the in-progress session for this set, or creates one from the points that are due. */
    SessionDocument startSession(RecallSetDocument recallSet);

    SessionDocument resumeSession(SessionDocument session, RecallSetDocument recallSet);

    String getOpeningMessage();

    Optional<SessionState> getSessionState();

    ProcessMessageResult processUserMessage(String content);

    /** Forces an evaluation of the point currently being probed. */
    ProcessMessageResult triggerEvaluation();

    void abandonSession();

    void pauseSession();

    SessionCompletionSummary completeSession();

    /** Opts into a detected tangent and returns the exploration partner's first message. */
    String enterRabbithole(String rabbitholeEventId, String topic);

    RabbitholeExit exitRabbithole();

    void declineRabbithole();

    void setEventListener(SessionEventListener listener);

    @Override
    void close();
}
