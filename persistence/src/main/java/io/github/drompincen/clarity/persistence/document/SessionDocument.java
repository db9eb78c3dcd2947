package io.github.drompincen.clarity.persistence.document;

import io.github.drompincen.clarity.protocol.api.SessionStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Document(collection = "sessions")
public class SessionDocument {

    @Id
    private String sessionId;

    @Indexed
    private String recallSetId;

    private SessionStatus status;
    private List<String> targetRecallPointIds = new ArrayList<>();
    // checklist progress, survives pause/resume
    private List<String> recalledPointIds = new ArrayList<>();
    private Instant startedAt;
    private Instant pausedAt;
    private Instant endedAt;

    public SessionDocument() {}

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public String getRecallSetId() { return recallSetId; }
    public void setRecallSetId(String recallSetId) { this.recallSetId = recallSetId; }

    public SessionStatus getStatus() { return status; }
    public void setStatus(SessionStatus status) { this.status = status; }

    public List<String> getTargetRecallPointIds() { return targetRecallPointIds; }
    public void setTargetRecallPointIds(List<String> targetRecallPointIds) { this.targetRecallPointIds = targetRecallPointIds; }

    public List<String> getRecalledPointIds() { return recalledPointIds; }
    public void setRecalledPointIds(List<String> recalledPointIds) { this.recalledPointIds = recalledPointIds; }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getPausedAt() { return pausedAt; }
    public void setPausedAt(Instant pausedAt) { this.pausedAt = pausedAt; }

    public Instant getEndedAt() { return endedAt; }
    public void setEndedAt(Instant endedAt) { this.endedAt = endedAt; }
}
