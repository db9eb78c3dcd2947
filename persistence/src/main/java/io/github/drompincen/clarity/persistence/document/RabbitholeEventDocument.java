package io.github.drompincen.clarity.persistence.document;

import io.github.drompincen.clarity.protocol.api.RabbitholeStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Document(collection = "rabbithole_events")
public class RabbitholeEventDocument {

    @Id
    private String eventId;

    @Indexed
    private String sessionId;

    private String topic;
    private int triggerMessageIndex;
    private Integer returnMessageIndex;
    private int depth;
    private List<String> relatedRecallPointIds = new ArrayList<>();
    private boolean userInitiated;
    private boolean entered;
    private RabbitholeStatus status;
    private Instant detectedAt;
    private Instant closedAt;

    public RabbitholeEventDocument() {}

    public String getEventId() { return eventId; }
    public void setEventId(String eventId) { this.eventId = eventId; }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public String getTopic() { return topic; }
    public void setTopic(String topic) { this.topic = topic; }

    public int getTriggerMessageIndex() { return triggerMessageIndex; }
    public void setTriggerMessageIndex(int triggerMessageIndex) { this.triggerMessageIndex = triggerMessageIndex; }

    public Integer getReturnMessageIndex() { return returnMessageIndex; }
    public void setReturnMessageIndex(Integer returnMessageIndex) { this.returnMessageIndex = returnMessageIndex; }

    public int getDepth() { return depth; }
    public void setDepth(int depth) { this.depth = depth; }

    public List<String> getRelatedRecallPointIds() { return relatedRecallPointIds; }
    public void setRelatedRecallPointIds(List<String> relatedRecallPointIds) { this.relatedRecallPointIds = relatedRecallPointIds; }

    public boolean isUserInitiated() { return userInitiated; }
    public void setUserInitiated(boolean userInitiated) { this.userInitiated = userInitiated; }

    public boolean isEntered() { return entered; }
    public void setEntered(boolean entered) { this.entered = entered; }

    public RabbitholeStatus getStatus() { return status; }
    public void setStatus(RabbitholeStatus status) { this.status = status; }

    public Instant getDetectedAt() { return detectedAt; }
    public void setDetectedAt(Instant detectedAt) { this.detectedAt = detectedAt; }

    public Instant getClosedAt() { return closedAt; }
    public void setClosedAt(Instant closedAt) { this.closedAt = closedAt; }
}
