package io.github.drompincen.clarity.persistence.document;

import io.github.drompincen.clarity.protocol.api.LearningState;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Document(collection = "recall_points")
public class RecallPointDocument {

    @Id
    private String recallPointId;

    @Indexed
    private String recallSetId;

    private String content;
    private String context;
    private LearningState learningState;
    private List<RecallAttempt> recallHistory = new ArrayList<>();
    private Instant createdAt;
    private Instant updatedAt;

    public RecallPointDocument() {}

    public static class RecallAttempt {
        private Instant timestamp;
        private boolean success;
        private long latencyMs;

        public RecallAttempt() {}

        public RecallAttempt(Instant timestamp, boolean success, long latencyMs) {
            this.timestamp = timestamp;
            this.success = success;
            this.latencyMs = latencyMs;
        }

        public Instant getTimestamp() { return timestamp; }
        public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }

        public boolean isSuccess() { return success; }
        public void setSuccess(boolean success) { this.success = success; }

        public long getLatencyMs() { return latencyMs; }
        public void setLatencyMs(long latencyMs) { this.latencyMs = latencyMs; }
    }

    public String getRecallPointId() { return recallPointId; }
    public void setRecallPointId(String recallPointId) { this.recallPointId = recallPointId; }

    public String getRecallSetId() { return recallSetId; }
    public void setRecallSetId(String recallSetId) { this.recallSetId = recallSetId; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public String getContext() { return context; }
    public void setContext(String context) { this.context = context; }

    public LearningState getLearningState() { return learningState; }
    public void setLearningState(LearningState learningState) { this.learningState = learningState; }

    public List<RecallAttempt> getRecallHistory() { return recallHistory; }
    public void setRecallHistory(List<RecallAttempt> recallHistory) { this.recallHistory = recallHistory; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
