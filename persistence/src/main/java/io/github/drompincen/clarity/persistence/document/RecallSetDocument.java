package io.github.drompincen.clarity.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "recall_sets")
public class RecallSetDocument {

    public enum RecallSetStatus { ACTIVE, PAUSED, ARCHIVED }

    @Id
    private String recallSetId;

    private String name;
    private String description;
    private RecallSetStatus status;
    private String discussionSystemPrompt;
    private Instant createdAt;
    private Instant updatedAt;

    public RecallSetDocument() {}

    public String getRecallSetId() { return recallSetId; }
    public void setRecallSetId(String recallSetId) { this.recallSetId = recallSetId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public RecallSetStatus getStatus() { return status; }
    public void setStatus(RecallSetStatus status) { this.status = status; }

    public String getDiscussionSystemPrompt() { return discussionSystemPrompt; }
    public void setDiscussionSystemPrompt(String discussionSystemPrompt) { this.discussionSystemPrompt = discussionSystemPrompt; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
