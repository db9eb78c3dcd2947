package io.github.drompincen.clarity.persistence.document;

import io.github.drompincen.clarity.protocol.api.MessageRole;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "session_messages")
@CompoundIndex(name = "session_seq", def = "{'sessionId': 1, 'seq': 1}", unique = true)
public class SessionMessageDocument {

    @Id
    private String messageId;
    private String sessionId;
    private long seq;
    private MessageRole role;
    private String content;
    private Instant timestamp;
    // set only for messages exchanged inside a rabbithole
    private String rabbitholeEventId;

    public SessionMessageDocument() {}

    public String getMessageId() { return messageId; }
    public void setMessageId(String messageId) { this.messageId = messageId; }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public long getSeq() { return seq; }
    public void setSeq(long seq) { this.seq = seq; }

    public MessageRole getRole() { return role; }
    public void setRole(MessageRole role) { this.role = role; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }

    public String getRabbitholeEventId() { return rabbitholeEventId; }
    public void setRabbitholeEventId(String rabbitholeEventId) { this.rabbitholeEventId = rabbitholeEventId; }
}
