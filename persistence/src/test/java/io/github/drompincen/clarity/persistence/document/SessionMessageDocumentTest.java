package io.github.drompincen.clarity.persistence.document;

import io.github.drompincen.clarity.protocol.api.MessageRole;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SessionMessageDocumentTest {

    @Test
    void messageFieldsPreserved() {
        SessionMessageDocument doc = new SessionMessageDocument();
        doc.setMessageId("m1");
        doc.setSessionId("sess_1");
        doc.setSeq(3);
        doc.setRole(MessageRole.USER);
        doc.setContent("It was signed in 1919");
        doc.setTimestamp(Instant.now());
        doc.setRabbitholeEventId("rh_1");

        assertThat(doc.getMessageId()).isEqualTo("m1");
        assertThat(doc.getRole()).isEqualTo(MessageRole.USER);
        assertThat(doc.getContent()).isEqualTo("It was signed in 1919");
        assertThat(doc.getSeq()).isEqualTo(3);
        assertThat(doc.getRabbitholeEventId()).isEqualTo("rh_1");
    }
}
