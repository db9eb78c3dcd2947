package io.github.drompincen.clarity.persistence.repository;

import io.github.drompincen.clarity.persistence.document.SessionDocument;
import io.github.drompincen.clarity.protocol.api.SessionStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface SessionRepository extends MongoRepository<SessionDocument, String> {
    List<SessionDocument> findByRecallSetIdAndStatus(String recallSetId, SessionStatus status);
}
