package io.github.drompincen.clarity.persistence.repository;

import io.github.drompincen.clarity.persistence.document.SessionMessageDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface SessionMessageRepository extends MongoRepository<SessionMessageDocument, String> {
    List<SessionMessageDocument> findBySessionIdOrderBySeqAsc(String sessionId);
}
