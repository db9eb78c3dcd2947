package io.github.drompincen.clarity.persistence.repository;

import io.github.drompincen.clarity.persistence.document.RabbitholeEventDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface RabbitholeEventRepository extends MongoRepository<RabbitholeEventDocument, String> {
    long countBySessionId(String sessionId);
}
