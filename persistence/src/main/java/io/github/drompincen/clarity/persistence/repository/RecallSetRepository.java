package io.github.drompincen.clarity.persistence.repository;

import io.github.drompincen.clarity.persistence.document.RecallSetDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface RecallSetRepository extends MongoRepository<RecallSetDocument, String> {
}
