package io.github.drompincen.clarity.persistence.repository;

import io.github.drompincen.clarity.persistence.document.RecallPointDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface RecallPointRepository extends MongoRepository<RecallPointDocument, String> {
    List<RecallPointDocument> findByRecallSetId(String recallSetId);
}
