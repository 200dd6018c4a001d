package io.github.drompincen.worktrack.persistence.repository;

import io.github.drompincen.worktrack.persistence.document.TrackerLogDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface TrackerLogRepository extends MongoRepository<TrackerLogDocument, String> {
    List<TrackerLogDocument> findByUserIdOrderByTimestampDesc(String userId);
}
