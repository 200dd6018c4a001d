package io.github.drompincen.worktrack.persistence.repository;

import io.github.drompincen.worktrack.persistence.document.CaptureCommandDocument;
import io.github.drompincen.worktrack.protocol.api.CommandStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface CaptureCommandRepository extends MongoRepository<CaptureCommandDocument, String> {
    List<CaptureCommandDocument> findByUserIdAndStatusOrderByRequestedAtAsc(String userId, CommandStatus status);
    List<CaptureCommandDocument> findByUserIdOrderByRequestedAtDesc(String userId);
}
