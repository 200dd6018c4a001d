package io.github.drompincen.worktrack.persistence.repository;

import io.github.drompincen.worktrack.persistence.document.WorkSessionDocument;
import io.github.drompincen.worktrack.protocol.api.SessionStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface WorkSessionRepository extends MongoRepository<WorkSessionDocument, String> {
    Optional<WorkSessionDocument> findFirstByUserIdAndStatusInOrderByCheckInTimeDesc(String userId,
                                                                                    Collection<SessionStatus> statuses);
    List<WorkSessionDocument> findByUserIdOrderByCheckInTimeDesc(String userId);
    List<WorkSessionDocument> findByUpdatedAtGreaterThanOrderByUpdatedAtAsc(Instant since);
    List<WorkSessionDocument> findByStatusIn(Collection<SessionStatus> statuses);
}
