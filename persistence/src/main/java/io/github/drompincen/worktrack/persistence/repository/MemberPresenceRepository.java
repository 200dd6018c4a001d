package io.github.drompincen.worktrack.persistence.repository;

import io.github.drompincen.worktrack.persistence.document.MemberPresenceDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface MemberPresenceRepository extends MongoRepository<MemberPresenceDocument, String> {
    List<MemberPresenceDocument> findByOnlineTrue();
}
