package io.github.drompincen.worktrack.gateway.controller;

import io.github.drompincen.worktrack.persistence.document.MemberPresenceDocument;
import io.github.drompincen.worktrack.persistence.document.WorkSessionDocument;
import io.github.drompincen.worktrack.protocol.api.EmergencyCheckoutRequest;
import io.github.drompincen.worktrack.protocol.api.PresenceUpdateRequest;
import io.github.drompincen.worktrack.protocol.api.SessionStatus;
import com.mongodb.client.result.UpdateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Direct store writes for the agent's shutdown path. Each is a single conditional update so
 * it can complete inside the agent's short request timeouts.
 */
@RestController
@RequestMapping("/api/store")
public class StoreController {

    private static final Logger log = LoggerFactory.getLogger(StoreController.class);

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public StoreController(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    @PatchMapping("/work-sessions/{id}/emergency-checkout")
    public ResponseEntity<?> emergencyCheckout(@PathVariable String id, @RequestBody EmergencyCheckoutRequest req) {
        Instant now = clock.instant();
        Query open = new Query(Criteria.where("_id").is(id)
                .and("status").in(SessionStatus.ACTIVE, SessionStatus.BREAK));
        Update update = new Update()
                .set("status", SessionStatus.COMPLETED)
                .set("checkOutTime", req.checkOutTime() != null ? req.checkOutTime() : now)
                .set("durationMinutes", req.durationMinutes())
                .set("breakDurationMinutes", req.breakDurationMinutes())
                .set("report", req.report())
                .set("attachments", List.of())
                .set("flagged", true)
                .set("flagReason", req.flagReason())
                .set("updatedAt", now)
                .inc("version", 1)
                .unset("openFor");
        UpdateResult result = mongoTemplate.updateFirst(open, update, WorkSessionDocument.class);
        if (result.getMatchedCount() == 0) {
            log.info("Emergency checkout of {} matched no open session", id);
            return ResponseEntity.notFound().build();
        }
        log.warn("Emergency checkout of {} recorded ({} min, {})", id, req.durationMinutes(), req.flagReason());
        return ResponseEntity.ok(Map.of("ok", true));
    }

    @PatchMapping("/presence/{userId}")
    public ResponseEntity<?> presence(@PathVariable String userId, @RequestBody PresenceUpdateRequest req) {
        Instant lastActive = req.lastActive() != null ? req.lastActive() : clock.instant();
        mongoTemplate.save(new MemberPresenceDocument(userId, req.online(), lastActive));
        return ResponseEntity.ok(Map.of("ok", true));
    }
}
