package io.github.drompincen.worktrack.gateway.controller;

import io.github.drompincen.worktrack.persistence.document.CaptureCommandDocument;
import io.github.drompincen.worktrack.persistence.repository.CaptureCommandRepository;
import io.github.drompincen.worktrack.protocol.api.CaptureCommandDto;
import io.github.drompincen.worktrack.protocol.api.CaptureType;
import io.github.drompincen.worktrack.protocol.api.CommandStatus;
import io.github.drompincen.worktrack.protocol.api.CreateCaptureCommandRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Manager-issued capture requests, picked up by the member's desktop agent. */
@RestController
@RequestMapping("/api/capture-commands")
public class CaptureCommandController {

    private static final Logger log = LoggerFactory.getLogger(CaptureCommandController.class);

    private final CaptureCommandRepository commandRepository;
    private final Clock clock;

    public CaptureCommandController(CaptureCommandRepository commandRepository, Clock clock) {
        this.commandRepository = commandRepository;
        this.clock = clock;
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestBody CreateCaptureCommandRequest req) {
        if (req == null || req.userId() == null || req.userId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "userId is required"));
        }
        CaptureCommandDocument doc = new CaptureCommandDocument();
        doc.setUserId(req.userId());
        doc.setType(req.type() != null ? req.type() : CaptureType.REMOTE);
        doc.setStatus(CommandStatus.PENDING);
        doc.setRequestedBy(req.requestedBy());
        doc.setRequestedAt(clock.instant());
        CaptureCommandDocument saved = commandRepository.save(doc);
        log.info("Capture command {} queued for {} by {}", saved.getId(), saved.getUserId(), saved.getRequestedBy());
        return ResponseEntity.ok(toDto(saved));
    }

    @GetMapping
    public List<CaptureCommandDto> list(@RequestParam String userId,
                                        @RequestParam(required = false) CommandStatus status) {
        List<CaptureCommandDocument> docs = status != null
                ? commandRepository.findByUserIdAndStatusOrderByRequestedAtAsc(userId, status)
                : commandRepository.findByUserIdOrderByRequestedAtDesc(userId);
        return docs.stream().map(this::toDto).collect(Collectors.toList());
    }

    private CaptureCommandDto toDto(CaptureCommandDocument d) {
        return new CaptureCommandDto(d.getId(), d.getUserId(), d.getType(), d.getStatus(),
                d.getRequestedBy(), d.getRequestedAt(), d.getCompletedAt());
    }
}
