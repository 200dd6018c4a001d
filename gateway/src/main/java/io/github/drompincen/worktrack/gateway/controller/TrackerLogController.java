package io.github.drompincen.worktrack.gateway.controller;

import io.github.drompincen.worktrack.persistence.document.TrackerLogDocument;
import io.github.drompincen.worktrack.persistence.repository.TrackerLogRepository;
import io.github.drompincen.worktrack.protocol.api.TrackerLogDto;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/tracker-logs")
public class TrackerLogController {

    private final TrackerLogRepository trackerLogRepository;

    public TrackerLogController(TrackerLogRepository trackerLogRepository) {
        this.trackerLogRepository = trackerLogRepository;
    }

    @GetMapping
    public List<TrackerLogDto> list(@RequestParam String userId) {
        return trackerLogRepository.findByUserIdOrderByTimestampDesc(userId).stream()
                .map(this::toDto).collect(Collectors.toList());
    }

    private TrackerLogDto toDto(TrackerLogDocument d) {
        return new TrackerLogDto(d.getId(), d.getUserId(), d.getUserDisplayName(), d.getScreenshotUrl(),
                d.getCameraImageUrl(), d.getType(), d.isFlagged(), d.getFlagReason(), d.getSource(),
                d.getTimestamp());
    }
}
