package io.github.drompincen.worktrack.persistence.stream;

import io.github.drompincen.worktrack.persistence.document.WorkSessionDocument;
import com.mongodb.client.model.Aggregates;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.changestream.FullDocument;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Pushes every insert, update and replace on {@code work_logs} to registered listeners.
 * Falls back to polling on {@code updatedAt} when change streams are unavailable
 * (standalone mongod). {@code updatedAt} is stamped by each writer's own clock, so every poll
 * looks back {@link #CLOCK_SKEW_ALLOWANCE} past the previous one and skips documents it already
 * delivered. Delivery is at-least-once; listeners order notifications on {@code version}.
 */
@Component
public class WorkSessionChangeStreamTailer {

    private static final Logger log = LoggerFactory.getLogger(WorkSessionChangeStreamTailer.class);
    private static final long POLL_INTERVAL_MS = 500;
    static final Duration CLOCK_SKEW_ALLOWANCE = Duration.ofMinutes(2);

    private final MongoTemplate mongoTemplate;
    private final Clock clock;
    // Touched only by the tailer thread.
    private final Map<String, Delivered> delivered = new HashMap<>();
    private final List<WorkSessionListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "work-session-tailer");
        t.setDaemon(true);
        return t;
    });
    private volatile boolean running = false;
    private volatile Instant pollWatermark = Instant.EPOCH;

    @Autowired
    public WorkSessionChangeStreamTailer(MongoTemplate mongoTemplate) {
        this(mongoTemplate, Clock.systemUTC());
    }

    WorkSessionChangeStreamTailer(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    public void addListener(WorkSessionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(WorkSessionListener listener) {
        listeners.remove(listener);
    }

    @PostConstruct
    public void start() {
        if (running) return;
        running = true;
        pollWatermark = clock.instant();
        executor.submit(this::tailChangeStream);
        log.info("Work session tailer started");
    }

    @PreDestroy
    public void stop() {
        running = false;
        executor.shutdownNow();
        log.info("Work session tailer stopped");
    }

    private void tailChangeStream() {
        while (running) {
            try {
                doTail();
            } catch (Exception e) {
                if (running) {
                    log.warn("Change stream unavailable, falling back to polling: {}", e.getMessage());
                    pollFallback();
                }
            }
        }
    }

    private void doTail() {
        var collection = mongoTemplate.getDb().getCollection("work_logs");
        var stream = collection.watch(
                List.of(Aggregates.match(Filters.in("operationType", "insert", "update", "replace")))
        ).fullDocument(FullDocument.UPDATE_LOOKUP);

        try (var cursor = stream.iterator()) {
            while (running && cursor.hasNext()) {
                var change = cursor.next();
                Document fullDoc = change.getFullDocument();
                if (fullDoc != null) {
                    notifyListeners(mongoTemplate.getConverter().read(WorkSessionDocument.class, fullDoc));
                }
            }
        }
    }

    private void pollFallback() {
        log.info("Using polling fallback for work session changes");
        while (running) {
            try {
                pollWatermark = pollOnce(pollWatermark);
                Thread.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Polling fallback error", e);
                try { Thread.sleep(1000); } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    /**
     * Delivers every session written since {@code since} minus the skew allowance that was not
     * delivered before; returns the poll's start time as the next watermark.
     */
    Instant pollOnce(Instant since) {
        Instant startedAt = clock.instant();
        Instant from = since.minus(CLOCK_SKEW_ALLOWANCE);
        var sessions = mongoTemplate.find(
                Query.query(Criteria.where("updatedAt").gt(from)).with(Sort.by("updatedAt")),
                WorkSessionDocument.class);
        for (WorkSessionDocument session : sessions) {
            Delivered mark = new Delivered(session.getVersion(), session.getUpdatedAt());
            if (mark.equals(delivered.put(session.getId(), mark))) continue;
            notifyListeners(session);
        }
        delivered.values().removeIf(d -> d.updatedAt() == null || !d.updatedAt().isAfter(from));
        return startedAt.isAfter(since) ? startedAt : since;
    }

    void notifyListeners(WorkSessionDocument session) {
        for (WorkSessionListener listener : listeners) {
            try {
                listener.onSessionChanged(session);
            } catch (Exception e) {
                log.error("Listener error for session {}", session.getId(), e);
                listener.onError(e);
            }
        }
    }

    private record Delivered(Long version, Instant updatedAt) {}
}
