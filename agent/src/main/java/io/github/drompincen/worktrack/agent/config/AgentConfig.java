package io.github.drompincen.worktrack.agent.config;

import io.github.drompincen.worktrack.persistence.repository.CaptureCommandRepository;
import io.github.drompincen.worktrack.persistence.repository.MemberPresenceRepository;
import io.github.drompincen.worktrack.persistence.repository.TrackerLogRepository;
import io.github.drompincen.worktrack.persistence.repository.WorkSessionRepository;
import io.github.drompincen.worktrack.persistence.stream.WorkSessionChangeStreamTailer;
import io.github.drompincen.worktrack.protocol.api.SessionSource;
import io.github.drompincen.worktrack.protocol.event.CaptureSignalType;
import io.github.drompincen.worktrack.runtime.capture.AutoCaptureScheduler;
import io.github.drompincen.worktrack.runtime.capture.AwtScreenCaptureSource;
import io.github.drompincen.worktrack.runtime.capture.CaptureOrchestrator;
import io.github.drompincen.worktrack.runtime.capture.CapturePipeline;
import io.github.drompincen.worktrack.runtime.capture.CaptureSettings;
import io.github.drompincen.worktrack.runtime.capture.CaptureSignalPublisher;
import io.github.drompincen.worktrack.runtime.capture.CountdownProtocol;
import io.github.drompincen.worktrack.runtime.capture.EvidenceStorage;
import io.github.drompincen.worktrack.runtime.capture.NoCameraSource;
import io.github.drompincen.worktrack.runtime.capture.ObjectStoreEvidenceStorage;
import io.github.drompincen.worktrack.runtime.capture.PlaceholderImageRenderer;
import io.github.drompincen.worktrack.runtime.capture.RemoteCommandPoller;
import io.github.drompincen.worktrack.runtime.guard.CrashCheckoutGuard;
import io.github.drompincen.worktrack.runtime.guard.EmergencyCheckoutTransport;
import io.github.drompincen.worktrack.runtime.host.DesktopNotifier;
import io.github.drompincen.worktrack.runtime.host.LoggingDesktopNotifier;
import io.github.drompincen.worktrack.runtime.liveness.HeartbeatPublisher;
import io.github.drompincen.worktrack.runtime.session.SessionLifecycleService;
import io.github.drompincen.worktrack.runtime.timer.ScheduledTimerService;
import io.github.drompincen.worktrack.runtime.timer.TimerService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the desktop agent: the session controller for this member, and everything that
 * follows its state (capture orchestrator, heartbeat publisher, crash guard, notifier).
 */
@Configuration
public class AgentConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    TimerService timerService(Clock clock) {
        return new ScheduledTimerService(clock);
    }

    @Bean
    CaptureSettings captureSettings(
            @Value("${worktrack.capture.countdown-seconds:60}") int countdownSeconds,
            @Value("${worktrack.capture.first-delay-min-seconds:180}") long firstMin,
            @Value("${worktrack.capture.first-delay-max-seconds:300}") long firstMax,
            @Value("${worktrack.capture.cooldown-seconds:120}") long cooldown,
            @Value("${worktrack.capture.jitter-min-seconds:600}") long jitterMin,
            @Value("${worktrack.capture.jitter-max-seconds:1800}") long jitterMax,
            @Value("${worktrack.capture.poll-initial-delay-seconds:5}") long pollInitial,
            @Value("${worktrack.capture.poll-interval-seconds:15}") long pollInterval) {
        return new CaptureSettings(countdownSeconds,
                Duration.ofSeconds(firstMin), Duration.ofSeconds(firstMax),
                Duration.ofSeconds(cooldown),
                Duration.ofSeconds(jitterMin), Duration.ofSeconds(jitterMax),
                Duration.ofSeconds(pollInitial), Duration.ofSeconds(pollInterval));
    }

    @Bean
    DesktopNotifier desktopNotifier() {
        return new LoggingDesktopNotifier();
    }

    @Bean
    SessionLifecycleService sessionLifecycleService(WorkSessionRepository sessionRepository,
                                                    MemberPresenceRepository presenceRepository,
                                                    WorkSessionChangeStreamTailer tailer,
                                                    DesktopNotifier notifier,
                                                    Clock clock) {
        SessionLifecycleService sessions = new SessionLifecycleService(sessionRepository, presenceRepository,
                SessionSource.DESKTOP, clock);
        sessions.addListener((state, session) -> notifier.updateStatus(state));
        tailer.addListener(sessions);
        return sessions;
    }

    @Bean
    CaptureSignalPublisher captureSignalPublisher(DesktopNotifier notifier) {
        CaptureSignalPublisher signals = new CaptureSignalPublisher();
        signals.addListener(signal -> {
            if (signal.type() == CaptureSignalType.COUNTDOWN_STARTED) {
                notifier.notify("Capture starting", "Screen and camera capture in "
                        + signal.remainingSeconds() + " seconds");
            }
        });
        return signals;
    }

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService captureIoExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "capture-io-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    EvidenceStorage evidenceStorage(@Value("${worktrack.storage.url}") String url,
                                    @Value("${worktrack.storage.bucket:tracker}") String bucket,
                                    @Value("${worktrack.storage.api-key:}") String apiKey,
                                    @Value("${worktrack.storage.timeout-seconds:30}") long timeout,
                                    Clock clock) {
        return new ObjectStoreEvidenceStorage(url, bucket, apiKey, Duration.ofSeconds(timeout), clock);
    }

    @Bean
    CapturePipeline capturePipeline(CaptureSettings settings,
                                    CaptureSignalPublisher signals,
                                    EvidenceStorage storage,
                                    TrackerLogRepository trackerLogRepository,
                                    DesktopNotifier notifier,
                                    ExecutorService captureIoExecutor,
                                    Clock clock) {
        return new CapturePipeline(new CountdownProtocol(signals, settings.countdownSeconds()),
                new AwtScreenCaptureSource(), new NoCameraSource(), new PlaceholderImageRenderer(clock),
                storage, trackerLogRepository, signals, notifier, captureIoExecutor, clock);
    }

    @Bean
    CaptureOrchestrator captureOrchestrator(CapturePipeline pipeline,
                                            CaptureSettings settings,
                                            CaptureCommandRepository commandRepository,
                                            SessionLifecycleService sessions,
                                            CaptureSignalPublisher signals,
                                            TimerService timers,
                                            Clock clock) {
        CaptureOrchestrator orchestrator = new CaptureOrchestrator(pipeline,
                new AutoCaptureScheduler(timers, settings, new SecureRandom(), clock),
                new RemoteCommandPoller(commandRepository, timers, settings, clock),
                sessions, signals, clock);
        sessions.addListener(orchestrator);
        return orchestrator;
    }

    @Bean
    HeartbeatPublisher heartbeatPublisher(MongoTemplate mongoTemplate,
                                          TimerService timers,
                                          SessionLifecycleService sessions,
                                          @Value("${worktrack.heartbeat.interval-seconds:30}") long interval,
                                          Clock clock) {
        HeartbeatPublisher publisher = new HeartbeatPublisher(mongoTemplate, timers, Duration.ofSeconds(interval), clock);
        sessions.addListener(publisher);
        return publisher;
    }

    @Bean
    CrashCheckoutGuard crashCheckoutGuard(@Value("${worktrack.gateway.url:http://localhost:8080}") String gatewayUrl,
                                          ObjectMapper objectMapper,
                                          SessionLifecycleService sessions,
                                          Clock clock) {
        CrashCheckoutGuard guard = new CrashCheckoutGuard(new EmergencyCheckoutTransport(gatewayUrl, objectMapper), clock);
        sessions.setMirrorSink(guard);
        return guard;
    }
}
