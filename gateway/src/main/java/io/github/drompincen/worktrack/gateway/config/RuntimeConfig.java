package io.github.drompincen.worktrack.gateway.config;

import io.github.drompincen.worktrack.persistence.document.WorkSessionDocument;
import io.github.drompincen.worktrack.persistence.repository.MemberPresenceRepository;
import io.github.drompincen.worktrack.persistence.repository.WorkSessionRepository;
import io.github.drompincen.worktrack.persistence.stream.WorkSessionChangeStreamTailer;
import io.github.drompincen.worktrack.protocol.api.SessionStatus;
import io.github.drompincen.worktrack.runtime.liveness.AgentControlClient;
import io.github.drompincen.worktrack.runtime.liveness.HeartbeatMonitor;
import io.github.drompincen.worktrack.runtime.liveness.LaunchHandshake;
import io.github.drompincen.worktrack.runtime.liveness.SessionRemediationService;
import io.github.drompincen.worktrack.runtime.timer.ScheduledTimerService;
import io.github.drompincen.worktrack.runtime.timer.TimerService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;

/**
 * Dashboard-side runtime: the liveness monitor fed by the work-session tailer, and the
 * remediation actions offered for stale desktop sessions.
 */
@Configuration
public class RuntimeConfig {

    private static final Logger log = LoggerFactory.getLogger(RuntimeConfig.class);

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    TimerService timerService(Clock clock) {
        return new ScheduledTimerService(clock);
    }

    @Bean(destroyMethod = "stop")
    HeartbeatMonitor heartbeatMonitor(TimerService timers, Clock clock,
                                      WorkSessionChangeStreamTailer tailer,
                                      WorkSessionRepository sessionRepository,
                                      @Value("${worktrack.heartbeat.stale-after-seconds:120}") long staleAfter,
                                      @Value("${worktrack.heartbeat.poll-seconds:30}") long poll) {
        HeartbeatMonitor monitor = new HeartbeatMonitor(timers, clock,
                Duration.ofSeconds(staleAfter), Duration.ofSeconds(poll));
        List<WorkSessionDocument> open = sessionRepository.findByStatusIn(
                EnumSet.of(SessionStatus.ACTIVE, SessionStatus.BREAK));
        open.forEach(monitor::watch);
        log.info("Watching {} open sessions for liveness", open.size());
        tailer.addListener(monitor);
        monitor.start();
        return monitor;
    }

    @Bean
    AgentControlClient agentControlClient(@Value("${worktrack.agent.url:http://127.0.0.1:59210}") String agentUrl,
                                          ObjectMapper objectMapper) {
        return new AgentControlClient(agentUrl, objectMapper);
    }

    @Bean
    LaunchHandshake launchHandshake() {
        return new LaunchHandshake();
    }

    @Bean
    SessionRemediationService sessionRemediationService(WorkSessionRepository sessionRepository,
                                                        MemberPresenceRepository presenceRepository,
                                                        AgentControlClient agentClient,
                                                        LaunchHandshake handshake,
                                                        TimerService timers,
                                                        Clock clock) {
        return new SessionRemediationService(sessionRepository, presenceRepository, agentClient,
                handshake, timers, clock);
    }
}
