package io.github.drompincen.worktrack.agent.lifecycle;

import io.github.drompincen.worktrack.runtime.capture.CaptureOrchestrator;
import io.github.drompincen.worktrack.runtime.guard.CrashCheckoutGuard;
import io.github.drompincen.worktrack.runtime.guard.GuardResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;

/** Runs the crash checkout when the agent process is asked to terminate. */
@Component
public class ShutdownGuard {

    private static final Logger log = LoggerFactory.getLogger(ShutdownGuard.class);

    private final CrashCheckoutGuard guard;
    private final CaptureOrchestrator orchestrator;

    public ShutdownGuard(CrashCheckoutGuard guard, CaptureOrchestrator orchestrator) {
        this.guard = guard;
        this.orchestrator = orchestrator;
    }

    @PreDestroy
    public void onShutdown() {
        orchestrator.shutdown();
        GuardResult result = guard.onTermination();
        if (result != GuardResult.NO_SESSION) {
            log.info("Shutdown checkout: {}", result);
        }
    }
}
