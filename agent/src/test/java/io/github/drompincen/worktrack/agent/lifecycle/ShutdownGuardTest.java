package io.github.drompincen.worktrack.agent.lifecycle;

import io.github.drompincen.worktrack.runtime.capture.CaptureOrchestrator;
import io.github.drompincen.worktrack.runtime.guard.CrashCheckoutGuard;
import io.github.drompincen.worktrack.runtime.guard.GuardResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ShutdownGuardTest {

    @Mock private CrashCheckoutGuard guard;
    @Mock private CaptureOrchestrator orchestrator;
    @InjectMocks private ShutdownGuard shutdownGuard;

    @Test
    void stopsCapturesThenRunsEmergencyCheckout() {
        when(guard.onTermination()).thenReturn(GuardResult.COMPLETED);

        shutdownGuard.onShutdown();

        InOrder order = inOrder(orchestrator, guard);
        order.verify(orchestrator).shutdown();
        order.verify(guard).onTermination();
    }
}
