package io.github.drompincen.worktrack.protocol.event;

import io.github.drompincen.worktrack.protocol.api.CaptureType;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CaptureSignalTest {

    @Test
    void tickFactoryCarriesRemainingSeconds() {
        CaptureSignal signal = CaptureSignal.of(CaptureSignalType.COUNTDOWN_TICK, CaptureType.AUTO, 42);

        assertThat(signal.type()).isEqualTo(CaptureSignalType.COUNTDOWN_TICK);
        assertThat(signal.captureType()).isEqualTo(CaptureType.AUTO);
        assertThat(signal.remainingSeconds()).isEqualTo(42);
        assertThat(signal.detail()).isEmpty();
        assertThat(signal.timestamp()).isNotNull();
    }

    @Test
    void detailFactoryKeepsDetail() {
        CaptureSignal signal = CaptureSignal.of(CaptureSignalType.CAPTURE_COMPLETED, CaptureType.REMOTE,
                Map.of("flagged", true));

        assertThat(signal.detail()).containsEntry("flagged", true);
        assertThat(signal.remainingSeconds()).isZero();
    }
}
