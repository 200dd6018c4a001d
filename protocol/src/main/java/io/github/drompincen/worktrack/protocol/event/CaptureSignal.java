package io.github.drompincen.worktrack.protocol.event;

import io.github.drompincen.worktrack.protocol.api.CaptureType;

import java.time.Instant;
import java.util.Map;

public record CaptureSignal(
        CaptureSignalType type,
        CaptureType captureType,
        int remainingSeconds,
        Map<String, Object> detail,
        Instant timestamp
) {
    public static CaptureSignal of(CaptureSignalType type, CaptureType captureType, int remainingSeconds) {
        return new CaptureSignal(type, captureType, remainingSeconds, Map.of(), Instant.now());
    }

    public static CaptureSignal of(CaptureSignalType type, CaptureType captureType, Map<String, Object> detail) {
        return new CaptureSignal(type, captureType, 0, detail, Instant.now());
    }
}
