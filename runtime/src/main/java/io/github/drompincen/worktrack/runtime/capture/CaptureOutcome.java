package io.github.drompincen.worktrack.runtime.capture;

import io.github.drompincen.worktrack.protocol.api.CaptureType;

public record CaptureOutcome(
        boolean skipped,
        String skipReason,
        CaptureType type,
        String screenshotUrl,
        String cameraImageUrl,
        boolean flagged,
        String flagReason,
        boolean permissionNeeded,
        String evidenceId
) {
    public static CaptureOutcome skipped(String reason) {
        return new CaptureOutcome(true, reason, null, null, null, false, null, false, null);
    }
}
