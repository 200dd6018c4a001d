package io.github.drompincen.worktrack.runtime.capture;

/**
 * Outcome of a screen grab. {@code permissionNeeded} is distinct from a plain failure:
 * the platform refused access and the user has to grant it.
 */
public record ScreenCaptureResult(byte[] jpeg, boolean permissionNeeded) {

    public static ScreenCaptureResult captured(byte[] jpeg) {
        return new ScreenCaptureResult(jpeg, false);
    }

    public static ScreenCaptureResult permissionDenied() {
        return new ScreenCaptureResult(null, true);
    }

    public static ScreenCaptureResult failed() {
        return new ScreenCaptureResult(null, false);
    }

    public boolean isPresent() {
        return jpeg != null && jpeg.length > 0;
    }
}
