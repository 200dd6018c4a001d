package io.github.drompincen.worktrack.runtime.capture;

import java.util.EnumSet;
import java.util.Set;

public enum CameraFailure {
    IN_USE,
    NOT_READABLE,
    ABORTED,
    TIMEOUT,
    NOT_FOUND,
    PERMISSION_DENIED,
    UNKNOWN;

    private static final Set<CameraFailure> DEVICE_BUSY =
            EnumSet.of(IN_USE, NOT_READABLE, ABORTED, TIMEOUT, NOT_FOUND);

    /** Busy failures are replaced by a placeholder frame instead of failing the artifact. */
    public boolean isDeviceBusy() {
        return DEVICE_BUSY.contains(this);
    }
}
