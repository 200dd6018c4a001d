package io.github.drompincen.worktrack.runtime.capture;

public interface CameraCaptureSource {
    /** Returns a JPEG frame. */
    byte[] capture() throws CameraCaptureException;
}
