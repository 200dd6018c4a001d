package io.github.drompincen.worktrack.runtime.capture;

public class CameraCaptureException extends Exception {

    private final CameraFailure failure;

    public CameraCaptureException(CameraFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public CameraCaptureException(CameraFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public CameraFailure getFailure() {
        return failure;
    }
}
