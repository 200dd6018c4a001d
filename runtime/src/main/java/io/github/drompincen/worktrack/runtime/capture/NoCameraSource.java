package io.github.drompincen.worktrack.runtime.capture;

/** Used on hosts without a camera driver; every attempt falls back to the placeholder frame. */
public class NoCameraSource implements CameraCaptureSource {

    @Override
    public byte[] capture() throws CameraCaptureException {
        throw new CameraCaptureException(CameraFailure.NOT_FOUND, "No camera device configured");
    }
}
