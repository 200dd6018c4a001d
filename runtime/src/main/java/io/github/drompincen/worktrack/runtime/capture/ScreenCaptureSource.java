package io.github.drompincen.worktrack.runtime.capture;

public interface ScreenCaptureSource {
    ScreenCaptureResult capture();
}
