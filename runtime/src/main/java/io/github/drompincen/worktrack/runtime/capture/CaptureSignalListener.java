package io.github.drompincen.worktrack.runtime.capture;

import io.github.drompincen.worktrack.protocol.event.CaptureSignal;

public interface CaptureSignalListener {
    void onSignal(CaptureSignal signal);
}
