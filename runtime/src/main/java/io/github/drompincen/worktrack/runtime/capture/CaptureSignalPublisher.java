package io.github.drompincen.worktrack.runtime.capture;

import io.github.drompincen.worktrack.protocol.api.CaptureType;
import io.github.drompincen.worktrack.protocol.event.CaptureSignal;
import io.github.drompincen.worktrack.protocol.event.CaptureSignalType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class CaptureSignalPublisher {

    private static final Logger log = LoggerFactory.getLogger(CaptureSignalPublisher.class);

    private final List<CaptureSignalListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(CaptureSignalListener listener) {
        listeners.add(listener);
    }

    public void removeListener(CaptureSignalListener listener) {
        listeners.remove(listener);
    }

    public void publish(CaptureSignal signal) {
        for (CaptureSignalListener listener : listeners) {
            try {
                listener.onSignal(signal);
            } catch (Exception e) {
                log.error("Capture signal listener failed on {}", signal.type(), e);
            }
        }
    }

    public void publish(CaptureSignalType type, CaptureType captureType, int remainingSeconds) {
        publish(CaptureSignal.of(type, captureType, remainingSeconds));
    }
}
