package io.github.drompincen.worktrack.runtime.capture;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Non-reentrant, owner-token mutex around the capture pipeline. A holder releases with the
 * token it acquired, so a torn-down pipeline cannot clear a lock taken after a force release.
 */
public class CaptureLock {

    private final AtomicReference<String> owner = new AtomicReference<>();

    public Optional<String> tryAcquire() {
        String token = UUID.randomUUID().toString();
        return owner.compareAndSet(null, token) ? Optional.of(token) : Optional.empty();
    }

    public boolean release(String token) {
        return owner.compareAndSet(token, null);
    }

    public void forceRelease() {
        owner.set(null);
    }

    public boolean isHeld() {
        return owner.get() != null;
    }
}
