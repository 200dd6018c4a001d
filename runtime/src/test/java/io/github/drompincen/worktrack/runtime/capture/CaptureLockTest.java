package io.github.drompincen.worktrack.runtime.capture;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class CaptureLockTest {

    @Test
    void secondAcquireFailsWhileHeld() {
        CaptureLock lock = new CaptureLock();

        Optional<String> first = lock.tryAcquire();
        Optional<String> second = lock.tryAcquire();

        assertThat(first).isPresent();
        assertThat(second).isEmpty();
        assertThat(lock.isHeld()).isTrue();
    }

    @Test
    void releaseRequiresOwningToken() {
        CaptureLock lock = new CaptureLock();
        String token = lock.tryAcquire().orElseThrow();

        assertThat(lock.release("someone-else")).isFalse();
        assertThat(lock.isHeld()).isTrue();
        assertThat(lock.release(token)).isTrue();
        assertThat(lock.isHeld()).isFalse();
    }

    @Test
    void staleTokenCannotReleaseLockTakenAfterForceRelease() {
        CaptureLock lock = new CaptureLock();
        String stale = lock.tryAcquire().orElseThrow();
        lock.forceRelease();
        lock.tryAcquire().orElseThrow();

        assertThat(lock.release(stale)).isFalse();
        assertThat(lock.isHeld()).isTrue();
    }
}
