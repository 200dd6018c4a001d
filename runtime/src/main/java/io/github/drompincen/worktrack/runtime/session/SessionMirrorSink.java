package io.github.drompincen.worktrack.runtime.session;

import io.github.drompincen.worktrack.protocol.api.SessionMirror;

@FunctionalInterface
public interface SessionMirrorSink {
    /** Receives the current session identity, or null when no session is open. */
    void sync(SessionMirror mirror);
}
