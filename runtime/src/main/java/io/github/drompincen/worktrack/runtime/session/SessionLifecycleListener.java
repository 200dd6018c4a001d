package io.github.drompincen.worktrack.runtime.session;

import io.github.drompincen.worktrack.persistence.document.WorkSessionDocument;

public interface SessionLifecycleListener {
    /** {@code session} is null once nothing is tracked. */
    void onSessionStateChanged(SessionState state, WorkSessionDocument session);
}
