package io.github.drompincen.worktrack.persistence.stream;

import io.github.drompincen.worktrack.persistence.document.WorkSessionDocument;

public interface WorkSessionListener {
    void onSessionChanged(WorkSessionDocument session);

    default void onError(Throwable error) {}
}
