package io.github.drompincen.worktrack.runtime.session;

import io.github.drompincen.worktrack.persistence.document.WorkSessionDocument;

public record CheckInResult(WorkSessionDocument session, boolean resumed) {}
