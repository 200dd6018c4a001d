package io.github.drompincen.worktrack.runtime.host;

import io.github.drompincen.worktrack.runtime.session.SessionState;

/** Host-process surface for user-facing notices. */
public interface DesktopNotifier {

    void notify(String title, String body);

    void updateStatus(SessionState state);
}
