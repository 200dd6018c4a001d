package io.github.drompincen.worktrack.runtime.host;

import io.github.drompincen.worktrack.runtime.session.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingDesktopNotifier implements DesktopNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingDesktopNotifier.class);

    @Override
    public void notify(String title, String body) {
        log.info("[notice] {}: {}", title, body);
    }

    @Override
    public void updateStatus(SessionState state) {
        log.info("[status] {}", state);
    }
}
