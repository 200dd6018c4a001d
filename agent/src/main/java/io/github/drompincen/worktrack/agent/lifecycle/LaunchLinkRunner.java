package io.github.drompincen.worktrack.agent.lifecycle;

import io.github.drompincen.worktrack.runtime.liveness.LaunchHandshake;
import io.github.drompincen.worktrack.runtime.liveness.LaunchRequest;
import io.github.drompincen.worktrack.runtime.session.CheckInResult;
import io.github.drompincen.worktrack.runtime.session.MemberIdentity;
import io.github.drompincen.worktrack.runtime.session.SessionLifecycleService;
import io.github.drompincen.worktrack.runtime.session.SessionTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Consumes a {@code worktrack://checkin?...} link passed on the command line, which is how
 * the dashboard relaunches an agent that stopped answering. The link is used once.
 */
@Component
public class LaunchLinkRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(LaunchLinkRunner.class);

    private final SessionLifecycleService sessions;

    public LaunchLinkRunner(SessionLifecycleService sessions) {
        this.sessions = sessions;
    }

    @Override
    public void run(ApplicationArguments args) {
        for (String arg : args.getSourceArgs()) {
            Optional<LaunchRequest> link = LaunchHandshake.parse(arg);
            if (link.isPresent()) {
                consume(link.get());
                return;
            }
        }
    }

    void consume(LaunchRequest request) {
        if (request.credential() == null || request.userId() == null) {
            log.warn("Launch link without credential or userId ignored");
            return;
        }
        sessions.signIn(new MemberIdentity(request.userId(), request.name(), request.credential()));
        try {
            CheckInResult result = sessions.resumeOrCheckIn();
            log.info("Launch link {} session {} for {}", result.resumed() ? "resumed" : "opened",
                    result.session().getId(), request.userId());
        } catch (SessionTransitionException e) {
            log.warn("Launch link check-in for {} refused: {}", request.userId(), e.getMessage());
        }
    }
}
