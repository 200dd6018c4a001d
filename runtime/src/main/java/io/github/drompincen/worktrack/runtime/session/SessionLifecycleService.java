package io.github.drompincen.worktrack.runtime.session;

import io.github.drompincen.worktrack.persistence.document.MemberPresenceDocument;
import io.github.drompincen.worktrack.persistence.document.WorkSessionDocument;
import io.github.drompincen.worktrack.persistence.document.WorkSessionDocument.BreakEntry;
import io.github.drompincen.worktrack.persistence.repository.MemberPresenceRepository;
import io.github.drompincen.worktrack.persistence.repository.WorkSessionRepository;
import io.github.drompincen.worktrack.persistence.stream.WorkSessionListener;
import io.github.drompincen.worktrack.protocol.api.SessionMirror;
import io.github.drompincen.worktrack.protocol.api.SessionSource;
import io.github.drompincen.worktrack.protocol.api.SessionStatus;
import io.github.drompincen.worktrack.runtime.session.SessionTransitionException.Failure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Local view of one member's work session: checked in, on break, or out.
 *
 * <p>Intents become document writes through the repository. Each write is built on a copy of
 * the tracked document and becomes local state only once the store accepted it. Change
 * notifications from the store are applied on top of local state and win over it, so a checkout
 * written by the other process (or a force close) ends the session here too. Notifications are
 * ordered on the document {@code version}, never on writer clocks. Every transition is pushed to
 * the lifecycle listeners and to the crash-guard mirror.
 */
public class SessionLifecycleService implements WorkSessionListener {

    private static final Logger log = LoggerFactory.getLogger(SessionLifecycleService.class);
    private static final List<SessionStatus> OPEN_STATUSES = List.of(SessionStatus.ACTIVE, SessionStatus.BREAK);
    static final int CLOSED_SESSIONS_REMEMBERED = 16;

    private final WorkSessionRepository sessionRepository;
    private final MemberPresenceRepository presenceRepository;
    private final SessionSource source;
    private final Clock clock;
    private final List<SessionLifecycleListener> listeners = new CopyOnWriteArrayList<>();
    // Recently closed ids, so late echoes of them are not adopted again.
    private final Set<String> closedSessionIds = Collections.newSetFromMap(new LinkedHashMap<String, Boolean>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
            return size() > CLOSED_SESSIONS_REMEMBERED;
        }
    });

    private volatile SessionMirrorSink mirrorSink = mirror -> {};
    private volatile MemberIdentity identity;
    private volatile SessionState state = SessionState.NO_SESSION;
    private volatile WorkSessionDocument current;
    private Long lastAppliedVersion;

    public SessionLifecycleService(WorkSessionRepository sessionRepository,
                                   MemberPresenceRepository presenceRepository,
                                   SessionSource source,
                                   Clock clock) {
        this.sessionRepository = sessionRepository;
        this.presenceRepository = presenceRepository;
        this.source = source;
        this.clock = clock;
    }

    public void addListener(SessionLifecycleListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SessionLifecycleListener listener) {
        listeners.remove(listener);
    }

    public void setMirrorSink(SessionMirrorSink mirrorSink) {
        this.mirrorSink = mirrorSink != null ? mirrorSink : mirror -> {};
    }

    public synchronized void signIn(MemberIdentity member) {
        if (identity != null && !identity.userId().equals(member.userId())) {
            if (current != null) {
                log.warn("Switching member from {} to {} while session {} is tracked",
                        identity.userId(), member.userId(), current.getId());
                clearCurrent(SessionState.NO_SESSION);
            }
            closedSessionIds.clear();
        }
        this.identity = member;
        pushMirror();
    }

    public synchronized void refreshCredential(String credential) {
        if (identity == null) {
            throw new IllegalStateException("No signed-in member");
        }
        identity = identity.withCredential(credential);
        pushMirror();
        log.debug("Credential refreshed for {}", identity.userId());
    }

    public synchronized WorkSessionDocument checkIn() {
        MemberIdentity member = requireIdentity();
        if (state.isOpen()) {
            throw new SessionTransitionException(Failure.ALREADY_CHECKED_IN);
        }
        Instant now = clock.instant();
        WorkSessionDocument session = new WorkSessionDocument();
        session.setUserId(member.userId());
        session.setUserDisplayName(member.displayName());
        session.setCheckInTime(now);
        session.setStatus(SessionStatus.ACTIVE);
        session.setSource(source);
        session.setBreaks(new ArrayList<>());
        session.setOpenFor(member.userId());
        session.setUpdatedAt(now);
        if (source == SessionSource.DESKTOP) {
            session.setLastHeartbeat(now);
        }

        WorkSessionDocument saved;
        try {
            saved = sessionRepository.save(session);
        } catch (DuplicateKeyException e) {
            log.warn("Check-in for {} lost to an open session written elsewhere", member.userId());
            throw new SessionTransitionException(Failure.ALREADY_CHECKED_IN, e);
        }
        track(saved);
        markPresence(member.userId(), true, now);
        log.info("Checked in {} as session {} from {}", member.userId(), saved.getId(), source);
        publish();
        return saved;
    }

    /** Adopts the member's open session if the store has one, otherwise checks in. */
    public synchronized CheckInResult resumeOrCheckIn() {
        MemberIdentity member = requireIdentity();
        if (state.isOpen() && current != null) {
            return new CheckInResult(current, true);
        }
        Optional<WorkSessionDocument> existing =
                sessionRepository.findFirstByUserIdAndStatusInOrderByCheckInTimeDesc(member.userId(), OPEN_STATUSES);
        if (existing.isPresent()) {
            track(existing.get());
            log.info("Resumed open session {} for {} ({})", current.getId(), member.userId(), state);
            publish();
            return new CheckInResult(current, true);
        }
        return new CheckInResult(checkIn(), false);
    }

    public synchronized WorkSessionDocument startBreak() {
        if (state != SessionState.ACTIVE || current == null) {
            throw new SessionTransitionException(Failure.NO_ACTIVE_SESSION);
        }
        Instant now = clock.instant();
        WorkSessionDocument session = current.copy();
        session.getBreaks().add(new BreakEntry(now));
        session.setStatus(SessionStatus.BREAK);
        session.setUpdatedAt(now);
        track(write(session));
        log.info("Break started on session {}", current.getId());
        publish();
        return current;
    }

    public synchronized WorkSessionDocument resumeWork() {
        if (state != SessionState.ON_BREAK || current == null) {
            throw new SessionTransitionException(Failure.NO_ACTIVE_SESSION);
        }
        WorkSessionDocument session = current.copy();
        BreakEntry open = SessionDurations.openBreak(session.getBreaks());
        if (open == null) {
            log.warn("Session {} is on break without an open break entry", session.getId());
            throw new SessionTransitionException(Failure.NO_OPEN_BREAK);
        }
        Instant now = clock.instant();
        SessionDurations.closeBreak(open, now);
        session.setStatus(SessionStatus.ACTIVE);
        session.setUpdatedAt(now);
        track(write(session));
        log.info("Work resumed on session {} after {} min break", current.getId(), open.getDurationMinutes());
        publish();
        return current;
    }

    public synchronized WorkSessionDocument checkOut(String report, String proofLink) {
        if (!state.isOpen() || current == null) {
            throw new SessionTransitionException(Failure.NO_ACTIVE_SESSION);
        }
        Instant now = clock.instant();
        WorkSessionDocument session = current.copy();
        BreakEntry open = SessionDurations.openBreak(session.getBreaks());
        if (open != null) {
            SessionDurations.closeBreak(open, now);
        }
        SessionDurations.Totals totals = SessionDurations.totals(session.getCheckInTime(), now,
                SessionDurations.closedBreakSeconds(session.getBreaks()));

        session.setCheckOutTime(now);
        session.setStatus(SessionStatus.COMPLETED);
        session.setDurationMinutes(totals.durationMinutes());
        session.setBreakDurationMinutes(totals.breakDurationMinutes());
        session.setReport(report);
        session.setAttachments(proofLink == null || proofLink.isBlank() ? List.of() : List.of(proofLink));
        session.setOpenFor(null);
        session.setUpdatedAt(now);

        WorkSessionDocument saved = write(session);
        closedSessionIds.add(saved.getId());
        markPresence(saved.getUserId(), false, now);
        log.info("Checked out session {}: {} min worked, {} min break",
                saved.getId(), totals.durationMinutes(), totals.breakDurationMinutes());
        clearCurrent(SessionState.COMPLETED);
        return saved;
    }

    /** Re-reads the tracked session and applies it as a remote change. */
    public synchronized void sync() {
        WorkSessionDocument tracked = current;
        if (tracked == null) {
            if (identity != null) {
                sessionRepository.findFirstByUserIdAndStatusInOrderByCheckInTimeDesc(identity.userId(), OPEN_STATUSES)
                        .ifPresent(this::onSessionChanged);
            }
            return;
        }
        Optional<WorkSessionDocument> fresh = sessionRepository.findById(tracked.getId());
        if (fresh.isEmpty()) {
            log.warn("Tracked session {} no longer exists", tracked.getId());
            clearCurrent(SessionState.NO_SESSION);
            return;
        }
        onSessionChanged(fresh.get());
    }

    @Override
    public synchronized void onSessionChanged(WorkSessionDocument remote) {
        MemberIdentity member = identity;
        if (member == null || !member.userId().equals(remote.getUserId())) return;

        WorkSessionDocument tracked = current;
        if (tracked != null && Objects.equals(tracked.getId(), remote.getId())) {
            // Completion is terminal, whatever order it arrives in.
            if (remote.getStatus() == SessionStatus.COMPLETED) {
                closedSessionIds.add(remote.getId());
                log.info("Session {} completed remotely{}", remote.getId(),
                        remote.isFlagged() ? " (" + remote.getFlagReason() + ")" : "");
                clearCurrent(SessionState.COMPLETED);
                return;
            }
            if (isOlderThanApplied(remote)) {
                log.debug("Ignoring stale notification for session {} (version {} < {})",
                        remote.getId(), remote.getVersion(), lastAppliedVersion);
                return;
            }
            SessionState previous = state;
            track(remote);
            if (state != previous) {
                log.info("Session {} moved {} -> {} remotely", remote.getId(), previous, state);
                publish();
            } else {
                pushMirror();
            }
            return;
        }

        if (tracked == null && remote.getStatus() != null && remote.getStatus().isOpen()
                && !closedSessionIds.contains(remote.getId())) {
            track(remote);
            log.info("Adopted session {} opened by {}", remote.getId(), remote.getSource());
            publish();
        }
    }

    public SessionState getState() {
        return state;
    }

    public Optional<WorkSessionDocument> currentSession() {
        return Optional.ofNullable(current);
    }

    public Optional<MemberIdentity> identity() {
        return Optional.ofNullable(identity);
    }

    public SessionSource getSource() {
        return source;
    }

    private MemberIdentity requireIdentity() {
        MemberIdentity member = identity;
        if (member == null) {
            throw new IllegalStateException("No signed-in member");
        }
        return member;
    }

    /** Number of closed session ids kept to recognise late echoes. */
    int closedSessionsRemembered() {
        return closedSessionIds.size();
    }

    /**
     * Saves a transition built on a copy of the tracked session. When another process wrote the
     * session first, the store's copy is applied and the intent is reported as a conflict.
     */
    private WorkSessionDocument write(WorkSessionDocument session) {
        try {
            return sessionRepository.save(session);
        } catch (OptimisticLockingFailureException e) {
            log.warn("Session {} was changed elsewhere, re-reading it", session.getId());
            SessionTransitionException conflict = new SessionTransitionException(Failure.CHANGED_ELSEWHERE, e);
            try {
                sync();
            } catch (RuntimeException syncFailure) {
                conflict.addSuppressed(syncFailure);
            }
            throw conflict;
        }
    }

    private boolean isOlderThanApplied(WorkSessionDocument remote) {
        return lastAppliedVersion != null && remote.getVersion() != null
                && remote.getVersion() < lastAppliedVersion;
    }

    private void track(WorkSessionDocument session) {
        current = session;
        state = SessionState.from(session.getStatus());
        lastAppliedVersion = session.getVersion();
    }

    private void clearCurrent(SessionState terminal) {
        current = null;
        lastAppliedVersion = null;
        state = terminal;
        publish();
    }

    private void markPresence(String userId, boolean online, Instant at) {
        try {
            presenceRepository.save(new MemberPresenceDocument(userId, online, at));
        } catch (Exception e) {
            log.warn("Presence update for {} failed: {}", userId, e.getMessage());
        }
    }

    private void publish() {
        WorkSessionDocument session = current;
        SessionState snapshot = state;
        for (SessionLifecycleListener listener : listeners) {
            try {
                listener.onSessionStateChanged(snapshot, session);
            } catch (Exception e) {
                log.error("Lifecycle listener failed on {}", snapshot, e);
            }
        }
        pushMirror();
    }

    private void pushMirror() {
        WorkSessionDocument session = current;
        MemberIdentity member = identity;
        SessionMirror mirror = null;
        if (session != null && member != null && state.isOpen()) {
            mirror = new SessionMirror(member.credential(), member.userId(), session.getId(),
                    session.getCheckInTime(), SessionDurations.closedBreakSeconds(session.getBreaks()));
        }
        try {
            mirrorSink.sync(mirror);
        } catch (Exception e) {
            log.warn("Mirror sync failed: {}", e.getMessage());
        }
    }
}
