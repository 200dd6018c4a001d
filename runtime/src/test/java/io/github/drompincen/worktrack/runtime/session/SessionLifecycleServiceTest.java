package io.github.drompincen.worktrack.runtime.session;

import io.github.drompincen.worktrack.persistence.document.MemberPresenceDocument;
import io.github.drompincen.worktrack.persistence.document.WorkSessionDocument;
import io.github.drompincen.worktrack.persistence.repository.MemberPresenceRepository;
import io.github.drompincen.worktrack.persistence.repository.WorkSessionRepository;
import io.github.drompincen.worktrack.protocol.api.SessionMirror;
import io.github.drompincen.worktrack.protocol.api.SessionSource;
import io.github.drompincen.worktrack.protocol.api.SessionStatus;
import io.github.drompincen.worktrack.runtime.session.SessionTransitionException.Failure;
import io.github.drompincen.worktrack.runtime.timer.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionLifecycleServiceTest {

    private static final Instant NINE = Instant.parse("2026-01-05T09:00:00Z");

    @Mock private WorkSessionRepository sessionRepository;
    @Mock private MemberPresenceRepository presenceRepository;

    private MutableClock clock;
    private SessionLifecycleService service;
    private final List<SessionMirror> mirrors = new ArrayList<>();
    private final List<SessionState> transitions = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NINE);
        service = new SessionLifecycleService(sessionRepository, presenceRepository, SessionSource.DESKTOP, clock);
        service.setMirrorSink(mirrors::add);
        service.addListener((state, session) -> transitions.add(state));
        service.signIn(new MemberIdentity("u1", "Ana", "cred-1"));
    }

    private void stubSave() {
        when(sessionRepository.save(any(WorkSessionDocument.class))).thenAnswer(inv -> {
            WorkSessionDocument doc = inv.getArgument(0);
            if (doc.getId() == null) doc.setId("w1");
            doc.setVersion(doc.getVersion() == null ? 0L : doc.getVersion() + 1);
            return doc;
        });
    }

    @Test
    void checkInCreatesOpenDesktopSession() {
        stubSave();

        WorkSessionDocument session = service.checkIn();

        assertThat(session.getStatus()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(session.getSource()).isEqualTo(SessionSource.DESKTOP);
        assertThat(session.getBreaks()).isEmpty();
        assertThat(session.getOpenFor()).isEqualTo("u1");
        assertThat(session.getLastHeartbeat()).isEqualTo(NINE);
        assertThat(service.getState()).isEqualTo(SessionState.ACTIVE);
        assertThat(transitions).containsExactly(SessionState.ACTIVE);

        ArgumentCaptor<MemberPresenceDocument> presence = ArgumentCaptor.forClass(MemberPresenceDocument.class);
        verify(presenceRepository).save(presence.capture());
        assertThat(presence.getValue().isOnline()).isTrue();
    }

    @Test
    void secondCheckInFailsLocally() {
        stubSave();
        service.checkIn();

        assertThatThrownBy(() -> service.checkIn())
                .isInstanceOf(SessionTransitionException.class)
                .extracting(e -> ((SessionTransitionException) e).getFailure())
                .isEqualTo(Failure.ALREADY_CHECKED_IN);
        verify(sessionRepository, times(1)).save(any());
    }

    @Test
    void checkInLosingTheRaceReportsAlreadyCheckedIn() {
        when(sessionRepository.save(any(WorkSessionDocument.class)))
                .thenThrow(new DuplicateKeyException("openFor dup"));

        assertThatThrownBy(() -> service.checkIn())
                .isInstanceOf(SessionTransitionException.class)
                .hasMessage("Already checked in");
        assertThat(service.getState()).isEqualTo(SessionState.NO_SESSION);
        verifyNoInteractions(presenceRepository);
    }

    @Test
    void checkInWithoutSignedInMemberIsRejected() {
        SessionLifecycleService anonymous =
                new SessionLifecycleService(sessionRepository, presenceRepository, SessionSource.BROWSER, clock);

        assertThatThrownBy(anonymous::checkIn).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void fullDayScenarioComputesNetDuration() {
        stubSave();
        service.checkIn();

        clock.set(Instant.parse("2026-01-05T09:30:00Z"));
        service.startBreak();
        assertThat(service.getState()).isEqualTo(SessionState.ON_BREAK);

        clock.set(Instant.parse("2026-01-05T09:45:00Z"));
        WorkSessionDocument resumed = service.resumeWork();
        assertThat(resumed.getBreaks()).hasSize(1);
        assertThat(resumed.getBreaks().get(0).getDurationMinutes()).isEqualTo(15);

        clock.set(Instant.parse("2026-01-05T12:00:00Z"));
        WorkSessionDocument done = service.checkOut("Shipped the parser", "https://proof/1");

        assertThat(done.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(done.getBreakDurationMinutes()).isEqualTo(15);
        assertThat(done.getDurationMinutes()).isEqualTo(165);
        assertThat(done.getAttachments()).containsExactly("https://proof/1");
        assertThat(done.getOpenFor()).isNull();
        assertThat(service.getState()).isEqualTo(SessionState.COMPLETED);
        assertThat(service.currentSession()).isEmpty();
        assertThat(transitions).containsExactly(
                SessionState.ACTIVE, SessionState.ON_BREAK, SessionState.ACTIVE, SessionState.COMPLETED);
    }

    @Test
    void checkOutDuringBreakClosesTheBreakFirst() {
        stubSave();
        service.checkIn();
        clock.advance(Duration.ofMinutes(60));
        service.startBreak();
        clock.advance(Duration.ofMinutes(20));

        WorkSessionDocument done = service.checkOut("wrap up", null);

        assertThat(done.getBreaks().get(0).getEndTime()).isEqualTo(clock.instant());
        assertThat(done.getBreakDurationMinutes()).isEqualTo(20);
        assertThat(done.getDurationMinutes()).isEqualTo(60);
        assertThat(done.getAttachments()).isEmpty();
    }

    @Test
    void startBreakWithoutSessionFails() {
        assertThatThrownBy(() -> service.startBreak())
                .isInstanceOf(SessionTransitionException.class)
                .hasMessage("No active session");
    }

    @Test
    void resumeWorkWithoutOpenBreakMakesNoWrite() {
        WorkSessionDocument broken = remote("w9", SessionStatus.BREAK, NINE);
        service.onSessionChanged(broken);
        assertThat(service.getState()).isEqualTo(SessionState.ON_BREAK);

        assertThatThrownBy(() -> service.resumeWork())
                .isInstanceOf(SessionTransitionException.class)
                .extracting(e -> ((SessionTransitionException) e).getFailure())
                .isEqualTo(Failure.NO_OPEN_BREAK);
        verify(sessionRepository, never()).save(any());
    }

    @Test
    void remoteCompletionEndsLocalSession() {
        stubSave();
        WorkSessionDocument session = service.checkIn();

        WorkSessionDocument closed = remote(session.getId(), SessionStatus.COMPLETED, NINE.plusSeconds(300));
        closed.setFlagged(true);
        closed.setFlagReason("heartbeat stopped");
        service.onSessionChanged(closed);

        assertThat(service.getState()).isEqualTo(SessionState.COMPLETED);
        assertThat(service.currentSession()).isEmpty();
        assertThat(mirrors.get(mirrors.size() - 1)).isNull();
    }

    @Test
    void remoteBreakIsAppliedAndOlderVersionIgnored() {
        stubSave();
        WorkSessionDocument session = service.checkIn();

        WorkSessionDocument onBreak = remote(session.getId(), SessionStatus.BREAK, NINE.plusSeconds(600), 1L);
        onBreak.getBreaks().add(new WorkSessionDocument.BreakEntry(NINE.plusSeconds(600)));
        service.onSessionChanged(onBreak);
        assertThat(service.getState()).isEqualTo(SessionState.ON_BREAK);

        // Stamped later by a fast clock, but written before the break.
        service.onSessionChanged(remote(session.getId(), SessionStatus.ACTIVE, NINE.plusSeconds(900), 0L));
        assertThat(service.getState()).isEqualTo(SessionState.ON_BREAK);
    }

    @Test
    void remoteCompletionStampedByASlowClockStillEndsSession() {
        stubSave();
        WorkSessionDocument session = service.checkIn();

        WorkSessionDocument closed = remote(session.getId(), SessionStatus.COMPLETED,
                Instant.parse("2026-01-05T08:59:59Z"), 1L);
        service.onSessionChanged(closed);

        assertThat(service.getState()).isEqualTo(SessionState.COMPLETED);
        assertThat(service.currentSession()).isEmpty();
        assertThat(mirrors.get(mirrors.size() - 1)).isNull();
    }

    @Test
    void remoteCompletionWinsEvenWhenItsVersionLooksOlder() {
        stubSave();
        WorkSessionDocument session = service.checkIn();
        service.startBreak();

        service.onSessionChanged(remote(session.getId(), SessionStatus.COMPLETED, NINE, 0L));

        assertThat(service.getState()).isEqualTo(SessionState.COMPLETED);
    }

    @Test
    void failedBreakWriteLeavesSessionUntouchedAndRetryOpensOneBreak() {
        when(sessionRepository.save(any(WorkSessionDocument.class)))
                .thenAnswer(inv -> withId(inv.getArgument(0)))
                .thenThrow(new DataAccessResourceFailureException("store unreachable"))
                .thenAnswer(inv -> withId(inv.getArgument(0)));
        service.checkIn();
        clock.advance(Duration.ofMinutes(30));

        assertThatThrownBy(() -> service.startBreak()).isInstanceOf(DataAccessResourceFailureException.class);
        assertThat(service.getState()).isEqualTo(SessionState.ACTIVE);
        assertThat(service.currentSession().orElseThrow().getBreaks()).isEmpty();
        assertThat(service.currentSession().orElseThrow().getStatus()).isEqualTo(SessionStatus.ACTIVE);

        WorkSessionDocument onBreak = service.startBreak();

        assertThat(onBreak.getBreaks()).hasSize(1);
        assertThat(onBreak.getBreaks().stream().filter(WorkSessionDocument.BreakEntry::isOpen)).hasSize(1);
        assertThat(service.getState()).isEqualTo(SessionState.ON_BREAK);
    }

    @Test
    void failedCheckOutDuringBreakKeepsBreakOpenAndResumable() {
        when(sessionRepository.save(any(WorkSessionDocument.class)))
                .thenAnswer(inv -> withId(inv.getArgument(0)))
                .thenAnswer(inv -> withId(inv.getArgument(0)))
                .thenThrow(new DataAccessResourceFailureException("store unreachable"))
                .thenAnswer(inv -> withId(inv.getArgument(0)));
        service.checkIn();
        clock.advance(Duration.ofMinutes(60));
        service.startBreak();
        clock.advance(Duration.ofMinutes(10));

        assertThatThrownBy(() -> service.checkOut("done", null))
                .isInstanceOf(DataAccessResourceFailureException.class);

        WorkSessionDocument tracked = service.currentSession().orElseThrow();
        assertThat(service.getState()).isEqualTo(SessionState.ON_BREAK);
        assertThat(tracked.getStatus()).isEqualTo(SessionStatus.BREAK);
        assertThat(tracked.getBreaks().get(0).isOpen()).isTrue();
        assertThat(tracked.getCheckOutTime()).isNull();
        assertThat(tracked.getOpenFor()).isEqualTo("u1");
        assertThat(mirrors.get(mirrors.size() - 1)).isNotNull();
        verify(presenceRepository, times(1)).save(any(MemberPresenceDocument.class));

        WorkSessionDocument resumed = service.resumeWork();
        assertThat(resumed.getBreaks().get(0).getDurationMinutes()).isEqualTo(10);
        assertThat(service.getState()).isEqualTo(SessionState.ACTIVE);
    }

    @Test
    void failedResumeKeepsBreakOpen() {
        when(sessionRepository.save(any(WorkSessionDocument.class)))
                .thenAnswer(inv -> withId(inv.getArgument(0)))
                .thenAnswer(inv -> withId(inv.getArgument(0)))
                .thenThrow(new DataAccessResourceFailureException("store unreachable"));
        service.checkIn();
        service.startBreak();

        assertThatThrownBy(() -> service.resumeWork()).isInstanceOf(DataAccessResourceFailureException.class);

        assertThat(service.getState()).isEqualTo(SessionState.ON_BREAK);
        assertThat(service.currentSession().orElseThrow().getBreaks().get(0).isOpen()).isTrue();
    }

    @Test
    void conflictingWriteAppliesStoreCopyAndReportsChangedElsewhere() {
        when(sessionRepository.save(any(WorkSessionDocument.class)))
                .thenAnswer(inv -> withId(inv.getArgument(0)))
                .thenThrow(new OptimisticLockingFailureException("version 0 is stale"));
        service.checkIn();
        WorkSessionDocument forceClosed = remote("w1", SessionStatus.COMPLETED, NINE.plusSeconds(120), 1L);
        when(sessionRepository.findById("w1")).thenReturn(Optional.of(forceClosed));

        assertThatThrownBy(() -> service.startBreak())
                .isInstanceOf(SessionTransitionException.class)
                .extracting(e -> ((SessionTransitionException) e).getFailure())
                .isEqualTo(Failure.CHANGED_ELSEWHERE);
        assertThat(service.getState()).isEqualTo(SessionState.COMPLETED);
        assertThat(service.currentSession()).isEmpty();
    }

    @Test
    void closedSessionMemoryIsBounded() {
        AtomicInteger ids = new AtomicInteger();
        when(sessionRepository.save(any(WorkSessionDocument.class))).thenAnswer(inv -> {
            WorkSessionDocument doc = inv.getArgument(0);
            if (doc.getId() == null) doc.setId("w" + ids.incrementAndGet());
            return doc;
        });

        for (int i = 0; i < 200; i++) {
            service.checkIn();
            clock.advance(Duration.ofMinutes(1));
            service.checkOut("r", null);
        }

        assertThat(service.closedSessionsRemembered())
                .isEqualTo(SessionLifecycleService.CLOSED_SESSIONS_REMEMBERED);

        service.onSessionChanged(remote("w200", SessionStatus.ACTIVE, NINE));
        assertThat(service.getState()).isEqualTo(SessionState.COMPLETED);
    }

    @Test
    void switchingMemberForgetsClosedSessions() {
        stubSave();
        service.checkIn();
        service.checkOut("r", null);
        assertThat(service.closedSessionsRemembered()).isEqualTo(1);

        service.signIn(new MemberIdentity("u2", "Bo", "cred-2"));

        assertThat(service.closedSessionsRemembered()).isZero();
    }

    @Test
    void openSessionFromOtherProcessIsAdopted() {
        WorkSessionDocument browser = remote("w7", SessionStatus.ACTIVE, NINE);
        browser.setSource(SessionSource.BROWSER);

        service.onSessionChanged(browser);

        assertThat(service.getState()).isEqualTo(SessionState.ACTIVE);
        assertThat(service.currentSession()).map(WorkSessionDocument::getId).contains("w7");
        assertThat(mirrors.get(mirrors.size() - 1).sessionId()).isEqualTo("w7");
    }

    @Test
    void sessionsOfOtherMembersAreIgnored() {
        WorkSessionDocument other = remote("w8", SessionStatus.ACTIVE, NINE);
        other.setUserId("u2");

        service.onSessionChanged(other);

        assertThat(service.getState()).isEqualTo(SessionState.NO_SESSION);
    }

    @Test
    void lateEchoOfClosedSessionIsNotReadopted() {
        stubSave();
        WorkSessionDocument session = service.checkIn();
        clock.advance(Duration.ofMinutes(30));
        service.checkOut("done", null);

        service.onSessionChanged(remote(session.getId(), SessionStatus.ACTIVE, NINE.plusSeconds(60)));

        assertThat(service.getState()).isEqualTo(SessionState.COMPLETED);
    }

    @Test
    void resumeOrCheckInAdoptsExistingOpenSession() {
        WorkSessionDocument existing = remote("w3", SessionStatus.BREAK, NINE);
        existing.getBreaks().add(new WorkSessionDocument.BreakEntry(NINE.plusSeconds(60)));
        when(sessionRepository.findFirstByUserIdAndStatusInOrderByCheckInTimeDesc(eq("u1"), anyCollection()))
                .thenReturn(Optional.of(existing));

        CheckInResult result = service.resumeOrCheckIn();

        assertThat(result.resumed()).isTrue();
        assertThat(result.session().getId()).isEqualTo("w3");
        assertThat(service.getState()).isEqualTo(SessionState.ON_BREAK);
        verify(sessionRepository, never()).save(any());
    }

    @Test
    void resumeOrCheckInCreatesWhenNothingIsOpen() {
        when(sessionRepository.findFirstByUserIdAndStatusInOrderByCheckInTimeDesc(eq("u1"), anyCollection()))
                .thenReturn(Optional.empty());
        stubSave();

        CheckInResult result = service.resumeOrCheckIn();

        assertThat(result.resumed()).isFalse();
        assertThat(service.getState()).isEqualTo(SessionState.ACTIVE);
    }

    @Test
    void mirrorFollowsTransitionsAndCredentialRefresh() {
        stubSave();
        service.checkIn();
        clock.advance(Duration.ofMinutes(10));
        service.startBreak();
        clock.advance(Duration.ofMinutes(5));
        service.resumeWork();

        SessionMirror afterResume = mirrors.get(mirrors.size() - 1);
        assertThat(afterResume.sessionId()).isEqualTo("w1");
        assertThat(afterResume.checkInTime()).isEqualTo(NINE);
        assertThat(afterResume.cumulativeBreakSeconds()).isEqualTo(300);

        service.refreshCredential("cred-2");
        assertThat(mirrors.get(mirrors.size() - 1).credential()).isEqualTo("cred-2");

        service.checkOut("done", null);
        assertThat(mirrors.get(mirrors.size() - 1)).isNull();
    }

    @Test
    void syncClearsViewWhenTrackedSessionDisappeared() {
        stubSave();
        service.checkIn();
        when(sessionRepository.findById("w1")).thenReturn(Optional.empty());

        service.sync();

        assertThat(service.getState()).isEqualTo(SessionState.NO_SESSION);
        assertThat(service.currentSession()).isEmpty();
    }

    @Test
    void atMostOneOpenBreakAndAlwaysLast() {
        stubSave();
        Random random = new Random(42);
        for (int i = 0; i < 300; i++) {
            clock.advance(Duration.ofSeconds(30 + random.nextInt(600)));
            try {
                switch (random.nextInt(4)) {
                    case 0 -> service.checkIn();
                    case 1 -> service.startBreak();
                    case 2 -> service.resumeWork();
                    default -> service.checkOut("r", null);
                }
            } catch (SessionTransitionException expected) {
                // invalid intent for the current state
            }
            service.currentSession().ifPresent(s -> {
                var breaks = s.getBreaks();
                long open = breaks.stream().filter(WorkSessionDocument.BreakEntry::isOpen).count();
                assertThat(open).isLessThanOrEqualTo(1);
                if (open == 1) {
                    assertThat(breaks.get(breaks.size() - 1).isOpen()).isTrue();
                }
            });
        }
    }

    private static WorkSessionDocument withId(WorkSessionDocument doc) {
        if (doc.getId() == null) doc.setId("w1");
        return doc;
    }

    private static WorkSessionDocument remote(String id, SessionStatus status, Instant updatedAt, Long version) {
        WorkSessionDocument doc = remote(id, status, updatedAt);
        doc.setVersion(version);
        return doc;
    }

    private static WorkSessionDocument remote(String id, SessionStatus status, Instant updatedAt) {
        WorkSessionDocument doc = new WorkSessionDocument();
        doc.setId(id);
        doc.setUserId("u1");
        doc.setStatus(status);
        doc.setSource(SessionSource.DESKTOP);
        doc.setCheckInTime(NINE);
        doc.setUpdatedAt(updatedAt);
        return doc;
    }
}
