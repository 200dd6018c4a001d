package io.github.drompincen.worktrack.runtime.session;

import io.github.drompincen.worktrack.persistence.document.WorkSessionDocument.BreakEntry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Minute arithmetic shared by checkout, force close and the crash guard.
 * Totals and breaks are rounded separately, then subtracted and clamped at zero.
 */
public final class SessionDurations {

    private SessionDurations() {}

    public record Totals(int durationMinutes, int breakDurationMinutes) {}

    public static int roundMinutes(Duration duration) {
        long millis = Math.max(0, duration.toMillis());
        return (int) Math.round(millis / 60_000.0);
    }

    public static int roundMinutes(long seconds) {
        return roundMinutes(Duration.ofSeconds(seconds));
    }

    public static void closeBreak(BreakEntry entry, Instant now) {
        entry.setEndTime(now);
        entry.setDurationMinutes(roundMinutes(Duration.between(entry.getStartTime(), now)));
    }

    public static long closedBreakSeconds(List<BreakEntry> breaks) {
        long seconds = 0;
        for (BreakEntry entry : breaks) {
            if (entry.getStartTime() != null && entry.getEndTime() != null) {
                seconds += Math.max(0, Duration.between(entry.getStartTime(), entry.getEndTime()).getSeconds());
            }
        }
        return seconds;
    }

    /** Closed breaks plus the open break measured up to {@code now}. */
    public static long breakSecondsUntil(List<BreakEntry> breaks, Instant now) {
        long seconds = closedBreakSeconds(breaks);
        if (!breaks.isEmpty()) {
            BreakEntry last = breaks.get(breaks.size() - 1);
            if (last.isOpen() && last.getStartTime() != null) {
                seconds += Math.max(0, Duration.between(last.getStartTime(), now).getSeconds());
            }
        }
        return seconds;
    }

    public static Totals totals(Instant checkIn, Instant end, long breakSeconds) {
        int totalMinutes = roundMinutes(Duration.between(checkIn, end));
        int breakMinutes = roundMinutes(breakSeconds);
        return new Totals(Math.max(0, totalMinutes - breakMinutes), breakMinutes);
    }

    public static BreakEntry openBreak(List<BreakEntry> breaks) {
        if (breaks.isEmpty()) return null;
        BreakEntry last = breaks.get(breaks.size() - 1);
        return last.isOpen() ? last : null;
    }
}
