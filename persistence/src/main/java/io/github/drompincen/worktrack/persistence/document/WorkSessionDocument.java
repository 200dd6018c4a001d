package io.github.drompincen.worktrack.persistence.document;

import io.github.drompincen.worktrack.protocol.api.SessionSource;
import io.github.drompincen.worktrack.protocol.api.SessionStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Document(collection = "work_logs")
@CompoundIndex(name = "user_checkin", def = "{'userId': 1, 'checkInTime': -1}")
public class WorkSessionDocument {

    @Id
    private String id;

    @Indexed
    private String userId;
    private String userDisplayName;
    private Instant checkInTime;
    private Instant checkOutTime;
    private SessionStatus status;
    private SessionSource source;
    private List<BreakEntry> breaks = new ArrayList<>();
    private Instant lastHeartbeat;
    private Integer durationMinutes;
    private Integer breakDurationMinutes;
    private String report;
    private List<String> attachments;
    private boolean flagged;
    private String flagReason;

    @Indexed
    private Instant updatedAt;

    // Bumped by the store on every save; orders change notifications without trusting writer clocks.
    @Version
    private Long version;

    // Holds the userId while the session is open; cleared on checkout.
    @Indexed(unique = true, sparse = true)
    private String openFor;

    public WorkSessionDocument() {}

    /** Detached copy, break entries included, for building a write without touching this instance. */
    public WorkSessionDocument copy() {
        WorkSessionDocument copy = new WorkSessionDocument();
        copy.id = id;
        copy.userId = userId;
        copy.userDisplayName = userDisplayName;
        copy.checkInTime = checkInTime;
        copy.checkOutTime = checkOutTime;
        copy.status = status;
        copy.source = source;
        copy.breaks = new ArrayList<>();
        for (BreakEntry entry : breaks) {
            copy.breaks.add(entry.copy());
        }
        copy.lastHeartbeat = lastHeartbeat;
        copy.durationMinutes = durationMinutes;
        copy.breakDurationMinutes = breakDurationMinutes;
        copy.report = report;
        copy.attachments = attachments != null ? new ArrayList<>(attachments) : null;
        copy.flagged = flagged;
        copy.flagReason = flagReason;
        copy.updatedAt = updatedAt;
        copy.version = version;
        copy.openFor = openFor;
        return copy;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getUserDisplayName() { return userDisplayName; }
    public void setUserDisplayName(String userDisplayName) { this.userDisplayName = userDisplayName; }

    public Instant getCheckInTime() { return checkInTime; }
    public void setCheckInTime(Instant checkInTime) { this.checkInTime = checkInTime; }

    public Instant getCheckOutTime() { return checkOutTime; }
    public void setCheckOutTime(Instant checkOutTime) { this.checkOutTime = checkOutTime; }

    public SessionStatus getStatus() { return status; }
    public void setStatus(SessionStatus status) { this.status = status; }

    public SessionSource getSource() { return source; }
    public void setSource(SessionSource source) { this.source = source; }

    public List<BreakEntry> getBreaks() { return breaks; }
    public void setBreaks(List<BreakEntry> breaks) { this.breaks = breaks != null ? breaks : new ArrayList<>(); }

    public Instant getLastHeartbeat() { return lastHeartbeat; }
    public void setLastHeartbeat(Instant lastHeartbeat) { this.lastHeartbeat = lastHeartbeat; }

    public Integer getDurationMinutes() { return durationMinutes; }
    public void setDurationMinutes(Integer durationMinutes) { this.durationMinutes = durationMinutes; }

    public Integer getBreakDurationMinutes() { return breakDurationMinutes; }
    public void setBreakDurationMinutes(Integer breakDurationMinutes) { this.breakDurationMinutes = breakDurationMinutes; }

    public String getReport() { return report; }
    public void setReport(String report) { this.report = report; }

    public List<String> getAttachments() { return attachments; }
    public void setAttachments(List<String> attachments) { this.attachments = attachments; }

    public boolean isFlagged() { return flagged; }
    public void setFlagged(boolean flagged) { this.flagged = flagged; }

    public String getFlagReason() { return flagReason; }
    public void setFlagReason(String flagReason) { this.flagReason = flagReason; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }

    public String getOpenFor() { return openFor; }
    public void setOpenFor(String openFor) { this.openFor = openFor; }

    public static class BreakEntry {
        private Instant startTime;
        private Instant endTime;
        private Integer durationMinutes;

        public BreakEntry() {}

        public BreakEntry(Instant startTime) {
            this.startTime = startTime;
        }

        BreakEntry copy() {
            BreakEntry copy = new BreakEntry(startTime);
            copy.endTime = endTime;
            copy.durationMinutes = durationMinutes;
            return copy;
        }

        public Instant getStartTime() { return startTime; }
        public void setStartTime(Instant startTime) { this.startTime = startTime; }

        public Instant getEndTime() { return endTime; }
        public void setEndTime(Instant endTime) { this.endTime = endTime; }

        public Integer getDurationMinutes() { return durationMinutes; }
        public void setDurationMinutes(Integer durationMinutes) { this.durationMinutes = durationMinutes; }

        public boolean isOpen() { return endTime == null; }
    }
}
