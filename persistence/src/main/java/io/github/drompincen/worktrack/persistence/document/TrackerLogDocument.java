package io.github.drompincen.worktrack.persistence.document;

import io.github.drompincen.worktrack.protocol.api.CaptureType;
import io.github.drompincen.worktrack.protocol.api.SessionSource;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "tracker_logs")
@CompoundIndex(name = "user_timestamp", def = "{'userId': 1, 'timestamp': -1}")
public class TrackerLogDocument {

    @Id
    private String id;
    private String userId;
    private String userDisplayName;
    private String screenshotUrl;
    private String cameraImageUrl;
    private CaptureType type;
    private boolean flagged;
    private String flagReason;
    private SessionSource source;
    private Instant timestamp;

    public TrackerLogDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getUserDisplayName() { return userDisplayName; }
    public void setUserDisplayName(String userDisplayName) { this.userDisplayName = userDisplayName; }

    public String getScreenshotUrl() { return screenshotUrl; }
    public void setScreenshotUrl(String screenshotUrl) { this.screenshotUrl = screenshotUrl; }

    public String getCameraImageUrl() { return cameraImageUrl; }
    public void setCameraImageUrl(String cameraImageUrl) { this.cameraImageUrl = cameraImageUrl; }

    public CaptureType getType() { return type; }
    public void setType(CaptureType type) { this.type = type; }

    public boolean isFlagged() { return flagged; }
    public void setFlagged(boolean flagged) { this.flagged = flagged; }

    public String getFlagReason() { return flagReason; }
    public void setFlagReason(String flagReason) { this.flagReason = flagReason; }

    public SessionSource getSource() { return source; }
    public void setSource(SessionSource source) { this.source = source; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
}
