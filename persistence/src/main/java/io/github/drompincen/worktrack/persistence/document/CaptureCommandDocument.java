package io.github.drompincen.worktrack.persistence.document;

import io.github.drompincen.worktrack.protocol.api.CaptureType;
import io.github.drompincen.worktrack.protocol.api.CommandStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "capture_commands")
@CompoundIndex(name = "user_status_requested", def = "{'userId': 1, 'status': 1, 'requestedAt': 1}")
public class CaptureCommandDocument {

    @Id
    private String id;
    private String userId;
    private CaptureType type;
    private CommandStatus status;
    private String requestedBy;
    private Instant requestedAt;
    private Instant completedAt;

    public CaptureCommandDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public CaptureType getType() { return type; }
    public void setType(CaptureType type) { this.type = type; }

    public CommandStatus getStatus() { return status; }
    public void setStatus(CommandStatus status) { this.status = status; }

    public String getRequestedBy() { return requestedBy; }
    public void setRequestedBy(String requestedBy) { this.requestedBy = requestedBy; }

    public Instant getRequestedAt() { return requestedAt; }
    public void setRequestedAt(Instant requestedAt) { this.requestedAt = requestedAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }
}
