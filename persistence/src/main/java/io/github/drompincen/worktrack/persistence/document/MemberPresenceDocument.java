package io.github.drompincen.worktrack.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "member_profiles")
public class MemberPresenceDocument {

    @Id
    private String userId;
    private boolean online;
    private Instant lastActive;

    public MemberPresenceDocument() {}

    public MemberPresenceDocument(String userId, boolean online, Instant lastActive) {
        this.userId = userId;
        this.online = online;
        this.lastActive = lastActive;
    }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public boolean isOnline() { return online; }
    public void setOnline(boolean online) { this.online = online; }

    public Instant getLastActive() { return lastActive; }
    public void setLastActive(Instant lastActive) { this.lastActive = lastActive; }
}
