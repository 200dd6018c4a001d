package io.github.drompincen.worktrack.runtime.session;

/** The signed-in member a process acts for. The credential is opaque to this core. */
public record MemberIdentity(String userId, String displayName, String credential) {

    public MemberIdentity withCredential(String newCredential) {
        return new MemberIdentity(userId, displayName, newCredential);
    }
}
