package io.github.drompincen.worktrack.runtime.capture;

import java.util.Optional;

public interface EvidenceStorage {
    /** Uploads a JPEG and returns its public URL; empty when the upload was skipped or failed. */
    Optional<String> upload(byte[] jpeg, String prefix, String userId);
}
