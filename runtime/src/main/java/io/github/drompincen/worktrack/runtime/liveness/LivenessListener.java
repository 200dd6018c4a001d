package io.github.drompincen.worktrack.runtime.liveness;

import io.github.drompincen.worktrack.protocol.api.LivenessDto;

public interface LivenessListener {
    void onLivenessChanged(String userId, LivenessDto liveness);
}
