package io.github.drompincen.clarity.runtime.session;

import io.github.drompincen.clarity.protocol.api.SessionStatus;

import java.time.Instant;
import java.util.List;

public record SessionState(
        String sessionId,
        String recallSetId,
        SessionStatus status,
        int totalPoints,
        int recalledCount,
        List<String> recalledPointIds,
        String currentProbePointId,
        int messageCount,
        boolean inRabbithole,
        String activeRabbitholeTopic,
        Instant startedAt
) {
    public boolean allRecalled() {
        return totalPoints > 0 && recalledCount >= totalPoints;
    }
}
