package io.github.drompincen.clarity.runtime.analysis;

import io.github.drompincen.clarity.protocol.api.RabbitholeStatus;

import java.time.Instant;
import java.util.List;

/** An open tangent as tracked by the detector. */
public record ActiveRabbithole(
        String id,
        String topic,
        int triggerMessageIndex,
        int depth,
        List<String> relatedRecallPointIds,
        boolean userInitiated,
        Instant detectedAt
) {
    RabbitholeEvent toEvent(RabbitholeStatus status, Integer returnMessageIndex) {
        return new RabbitholeEvent(id, topic, triggerMessageIndex, returnMessageIndex, depth,
                relatedRecallPointIds, userInitiated, status, detectedAt);
    }
}
