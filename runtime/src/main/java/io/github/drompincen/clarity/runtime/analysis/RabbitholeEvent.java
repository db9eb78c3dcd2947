package io.github.drompincen.clarity.runtime.analysis;

import io.github.drompincen.clarity.protocol.api.RabbitholeStatus;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of a tangent handed out by the detector. {@code returnMessageIndex} is null while active.
 */
public record RabbitholeEvent(
        String id,
        String topic,
        int triggerMessageIndex,
        Integer returnMessageIndex,
        int depth,
        List<String> relatedRecallPointIds,
        boolean userInitiated,
        RabbitholeStatus status,
        Instant detectedAt
) {}
