package io.github.drompincen.clarity.protocol.api;

import java.util.List;

public record SessionCompletionSummary(
        String sessionId,
        int totalPoints,
        int recalledCount,
        double recallRate,
        long durationMs,
        int rabbitholeCount,
        List<String> recalledPointIds
) {}
