package io.github.drompincen.clarity.runtime.session;

import java.util.List;

/**
 * Outcome of one learner turn. {@code completionReached} is true only on the turn that recalled the
 * last pending point outside a rabbithole.
 */
public record ProcessMessageResult(
        String response,
        List<String> pointsRecalledThisTurn,
        int recalledCount,
        int totalPoints,
        boolean completionReached
) {
    public ProcessMessageResult {
        pointsRecalledThisTurn = pointsRecalledThisTurn == null ? List.of() : List.copyOf(pointsRecalledThisTurn);
    }
}
