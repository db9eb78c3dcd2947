package io.github.drompincen.clarity.protocol.api;

import java.time.Instant;

/**
 * Scheduling state of one recall point. Only the FSRS scheduler produces new instances.
 * {@code reps == 0}, {@code state == NEW} and {@code lastReview == null} always hold together.
 */
public record LearningState(
        double difficulty,
        double stability,
        Instant due,
        Instant lastReview,
        int reps,
        int lapses,
        LearningPhase state
) {
    public static LearningState initial(Instant now) {
        return new LearningState(0, 0, now, null, 0, 0, LearningPhase.NEW);
    }

    public boolean isNew() {
        return state == LearningPhase.NEW;
    }
}
