package io.github.drompincen.clarity.runtime.fsrs;

/**
 * @param maximumInterval  cap on days between reviews
 * @param requestRetention target recall probability when the next review is due, in (0, 1]
 */
public record FsrsSchedulerConfig(int maximumInterval, double requestRetention) {

    public FsrsSchedulerConfig {
        if (maximumInterval < 1) {
            throw new IllegalArgumentException("maximumInterval must be at least 1 day, got " + maximumInterval);
        }
        if (!(requestRetention > 0 && requestRetention <= 1)) {
            throw new IllegalArgumentException("requestRetention must be in (0, 1], got " + requestRetention);
        }
    }

    public static FsrsSchedulerConfig defaults() {
        return new FsrsSchedulerConfig(365, 0.9);
    }
}
