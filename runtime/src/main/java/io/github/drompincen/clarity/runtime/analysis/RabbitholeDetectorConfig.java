package io.github.drompincen.clarity.runtime.analysis;

public record RabbitholeDetectorConfig(
        double confidenceThreshold,
        double returnConfidenceThreshold,
        int messageWindowSize,
        boolean trackRelatedRecallPoints
) {
    public static RabbitholeDetectorConfig defaults() {
        return new RabbitholeDetectorConfig(0.6, 0.6, 10, true);
    }
}
