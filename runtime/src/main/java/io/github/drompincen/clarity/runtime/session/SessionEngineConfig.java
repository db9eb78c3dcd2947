package io.github.drompincen.clarity.runtime.session;

/**
 * @param declineCooldownMessages learner messages during which tangent detection stays quiet after
 *                                the learner declined one
 */
public record SessionEngineConfig(double tutorTemperature, int tutorMaxTokens, int declineCooldownMessages) {

    public SessionEngineConfig {
        if (tutorMaxTokens <= 0) {
            throw new IllegalArgumentException("tutorMaxTokens must be positive");
        }
        if (declineCooldownMessages < 0) {
            throw new IllegalArgumentException("declineCooldownMessages must not be negative");
        }
    }

    public static SessionEngineConfig defaults() {
        return new SessionEngineConfig(0.7, 512, 3);
    }
}
