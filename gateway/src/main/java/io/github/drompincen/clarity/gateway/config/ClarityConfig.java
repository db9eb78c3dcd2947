package io.github.drompincen.clarity.gateway.config;

import io.github.drompincen.clarity.gateway.websocket.ConnectionSettings;
import io.github.drompincen.clarity.runtime.analysis.RabbitholeDetectorConfig;
import io.github.drompincen.clarity.runtime.fsrs.FsrsScheduler;
import io.github.drompincen.clarity.runtime.fsrs.FsrsSchedulerConfig;
import io.github.drompincen.clarity.runtime.session.SessionEngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Binds the {@code clarity.*} properties to the runtime's config records.
 */
@Configuration
public class ClarityConfig {

    private static final Logger log = LoggerFactory.getLogger(ClarityConfig.class);

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    FsrsScheduler fsrsScheduler(@Value("${clarity.fsrs.maximum-interval:365}") int maximumInterval,
                                @Value("${clarity.fsrs.request-retention:0.9}") double requestRetention) {
        return new FsrsScheduler(new FsrsSchedulerConfig(maximumInterval, requestRetention));
    }

    @Bean
    RabbitholeDetectorConfig rabbitholeDetectorConfig(
            @Value("${clarity.rabbithole.confidence-threshold:0.6}") double confidenceThreshold,
            @Value("${clarity.rabbithole.return-confidence-threshold:0.6}") double returnConfidenceThreshold,
            @Value("${clarity.rabbithole.message-window-size:10}") int messageWindowSize,
            @Value("${clarity.rabbithole.track-related-points:true}") boolean trackRelatedPoints) {
        return new RabbitholeDetectorConfig(confidenceThreshold, returnConfidenceThreshold,
                messageWindowSize, trackRelatedPoints);
    }

    @Bean
    SessionEngineConfig sessionEngineConfig(
            @Value("${clarity.tutor.temperature:0.7}") double temperature,
            @Value("${clarity.tutor.max-tokens:512}") int maxTokens,
            @Value("${clarity.rabbithole.decline-cooldown-messages:3}") int declineCooldown) {
        return new SessionEngineConfig(temperature, maxTokens, declineCooldown);
    }

    @Bean
    ConnectionSettings connectionSettings(
            @Value("${clarity.ws.max-consecutive-errors:5}") int maxConsecutiveErrors,
            @Value("${clarity.ws.idle-timeout-ms:300000}") long idleTimeoutMs,
            @Value("${clarity.ws.chunk-size:20}") int chunkSize,
            @Value("${clarity.ws.chunk-delay-ms:15}") long chunkDelayMs) {
        ConnectionSettings settings = new ConnectionSettings(maxConsecutiveErrors, idleTimeoutMs, chunkSize, chunkDelayMs);
        log.info("Session connections: {}", settings);
        return settings;
    }
}
