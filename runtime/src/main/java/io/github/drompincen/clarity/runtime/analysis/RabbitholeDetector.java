package io.github.drompincen.clarity.runtime.analysis;

import io.github.drompincen.clarity.persistence.document.RecallPointDocument;
import io.github.drompincen.clarity.persistence.document.SessionMessageDocument;
import io.github.drompincen.clarity.protocol.api.MessageRole;
import io.github.drompincen.clarity.protocol.api.RabbitholeStatus;
import io.github.drompincen.clarity.runtime.llm.CompletionOptions;
import io.github.drompincen.clarity.runtime.llm.LlmClient;
import io.github.drompincen.clarity.runtime.prompt.RabbitholePrompts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Tracks conversational tangents for one session. Detection and return detection go through a
 * {@link SerialTaskQueue}, so LLM round trips for this instance never overlap and are applied to
 * the active set in arrival order.
 */
public class RabbitholeDetector {

    private static final Logger log = LoggerFactory.getLogger(RabbitholeDetector.class);

    static final CompletionOptions DETECTION_OPTIONS = CompletionOptions.of(0.3, 512);
    static final CompletionOptions RETURN_OPTIONS = CompletionOptions.of(0.3, 256);
    static final String DEFAULT_TOPIC = "Unknown tangent";

    private final LlmClient llmClient;
    private final RabbitholeDetectorConfig config;
    private final SerialTaskQueue queue;
    private final Clock clock;
    private final Map<String, ActiveRabbithole> active = new LinkedHashMap<>();

    public RabbitholeDetector(LlmClient llmClient, RabbitholeDetectorConfig config, Executor executor) {
        this(llmClient, config, executor, Clock.systemUTC());
    }

    public RabbitholeDetector(LlmClient llmClient, RabbitholeDetectorConfig config, Executor executor, Clock clock) {
        this.llmClient = llmClient;
        this.config = config;
        this.queue = new SerialTaskQueue(executor);
        this.clock = clock;
    }

    /**
     * Completes with the newly opened tangent, or null when the window is too short, the model says
     * no or is not confident enough, or the topic duplicates an open tangent.
     */
    public CompletableFuture<RabbitholeEvent> detectRabbithole(String sessionId,
                                                               List<SessionMessageDocument> messages,
                                                               RecallPointDocument currentPoint,
                                                               List<RecallPointDocument> allPoints,
                                                               int messageIndex) {
        long generation = queue.generation();
        return queue.submit(() -> runDetection(sessionId, messages, currentPoint, allPoints, messageIndex, generation));
    }

    /** Completes with the tangents closed as returned by this call, possibly none. */
    public CompletableFuture<List<RabbitholeEvent>> detectReturns(List<SessionMessageDocument> messages,
                                                                  RecallPointDocument currentPoint,
                                                                  int messageIndex) {
        long generation = queue.generation();
        return queue.submit(() -> runReturnDetection(messages, currentPoint, messageIndex, generation));
    }

    public List<RabbitholeEvent> closeAllActive(int finalMessageIndex) {
        List<RabbitholeEvent> closed = new ArrayList<>();
        synchronized (active) {
            for (ActiveRabbithole rabbithole : active.values()) {
                closed.add(rabbithole.toEvent(RabbitholeStatus.ABANDONED, finalMessageIndex));
            }
            active.clear();
        }
        if (!closed.isEmpty()) {
            log.debug("Force-closed {} open tangent(s) at message {}", closed.size(), finalMessageIndex);
        }
        return closed;
    }

    /** Drops one tangent from the active set, e.g. when the learner exits or declines it. */
    public boolean remove(String rabbitholeId) {
        synchronized (active) {
            return active.remove(rabbitholeId) != null;
        }
    }

    public void reset() {
        queue.clear();
        synchronized (active) {
            active.clear();
        }
    }

    public int getActiveCount() {
        synchronized (active) {
            return active.size();
        }
    }

    public List<RabbitholeEvent> getActiveRabbitholes() {
        synchronized (active) {
            return active.values().stream()
                    .map(rabbithole -> rabbithole.toEvent(RabbitholeStatus.ACTIVE, null))
                    .toList();
        }
    }

    public boolean isActive(String rabbitholeId) {
        synchronized (active) {
            return active.containsKey(rabbitholeId);
        }
    }

    public RabbitholeDetectorConfig getConfig() {
        return config;
    }

    private RabbitholeEvent runDetection(String sessionId, List<SessionMessageDocument> messages,
                                         RecallPointDocument currentPoint, List<RecallPointDocument> allPoints,
                                         int messageIndex, long generation) {
        List<SessionMessageDocument> window = recentWindow(messages);
        if (window.size() < 2) {
            return null;
        }
        List<String> existingTopics;
        synchronized (active) {
            existingTopics = active.values().stream().map(ActiveRabbithole::topic).toList();
        }

        String prompt = RabbitholePrompts.buildDetectionPrompt(window, currentPoint,
                config.trackRelatedRecallPoints() ? allPoints : List.of(), existingTopics);
        RabbitholePrompts.DetectionResult result =
                RabbitholePrompts.parseDetection(llmClient.complete(prompt, DETECTION_OPTIONS).text());
        log.debug("Session {} detection: rabbithole={}, confidence={}, topic={}",
                sessionId, result.isRabbithole(), result.confidence(), result.topic());

        if (!result.isRabbithole() || result.confidence() < config.confidenceThreshold()) {
            return null;
        }

        String topic = result.topic() != null ? result.topic() : DEFAULT_TOPIC;
        String normalized = normalize(topic);
        synchronized (active) {
            if (queue.generation() != generation) {
                return null;
            }
            boolean duplicate = active.values().stream().anyMatch(r -> normalize(r.topic()).equals(normalized));
            if (duplicate) {
                return null;
            }
            ActiveRabbithole rabbithole = new ActiveRabbithole(
                    "rh_" + UUID.randomUUID(),
                    topic,
                    messageIndex,
                    result.depth(),
                    List.copyOf(result.relatedRecallPointIds()),
                    wasUserInitiated(messages, messageIndex),
                    clock.instant());
            active.put(rabbithole.id(), rabbithole);
            log.info("Session {} opened tangent {} \"{}\" (depth {})", sessionId, rabbithole.id(), topic, rabbithole.depth());
            return rabbithole.toEvent(RabbitholeStatus.ACTIVE, null);
        }
    }

    private List<RabbitholeEvent> runReturnDetection(List<SessionMessageDocument> messages,
                                                     RecallPointDocument currentPoint,
                                                     int messageIndex, long generation) {
        List<ActiveRabbithole> open;
        synchronized (active) {
            open = new ArrayList<>(active.values());
        }
        List<SessionMessageDocument> window = recentWindow(messages);
        if (open.isEmpty() || window.size() < 2) {
            return List.of();
        }

        List<RabbitholeEvent> returned = new ArrayList<>();
        for (ActiveRabbithole rabbithole : open) {
            String prompt = RabbitholePrompts.buildReturnPrompt(rabbithole.topic(), currentPoint, window);
            RabbitholePrompts.ReturnResult result =
                    RabbitholePrompts.parseReturn(llmClient.complete(prompt, RETURN_OPTIONS).text());
            if (!result.hasReturned() || result.confidence() < config.returnConfidenceThreshold()) {
                continue;
            }
            synchronized (active) {
                if (queue.generation() != generation) {
                    return List.of();
                }
                if (active.remove(rabbithole.id()) != null) {
                    returned.add(rabbithole.toEvent(RabbitholeStatus.RETURNED, messageIndex));
                }
            }
        }
        return returned;
    }

    private List<SessionMessageDocument> recentWindow(List<SessionMessageDocument> messages) {
        int size = config.messageWindowSize();
        if (messages.size() <= size) {
            return messages;
        }
        return messages.subList(messages.size() - size, messages.size());
    }

    private static boolean wasUserInitiated(List<SessionMessageDocument> messages, int triggerIndex) {
        if (triggerIndex < 0 || triggerIndex >= messages.size()) {
            return true;
        }
        return messages.get(triggerIndex).getRole() == MessageRole.USER;
    }

    private static String normalize(String topic) {
        return topic.trim().toLowerCase(Locale.ROOT);
    }
}
