package io.github.drompincen.clarity.runtime.llm;

import io.github.drompincen.clarity.protocol.api.MessageRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Offline LLM for running without an API key. Recognizes the detector, return and checklist
 * prompts and answers them with canned JSON; everything else gets a short tutor question.
 *
 * Activate with: CLARITY_LLM_PROVIDER=fake
 */
@Service
@ConditionalOnProperty(name = "clarity.llm.provider", havingValue = "fake")
public class FakeLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(FakeLlmClient.class);

    private static final Pattern TARGET_LINE = Pattern.compile("^- \\[ID: ([^\\]]+)] (.*)$", Pattern.MULTILINE);
    private static final Pattern LEARNER_LINE = Pattern.compile("^\\[Learner]: (.*)$", Pattern.MULTILINE);
    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "of", "and", "or", "to", "in", "is", "are", "was", "it", "that", "this", "for", "on", "with");
    static final double RECALL_OVERLAP = 0.5;

    @Override
    public LlmResponse complete(String prompt, CompletionOptions options) {
        String text;
        if (prompt.contains("\"isRabbithole\"")) {
            text = """
                    {"isRabbithole": false, "topic": null, "depth": 1, "relatedToCurrentPoint": true, \
                    "relatedRecallPointIds": [], "confidence": 0.1, "reasoning": "Conversation is on topic."}""";
        } else if (prompt.contains("\"hasReturned\"")) {
            text = """
                    {"hasReturned": true, "confidence": 0.9, "reasoning": "Back on the recall point."}""";
        } else if (prompt.contains("\"evaluations\"")) {
            text = evaluateChecklist(prompt);
        } else {
            text = "What do you remember about this topic?";
        }
        log.debug("[FAKE LLM] complete: prompt length={}, response length={}", prompt.length(), text.length());
        return new LlmResponse(text);
    }

    @Override
    public LlmResponse chat(String systemPrompt, List<LlmMessage> history, CompletionOptions options) {
        String lastUser = history.stream()
                .filter(m -> m.role() == MessageRole.USER)
                .reduce((first, second) -> second)
                .map(LlmMessage::content)
                .orElse("");
        String text = lastUser.isBlank()
                ? "Let's begin. What can you tell me about what you studied?"
                : "Interesting. Can you tell me a bit more about that?";
        log.debug("[FAKE LLM] chat: history={}, response length={}", history.size(), text.length());
        return new LlmResponse(text);
    }

    /** A target counts as recalled when at least half of its content words appear in the learner's messages. */
    private String evaluateChecklist(String prompt) {
        Set<String> learnerWords = new HashSet<>();
        Matcher learner = LEARNER_LINE.matcher(prompt);
        while (learner.find()) {
            learnerWords.addAll(words(learner.group(1)));
        }

        List<String> entries = new ArrayList<>();
        Matcher target = TARGET_LINE.matcher(prompt);
        while (target.find()) {
            Set<String> targetWords = words(target.group(2));
            long hits = targetWords.stream().filter(learnerWords::contains).count();
            double overlap = targetWords.isEmpty() ? 0 : (double) hits / targetWords.size();
            boolean success = overlap >= RECALL_OVERLAP;
            entries.add(String.format(Locale.ROOT,
                    "{\"pointId\": \"%s\", \"success\": %s, \"confidence\": %.2f, \"reasoning\": \"word overlap %.2f\"}",
                    target.group(1), success, success ? Math.max(overlap, 0.7) : overlap, overlap));
        }
        return "{\"evaluations\": [" + String.join(", ", entries) + "]}";
    }

    private static Set<String> words(String text) {
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
                .filter(w -> w.length() > 1 && !STOP_WORDS.contains(w))
                .collect(Collectors.toSet());
    }
}
