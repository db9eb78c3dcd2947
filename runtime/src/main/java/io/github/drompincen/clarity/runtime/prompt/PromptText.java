package io.github.drompincen.clarity.runtime.prompt;

import io.github.drompincen.clarity.persistence.document.RecallPointDocument;
import io.github.drompincen.clarity.persistence.document.SessionMessageDocument;
import io.github.drompincen.clarity.protocol.api.MessageRole;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Shared formatting for prompts that embed learner-controlled text.
 */
public final class PromptText {

    private static final Pattern CLOSING_TAG = Pattern.compile(
            "</(current_recall_point|recent_messages|rabbithole_topic|recall_target|conversation|learner_message)>",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern JSON_FENCE = Pattern.compile("```json", Pattern.CASE_INSENSITIVE);

    static final int POINT_PREVIEW_LENGTH = 100;

    private PromptText() {}

    /** Neutralizes closing delimiter tags and code fences so embedded text cannot break out of its block. */
    public static String sanitize(String input) {
        if (input == null || input.isBlank()) return "";
        String text = CLOSING_TAG.matcher(input.trim()).replaceAll("&lt;/$1&gt;");
        text = JSON_FENCE.matcher(text).replaceAll("` ` `json");
        return text.replace("```", "` ` `");
    }

    public static String formatMessages(List<SessionMessageDocument> messages) {
        if (messages == null || messages.isEmpty()) return "";
        return messages.stream()
                .map(msg -> "[" + label(msg.getRole()) + "]: " + sanitize(msg.getContent()))
                .collect(Collectors.joining("\n\n"));
    }

    public static String formatRecallPoints(List<RecallPointDocument> points, String currentPointId) {
        if (points == null || points.isEmpty()) return "[No recall points provided]";
        return IntStream.range(0, points.size())
                .mapToObj(i -> {
                    RecallPointDocument point = points.get(i);
                    String marker = point.getRecallPointId() != null && point.getRecallPointId().equals(currentPointId)
                            ? " (CURRENT)" : "";
                    return (i + 1) + ". [ID: " + point.getRecallPointId() + "]" + marker + ": "
                            + sanitize(preview(point.getContent()));
                })
                .collect(Collectors.joining("\n"));
    }

    static String preview(String content) {
        if (content == null) return "";
        return content.length() > POINT_PREVIEW_LENGTH
                ? content.substring(0, POINT_PREVIEW_LENGTH) + "..."
                : content;
    }

    private static String label(MessageRole role) {
        return role != null ? role.label() : MessageRole.SYSTEM.label();
    }
}
