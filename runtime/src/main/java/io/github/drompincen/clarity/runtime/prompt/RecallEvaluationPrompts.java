package io.github.drompincen.clarity.runtime.prompt;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.clarity.persistence.document.RecallPointDocument;
import io.github.drompincen.clarity.persistence.document.SessionMessageDocument;
import io.github.drompincen.clarity.protocol.api.RecallRating;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checklist evaluation: which of the still-pending recall points did the learner just demonstrate?
 */
public final class RecallEvaluationPrompts {

    public record PointEvaluation(String pointId, boolean success, double confidence, String reasoning) {

        /** Confidence bands: 0.85+ easy, 0.6+ good, 0.3+ hard, below that forgot. */
        public RecallRating rating() {
            if (!success || confidence < 0.3) return RecallRating.FORGOT;
            if (confidence >= 0.85) return RecallRating.EASY;
            if (confidence >= 0.6) return RecallRating.GOOD;
            return RecallRating.HARD;
        }
    }

    private RecallEvaluationPrompts() {}

    public static String buildChecklistPrompt(List<RecallPointDocument> pendingPoints,
                                              List<SessionMessageDocument> recentMessages) {
        String targets = pendingPoints.stream()
                .map(p -> "- [ID: " + p.getRecallPointId() + "] " + PromptText.sanitize(p.getContent()))
                .collect(Collectors.joining("\n"));
        String conversation = PromptText.formatMessages(recentMessages);
        return """
                You evaluate whether a learner recalled specific information during a Socratic dialogue.

                ## Recall Targets Not Yet Recalled
                <recall_target>
                %s
                </recall_target>

                ## Conversation
                <conversation>
                %s
                </conversation>

                ## Criteria
                Count a target as recalled when the learner stated its essential content, even paraphrased, \
                or reached it with light hints. Do not count it when the tutor effectively gave the answer, \
                the learner was wrong or contradictory, or only trivial details came up. Judge the learner's \
                most recent messages; earlier credit is already recorded.

                ## Confidence
                0.85 to 1.0 effortless and accurate, 0.6 to 0.85 solid with minor prompting, \
                0.3 to 0.6 partial or effortful, below 0.3 not recalled.

                ## Response Format
                Respond with ONLY this JSON object, one entry per target ID above:
                {
                  "evaluations": [
                    { "pointId": string, "success": boolean, "confidence": number, "reasoning": string }
                  ]
                }
                """.formatted(
                targets.isEmpty() ? "[No pending targets]" : targets,
                conversation.isEmpty() ? "[No conversation provided]" : conversation);
    }

    /**
     * Evaluations for known pending ids only; unknown ids and malformed entries are dropped.
     */
    public static List<PointEvaluation> parseChecklist(String response, Set<String> pendingIds) {
        List<PointEvaluation> out = new ArrayList<>();
        Optional<JsonNode> parsed = JsonResponses.readObject(response);
        if (parsed.isEmpty()) return out;
        JsonNode evaluations = parsed.get().get("evaluations");
        if (evaluations == null || !evaluations.isArray()) return out;
        for (JsonNode node : evaluations) {
            String pointId = JsonResponses.textOr(node, "pointId", null);
            if (pointId == null || !pendingIds.contains(pointId)) continue;
            out.add(new PointEvaluation(
                    pointId,
                    JsonResponses.booleanOr(node, "success", false),
                    JsonResponses.confidence(node.get("confidence")),
                    JsonResponses.textOr(node, "reasoning", "No reasoning provided")));
        }
        return out;
    }
}
