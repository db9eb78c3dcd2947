package io.github.drompincen.clarity.runtime.prompt;

import io.github.drompincen.clarity.persistence.document.RecallPointDocument;
import io.github.drompincen.clarity.persistence.document.RecallSetDocument;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

public final class TutorPrompts {

    public static final String OPENING_INSTRUCTION =
            "Begin the recall discussion. Ask an opening question that prompts the learner to recall the target information.";

    private TutorPrompts() {}

    public static String buildTutorSystemPrompt(RecallSetDocument recallSet,
                                                List<RecallPointDocument> pendingPoints,
                                                List<RecallPointDocument> recalledPoints,
                                                RecallPointDocument probePoint) {
        if (pendingPoints.isEmpty() && recalledPoints.isEmpty()) {
            return """
                    You are facilitating a recall session for "%s" with no specific recall points. \
                    Ask open questions that help the learner articulate what they know about the subject."""
                    .formatted(recallSet.getName());
        }

        StringBuilder prompt = new StringBuilder("""
                You are facilitating a recall session. The learner already studied the material below and is \
                practicing retrieving it from memory. Probe their recall with questions; do not teach, explain \
                or hand out answers.

                ## Approach
                Ask, don't tell. Start broad, then narrow. Build on what the learner says. When a point is \
                recalled, move on; the interface confirms it. If they are stuck, give a contextual hint, never \
                the answer. Keep replies to one to three short sentences, no lists, no praise.
                """);

        if (probePoint == null) {
            prompt.append("\n## Current Focus Point\nAll points have been recalled. Keep the discussion open ")
                    .append("for anything the learner wants to revisit.\n");
        } else {
            prompt.append("\n## Current Focus Point\nProbe this next without revealing it:\n<recall_target>\n")
                    .append(PromptText.sanitize(probePoint.getContent()))
                    .append("\n</recall_target>\n");
            if (probePoint.getContext() != null && !probePoint.getContext().isBlank()) {
                prompt.append("<supporting_context>\n")
                        .append(PromptText.sanitize(probePoint.getContext()))
                        .append("\n</supporting_context>\n");
            }
            List<RecallPointDocument> others = pendingPoints.stream()
                    .filter(p -> !p.getRecallPointId().equals(probePoint.getRecallPointId()))
                    .toList();
            if (!others.isEmpty()) {
                prompt.append("\n## Other Unchecked Points\nAccept these if the learner recalls them out of order:\n")
                        .append(numbered(others)).append('\n');
            }
        }

        if (!recalledPoints.isEmpty()) {
            prompt.append("\n## Already Recalled\nDo not probe these again:\n")
                    .append(numbered(recalledPoints)).append('\n');
        }

        String guidelines = recallSet.getDiscussionSystemPrompt();
        if (guidelines != null && !guidelines.isBlank()) {
            prompt.append("\n## Guidelines For This Recall Set\n<supplementary_guidelines>\n")
                    .append(guidelines.trim())
                    .append("\n</supplementary_guidelines>\n");
        }
        return prompt.toString();
    }

    public static String buildRabbitholeSystemPrompt(String topic, RecallSetDocument recallSet) {
        String description = recallSet.getDescription() != null ? recallSet.getDescription() : "";
        return """
                The learner is exploring a tangent about "%s" that came up during a recall session on "%s".
                %s

                Be a curious conversation partner, not a tutor: do not quiz them. Share what is interesting, \
                make connections and go deep when asked. Answer in flowing prose of two to four sentences \
                unless asked for more. Do not steer them back to the recall session; the system does that."""
                .formatted(PromptText.sanitize(topic), recallSet.getName(), description);
    }

    private static String numbered(List<RecallPointDocument> points) {
        return IntStream.range(0, points.size())
                .mapToObj(i -> (i + 1) + ". " + PromptText.sanitize(PromptText.preview(points.get(i).getContent())))
                .collect(Collectors.joining("\n"));
    }
}
