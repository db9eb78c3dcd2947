package io.github.drompincen.clarity.runtime.prompt;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.clarity.persistence.document.RecallPointDocument;
import io.github.drompincen.clarity.persistence.document.SessionMessageDocument;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Prompts and parsers for tangent detection and return detection.
 */
public final class RabbitholePrompts {

    public record DetectionResult(boolean isRabbithole, String topic, int depth, boolean relatedToCurrentPoint,
                                  List<String> relatedRecallPointIds, double confidence, String reasoning) {

        static DetectionResult none(String reasoning) {
            return new DetectionResult(false, null, 1, false, List.of(), 0, reasoning);
        }
    }

    public record ReturnResult(boolean hasReturned, double confidence, String reasoning) {}

    private RabbitholePrompts() {}

    public static String buildDetectionPrompt(List<SessionMessageDocument> recentMessages,
                                              RecallPointDocument currentPoint,
                                              List<RecallPointDocument> allPoints,
                                              List<String> existingTopics) {
        String messages = PromptText.formatMessages(recentMessages);
        String points = PromptText.formatRecallPoints(allPoints, currentPoint.getRecallPointId());
        String existing = existingTopics.isEmpty() ? "" : """
                ## Tangents Already Tracked
                These tangent topics are already open in this session:
                %s

                Do not report them again unless the conversation left them and came back.
                """.formatted(IntStream.range(0, existingTopics.size())
                        .mapToObj(i -> (i + 1) + ". " + PromptText.sanitize(existingTopics.get(i)))
                        .collect(Collectors.joining("\n")));

        return """
                You analyze tutoring conversations and notice when they drift off topic.

                ## Task
                Decide whether the recent conversation has wandered into a "rabbithole": a tangent away \
                from the recall point the learner is supposed to be recalling.

                ## Current Recall Point
                <current_recall_point>
                %s
                </current_recall_point>

                ## Recent Conversation
                <recent_messages>
                %s
                </recent_messages>

                ## Session Recall Points
                If the tangent touches any of these, list their IDs:
                %s

                %s
                ## It IS a rabbithole when the conversation
                - talks about something that does not help recall the current point
                - explores interesting but tangential detail
                - has spent two or more exchanges on another subject

                ## It is NOT a rabbithole when
                - the learner is working toward the current point, even with difficulty
                - a single clarifying exchange helps understanding
                - context around the point is used to trigger recall

                ## Depth
                - 1: one or two exchanges, easy to recover
                - 2: three to five exchanges, needs gentle redirection
                - 3: more than five exchanges, far from the recall topic

                ## Response Format
                Respond with ONLY this JSON object:
                {
                  "isRabbithole": boolean,
                  "topic": string | null,
                  "depth": 1 | 2 | 3,
                  "relatedToCurrentPoint": boolean,
                  "relatedRecallPointIds": string[],
                  "confidence": number between 0.0 and 1.0,
                  "reasoning": one to three sentences
                }
                """.formatted(
                PromptText.sanitize(currentPoint.getContent()),
                messages.isEmpty() ? "[No messages provided]" : messages,
                points,
                existing);
    }

    public static String buildReturnPrompt(String rabbitholeTopic,
                                           RecallPointDocument currentPoint,
                                           List<SessionMessageDocument> recentMessages) {
        String messages = PromptText.formatMessages(recentMessages);
        return """
                You analyze tutoring conversations and judge whether a tangent has ended.

                ## Task
                Decide whether the conversation has come back from the tangent below to the recall topic, \
                or moved on to productive discussion of it.

                ## Tangent
                <rabbithole_topic>
                %s
                </rabbithole_topic>

                ## Recall Point
                <current_recall_point>
                %s
                </current_recall_point>

                ## Recent Conversation
                <recent_messages>
                %s
                </recent_messages>

                ## It HAS returned when
                - the recall point is being discussed again
                - the tutor redirected and the learner followed
                - nobody is discussing the tangent anymore

                ## It has NOT returned when
                - the tangent is still being explored or has spawned sub-tangents
                - the learner keeps asking about the tangent
                - a redirect was attempted but ignored

                ## Response Format
                Respond with ONLY this JSON object:
                {
                  "hasReturned": boolean,
                  "confidence": number between 0.0 and 1.0,
                  "reasoning": one to three sentences
                }
                """.formatted(
                PromptText.sanitize(rabbitholeTopic),
                PromptText.sanitize(currentPoint.getContent()),
                messages.isEmpty() ? "[No messages provided]" : messages);
    }

    public static DetectionResult parseDetection(String response) {
        if (response == null || response.isBlank()) {
            return DetectionResult.none("Failed to parse detection response");
        }
        Optional<JsonNode> parsed = JsonResponses.readObject(response);
        if (parsed.isEmpty()) {
            return DetectionResult.none("Failed to parse detection response: " + JsonResponses.head(response));
        }
        JsonNode node = parsed.get();
        return new DetectionResult(
                JsonResponses.booleanOr(node, "isRabbithole", false),
                JsonResponses.textOr(node, "topic", null),
                JsonResponses.depth(node.get("depth")),
                JsonResponses.booleanOr(node, "relatedToCurrentPoint", false),
                JsonResponses.stringList(node, "relatedRecallPointIds"),
                JsonResponses.confidence(node.get("confidence")),
                JsonResponses.textOr(node, "reasoning", "No reasoning provided"));
    }

    public static ReturnResult parseReturn(String response) {
        if (response == null || response.isBlank()) {
            return new ReturnResult(false, 0, "Failed to parse return detection response");
        }
        Optional<JsonNode> parsed = JsonResponses.readObject(response);
        if (parsed.isEmpty()) {
            return new ReturnResult(false, 0,
                    "Failed to parse return detection response: " + JsonResponses.head(response));
        }
        JsonNode node = parsed.get();
        return new ReturnResult(
                JsonResponses.booleanOr(node, "hasReturned", false),
                JsonResponses.confidence(node.get("confidence")),
                JsonResponses.textOr(node, "reasoning", "No reasoning provided"));
    }
}
