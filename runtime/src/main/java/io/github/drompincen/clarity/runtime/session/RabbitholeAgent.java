package io.github.drompincen.clarity.runtime.session;

import io.github.drompincen.clarity.persistence.document.RecallSetDocument;
import io.github.drompincen.clarity.runtime.llm.CompletionOptions;
import io.github.drompincen.clarity.runtime.llm.LlmClient;
import io.github.drompincen.clarity.runtime.llm.LlmMessage;
import io.github.drompincen.clarity.runtime.prompt.TutorPrompts;

import java.util.ArrayList;
import java.util.List;

/**
 * Exploration partner for one tangent. Keeps its own conversation, separate from the tutor's.
 */
public class RabbitholeAgent {

    static final CompletionOptions OPENING_OPTIONS = CompletionOptions.of(0.7, 256);
    static final CompletionOptions REPLY_OPTIONS = CompletionOptions.of(0.7, 512);

    private final LlmClient llmClient;
    private final String topic;
    private final String systemPrompt;
    private final List<LlmMessage> history = new ArrayList<>();

    public RabbitholeAgent(LlmClient llmClient, String topic, RecallSetDocument recallSet) {
        this.llmClient = llmClient;
        this.topic = topic;
        this.systemPrompt = TutorPrompts.buildRabbitholeSystemPrompt(topic, recallSet);
    }

    public String generateOpeningMessage() {
        // the provider wants a learner turn first
        history.add(LlmMessage.user(
                "I'm curious about \"" + topic + "\". Tell me what you'd like to explore, I'll follow your lead."));
        return reply(OPENING_OPTIONS);
    }

    public String generateResponse(String userMessage) {
        history.add(LlmMessage.user(userMessage));
        return reply(REPLY_OPTIONS);
    }

    public List<LlmMessage> getConversationHistory() {
        return List.copyOf(history);
    }

    public String getTopic() {
        return topic;
    }

    private String reply(CompletionOptions options) {
        String text = llmClient.chat(systemPrompt, List.copyOf(history), options).text();
        history.add(LlmMessage.assistant(text));
        return text;
    }
}
