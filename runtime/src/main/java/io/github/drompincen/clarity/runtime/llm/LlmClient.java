package io.github.drompincen.clarity.runtime.llm;

import java.util.List;

public interface LlmClient {

    /** Single-shot completion of a self-contained prompt. */
    LlmResponse complete(String prompt, CompletionOptions options);

    /** Conversational completion: system prompt plus alternating learner/tutor turns. */
    LlmResponse chat(String systemPrompt, List<LlmMessage> history, CompletionOptions options);

    default boolean isAvailable() { return true; }
}
