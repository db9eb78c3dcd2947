package io.github.drompincen.clarity.runtime.llm;

public record CompletionOptions(double temperature, int maxTokens) {

    public static CompletionOptions of(double temperature, int maxTokens) {
        return new CompletionOptions(temperature, maxTokens);
    }
}
