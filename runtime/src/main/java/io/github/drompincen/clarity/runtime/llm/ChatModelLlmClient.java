package io.github.drompincen.clarity.runtime.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * LLM client backed by Spring AI chat models. Uses whichever provider has a real
 * (non-placeholder) key; the configured provider is tried first, then the other one.
 */
@Service
@ConditionalOnExpression("'${clarity.llm.provider:anthropic}' != 'fake'")
public class ChatModelLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(ChatModelLlmClient.class);

    private final AnthropicChatModel anthropicModel;
    private final OpenAiChatModel openaiModel;
    private final Environment environment;
    private final String preferredProvider;

    public ChatModelLlmClient(@Autowired(required = false) AnthropicChatModel anthropicModel,
                              @Autowired(required = false) OpenAiChatModel openaiModel,
                              Environment environment,
                              @Value("${clarity.llm.provider:anthropic}") String preferredProvider) {
        this.anthropicModel = anthropicModel;
        this.openaiModel = openaiModel;
        this.environment = environment;
        this.preferredProvider = preferredProvider;
        log.info("ChatModelLlmClient initialized: preferred={}, anthropic={}, openai={}",
                preferredProvider,
                anthropicModel != null ? "available" : "missing",
                openaiModel != null ? "available" : "missing");
    }

    private enum Provider { ANTHROPIC, OPENAI, NONE }

    private boolean hasRealKey(String key, String placeholderPrefix) {
        return key != null && !key.isBlank() && !key.startsWith(placeholderPrefix);
    }

    private boolean anthropicReady() {
        return anthropicModel != null
                && hasRealKey(environment.getProperty("spring.ai.anthropic.api-key", ""), "sk-ant-placeholder");
    }

    private boolean openAiReady() {
        return openaiModel != null
                && hasRealKey(environment.getProperty("spring.ai.openai.api-key", ""), "sk-placeholder");
    }

    private Provider resolveProvider() {
        if ("openai".equalsIgnoreCase(preferredProvider)) {
            if (openAiReady()) return Provider.OPENAI;
            if (anthropicReady()) return Provider.ANTHROPIC;
        } else {
            if (anthropicReady()) return Provider.ANTHROPIC;
            if (openAiReady()) return Provider.OPENAI;
        }
        return Provider.NONE;
    }

    @Override
    public boolean isAvailable() {
        return resolveProvider() != Provider.NONE;
    }

    private ChatModel getActiveModel() {
        return switch (resolveProvider()) {
            case ANTHROPIC -> anthropicModel;
            case OPENAI -> openaiModel;
            case NONE -> throw new LlmException(
                    "No LLM provider configured: set ANTHROPIC_API_KEY or OPENAI_API_KEY, or clarity.llm.provider=fake");
        };
    }

    @Override
    public LlmResponse complete(String prompt, CompletionOptions options) {
        return call(List.of(new UserMessage(prompt)), options);
    }

    @Override
    public LlmResponse chat(String systemPrompt, List<LlmMessage> history, CompletionOptions options) {
        List<Message> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(new SystemMessage(systemPrompt));
        }
        for (LlmMessage msg : history) {
            switch (msg.role()) {
                case ASSISTANT -> messages.add(new AssistantMessage(msg.content()));
                case SYSTEM -> messages.add(new SystemMessage(msg.content()));
                case USER -> messages.add(new UserMessage(msg.content()));
            }
        }
        return call(messages, options);
    }

    private LlmResponse call(List<Message> messages, CompletionOptions options) {
        ChatModel model = getActiveModel();
        ChatOptions chatOptions = ChatOptions.builder()
                .temperature(options.temperature())
                .maxTokens(options.maxTokens())
                .build();
        log.debug("LLM call via {}: {} messages, temperature={}, maxTokens={}",
                resolveProvider(), messages.size(), options.temperature(), options.maxTokens());
        ChatResponse response;
        try {
            response = model.call(new Prompt(messages, chatOptions));
        } catch (RuntimeException e) {
            throw new LlmException("LLM call failed: " + e.getMessage(), e);
        }
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new LlmException("LLM returned no completion");
        }
        return new LlmResponse(response.getResult().getOutput().getText());
    }
}
