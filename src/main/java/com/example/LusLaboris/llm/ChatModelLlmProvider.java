package com.example.LusLaboris.llm;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Base for providers backed by a Spring AI {@link ChatModel}.
 * Subclasses only contribute the vendor-specific options.
 */
public abstract class ChatModelLlmProvider implements LlmProvider {

    public static final String SYSTEM_PROMPT = "Eres un asistente especializado en derecho laboral paraguayo.";

    private final ChatClient chatClient;
    private final String model;
    private final Duration timeout;

    protected ChatModelLlmProvider(ChatModel chatModel, String model, Duration timeout) {
        this.chatClient = ChatClient.builder(chatModel)
                .defaultSystem(SYSTEM_PROMPT)
                .build();
        this.model = model;
        this.timeout = timeout;
    }

    protected abstract ChatOptions options();

    @Override
    public String complete(String prompt) {
        // Blocking HTTP call: keep it off the caller's thread so the timeout can fire
        String content = Mono.fromCallable(() -> chatClient.prompt()
                        .user(prompt)
                        .options(options())
                        .call()
                        .content())
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .block();

        if (content == null || content.isBlank()) {
            throw new LlmGenerationException(provider() + " returned an empty completion");
        }
        return content.trim();
    }

    @Override
    public String model() {
        return model;
    }
}
