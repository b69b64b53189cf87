package com.example.LusLaboris.llm;

import com.example.LusLaboris.config.RagProperties;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;

public class OpenAiLlmProvider extends ChatModelLlmProvider {

    public static final String NAME = "openai";

    private final OpenAiChatOptions options;

    public OpenAiLlmProvider(OpenAiChatModel chatModel, RagProperties.Llm settings) {
        super(chatModel, settings.getModel(), settings.getTimeout());
        this.options = OpenAiChatOptions.builder()
                .model(settings.getModel())
                .temperature(settings.getTemperature())
                .maxTokens(settings.getMaxTokens())
                .build();
    }

    @Override
    protected ChatOptions options() {
        return options;
    }

    @Override
    public String provider() {
        return NAME;
    }
}
