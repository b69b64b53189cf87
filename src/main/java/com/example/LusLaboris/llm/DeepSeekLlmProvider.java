package com.example.LusLaboris.llm;

import com.example.LusLaboris.config.RagProperties;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.deepseek.DeepSeekChatOptions;

public class DeepSeekLlmProvider extends ChatModelLlmProvider {

    public static final String NAME = "deepseek";

    private final DeepSeekChatOptions options;

    public DeepSeekLlmProvider(DeepSeekChatModel chatModel, RagProperties.Llm settings) {
        super(chatModel, settings.getModel(), settings.getTimeout());
        this.options = DeepSeekChatOptions.builder()
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
