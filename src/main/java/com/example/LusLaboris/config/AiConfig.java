package com.example.LusLaboris.config;

import com.example.LusLaboris.llm.ChatClientEvaluationClassifier;
import com.example.LusLaboris.llm.DeepSeekLlmProvider;
import com.example.LusLaboris.llm.EvaluationClassifier;
import com.example.LusLaboris.llm.LlmProvider;
import com.example.LusLaboris.llm.OpenAiLlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

@Configuration
public class AiConfig {

    private static final Logger log = LoggerFactory.getLogger(AiConfig.class);

    /**
     * The answering backend is resolved once here from {@code lus-laboris.llm.provider};
     * the generator only ever sees the {@link LlmProvider} interface.
     * A provider whose ChatModel bean is missing (e.g. no API key) fails startup.
     */
    @Bean
    public LlmProvider llmProvider(
            RagProperties properties,
            ObjectProvider<OpenAiChatModel> openAiProvider,
            ObjectProvider<DeepSeekChatModel> deepSeekProvider
    ) {
        RagProperties.Llm settings = properties.getLlm();
        String provider = settings.getProvider() == null ? "" : settings.getProvider().toLowerCase(Locale.ROOT);

        LlmProvider llmProvider = switch (provider) {
            case OpenAiLlmProvider.NAME -> new OpenAiLlmProvider(
                    require(openAiProvider.getIfAvailable(), provider), settings);
            case DeepSeekLlmProvider.NAME -> new DeepSeekLlmProvider(
                    require(deepSeekProvider.getIfAvailable(), provider), settings);
            default -> throw new IllegalStateException("Unsupported LLM provider: " + settings.getProvider());
        };

        log.info("LLM provider initialized: {}/{}", llmProvider.provider(), llmProvider.model());
        return llmProvider;
    }

    /**
     * Evaluation always runs on OpenAI with a cheap model. Without an OpenAI
     * ChatModel the evaluator is registered as unavailable and turns itself off.
     */
    @Bean
    public EvaluationClassifier evaluationClassifier(
            RagProperties properties,
            ObjectProvider<OpenAiChatModel> openAiProvider
    ) {
        OpenAiChatModel model = openAiProvider.getIfAvailable();
        if (model == null) {
            return EvaluationClassifier.unavailable("no OpenAI chat model configured");
        }

        ChatClient chatClient = ChatClient.builder(model).build();
        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .model(properties.getEvaluation().getModel())
                .temperature(0.0)
                .build();
        return new ChatClientEvaluationClassifier(chatClient, options);
    }

    private static <T> T require(T model, String provider) {
        if (model == null) {
            throw new IllegalStateException("No ChatModel bean is available for LLM provider '" + provider + "'");
        }
        return model;
    }
}
