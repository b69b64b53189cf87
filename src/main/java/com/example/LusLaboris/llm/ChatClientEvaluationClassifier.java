package com.example.LusLaboris.llm;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;

/**
 * Classifier backed by a cheap chat model with deterministic sampling.
 */
public class ChatClientEvaluationClassifier implements EvaluationClassifier {

    private final ChatClient chatClient;
    private final ChatOptions options;

    public ChatClientEvaluationClassifier(ChatClient chatClient, ChatOptions options) {
        this.chatClient = chatClient;
        this.options = options;
    }

    @Override
    public String classify(String prompt) {
        String label = chatClient.prompt()
                .user(prompt)
                .options(options)
                .call()
                .content();
        return label == null ? "" : label.trim();
    }
}
