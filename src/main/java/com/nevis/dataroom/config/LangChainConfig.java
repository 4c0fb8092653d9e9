package com.nevis.dataroom.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LangChainConfig {

    @Value("${app.gemini.api-key}")
    private String apiKey;

    /**
     * Retries are handled by the summarizer, so the client itself never retries.
     * Requests are not logged because page requests carry whole images.
     */
    @Bean
    public ChatModel chatLanguageModel(SummaryProperties summaryProperties) {
        return GoogleAiGeminiChatModel.builder()
            .apiKey(apiKey)
            .modelName(summaryProperties.model())
            .timeout(summaryProperties.timeout())
            .maxRetries(0)
            .logRequests(false)
            .logResponses(true)
            .build();
    }
}
