package com.eainde.admission.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Chat model connection. Any OpenAI compatible endpoint works through {@code admission.llm.base-url}.
 */
@Log4j2
@Configuration
public class LlmConfig {

    @Value("${admission.llm.base-url:https://api.openai.com/v1}")
    private String baseUrl;

    @Value("${admission.llm.api-key:${OPENAI_API_KEY:not-configured}}")
    private String apiKey;

    @Value("${admission.llm.model-name:gpt-4o-mini}")
    private String modelName;

    @Value("${admission.llm.temperature:0.1}")
    private double temperature;

    @Value("${admission.llm.timeout:60s}")
    private Duration timeout;

    @Value("${admission.llm.log-requests:false}")
    private boolean logRequests;

    @Bean
    public ChatModelLoggingListener chatModelLoggingListener() {
        return new ChatModelLoggingListener();
    }

    @Bean
    @ConditionalOnMissingBean(ChatModel.class)
    public ChatModel chatModel(ChatModelLoggingListener listener) {
        if ("not-configured".equals(apiKey)) {
            log.warn("admission.llm.api-key is not set; model calls will fail until it is configured");
        }
        log.info("Using chat model {} at {}", modelName, baseUrl);
        return OpenAiChatModel.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(temperature)
                .timeout(timeout)
                // retries are handled per stage by RetryPolicy
                .maxRetries(0)
                .logRequests(logRequests)
                .logResponses(logRequests)
                .listeners(List.of(listener))
                .build();
    }
}
