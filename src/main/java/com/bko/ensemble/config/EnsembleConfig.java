package com.bko.ensemble.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.lang.Nullable;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Chat clients per provider and the two pools: {@code workerExecutor} runs model calls, and
 * {@code orchestrationExecutor} runs streamed modes in the background.
 */
@Configuration
@Slf4j
public class EnsembleConfig {

    @Bean
    @Primary
    public ChatClient chatClient(ObjectProvider<GoogleGenAiChatModel> googleGenAiChatModelProvider) {
        return clientFor("Google GenAI", googleGenAiChatModelProvider.getIfAvailable());
    }

    @Bean
    public ChatClient openAiChatClient(ObjectProvider<OpenAiChatModel> openAiChatModelProvider) {
        return clientFor("OpenAI", openAiChatModelProvider.getIfAvailable());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService workerExecutor(EnsembleProperties properties) {
        int threads = Math.max(1, properties.getWorkerConcurrency());
        log.info("Model call pool sized to {} thread(s).", threads);
        return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("mode-worker-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService orchestrationExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("mode-run-"));
    }

    @Nullable
    private static ChatClient clientFor(String provider, @Nullable ChatModel model) {
        if (model == null) {
            log.warn("No {} chat model is configured; instances on that provider will fail.", provider);
            return null;
        }
        return ChatClient.builder(model).build();
    }
}
