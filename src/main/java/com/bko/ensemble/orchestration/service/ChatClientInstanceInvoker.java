package com.bko.ensemble.orchestration.service;

import com.bko.ensemble.config.EnsembleProperties;
import com.bko.ensemble.orchestration.model.InputItem;
import com.bko.ensemble.orchestration.model.MessageUsage;
import com.bko.ensemble.orchestration.model.ModelParameters;
import com.bko.ensemble.orchestration.model.StreamResult;
import com.bko.ensemble.orchestration.runner.InstanceInvoker;
import com.bko.ensemble.orchestration.runner.InvocationRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Calls a model through Spring AI. The provider is taken from a {@code provider/} prefix on the model id,
 * falling back to {@code ensemble.ai-provider}.
 */
@Service
@Slf4j
public class ChatClientInstanceInvoker implements InstanceInvoker {

    private final ChatClient chatClient;
    private final ChatClient openAiChatClient;
    private final EnsembleProperties properties;

    public ChatClientInstanceInvoker(@Qualifier("chatClient") ObjectProvider<ChatClient> chatClientProvider,
                                     @Qualifier("openAiChatClient") ObjectProvider<ChatClient> openAiChatClientProvider,
                                     EnsembleProperties properties) {
        this.chatClient = chatClientProvider.getIfAvailable();
        this.openAiChatClient = openAiChatClientProvider.getIfAvailable();
        this.properties = properties;
    }

    @Override
    @Nullable
    public StreamResult invoke(InvocationRequest request) {
        if (request.token().isCancelled()) {
            return null;
        }
        try {
            ProviderModel target = resolve(request.modelId());
            ChatClient client = target.provider() == EnsembleProperties.AiProvider.OPENAI ? openAiChatClient : chatClient;
            if (client == null) {
                throw new IllegalStateException(target.provider() + " provider is not properly configured. "
                        + "Check that you have a valid API key in your configuration.");
            }
            log.debug("Invoking {} via {} (stream={}, items={}).", target.model(), target.provider(),
                    request.streamId(), request.input().size());
            ChatResponse response = client.prompt()
                    .messages(toMessages(request))
                    .options(options(target, request.parameters()))
                    .call()
                    .chatResponse();
            if (request.token().isCancelled()) {
                return null;
            }
            if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
                log.warn("Model {} returned no result (stream={}).", request.modelId(), request.streamId());
                return null;
            }
            String text = response.getResult().getOutput().getText();
            if (!StringUtils.hasText(text)) {
                log.warn("Model {} returned empty content (stream={}).", request.modelId(), request.streamId());
                return null;
            }
            return new StreamResult(text, usage(response));
        } catch (RuntimeException ex) {
            log.warn("Model call to {} failed (stream={}): {}", request.modelId(), request.streamId(), ex.getMessage());
            return null;
        }
    }

    ProviderModel resolve(String modelId) {
        int slash = modelId.indexOf('/');
        if (slash > 0) {
            String prefix = modelId.substring(0, slash).toUpperCase(Locale.ROOT);
            for (EnsembleProperties.AiProvider provider : EnsembleProperties.AiProvider.values()) {
                if (provider.name().equals(prefix)) {
                    return new ProviderModel(provider, modelId.substring(slash + 1));
                }
            }
        }
        return new ProviderModel(properties.getAiProvider(), modelId);
    }

    private List<Message> toMessages(InvocationRequest request) {
        List<Message> messages = new ArrayList<>(request.input().size() + 1);
        if (StringUtils.hasText(request.label())) {
            messages.add(new SystemMessage("You are " + request.label() + "."));
        }
        for (InputItem item : request.input()) {
            switch (item.role()) {
                case InputItem.SYSTEM -> messages.add(new SystemMessage(item.content()));
                case InputItem.ASSISTANT -> messages.add(new AssistantMessage(item.content()));
                default -> messages.add(new UserMessage(item.content()));
            }
        }
        return messages;
    }

    private ChatOptions options(ProviderModel target, ModelParameters parameters) {
        if (target.provider() == EnsembleProperties.AiProvider.OPENAI) {
            return OpenAiChatOptions.builder()
                    .model(target.model())
                    .temperature(parameters.temperature())
                    .topP(parameters.topP())
                    .maxTokens(parameters.maxTokens())
                    .frequencyPenalty(parameters.frequencyPenalty())
                    .presencePenalty(parameters.presencePenalty())
                    .build();
        }
        return ChatOptions.builder()
                .model(target.model())
                .temperature(parameters.temperature())
                .topP(parameters.topP())
                .topK(parameters.topK())
                .maxTokens(parameters.maxTokens())
                .frequencyPenalty(parameters.frequencyPenalty())
                .presencePenalty(parameters.presencePenalty())
                .build();
    }

    @Nullable
    private MessageUsage usage(ChatResponse response) {
        if (response.getMetadata() == null || response.getMetadata().getUsage() == null) {
            return null;
        }
        Usage usage = response.getMetadata().getUsage();
        long input = usage.getPromptTokens() != null ? usage.getPromptTokens() : 0;
        long output = usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0;
        long total = usage.getTotalTokens() != null ? usage.getTotalTokens() : input + output;
        return new MessageUsage(input, output, total, 0);
    }

    record ProviderModel(EnsembleProperties.AiProvider provider, String model) {
    }
}
