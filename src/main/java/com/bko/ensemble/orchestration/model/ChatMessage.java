package com.bko.ensemble.orchestration.model;

import jakarta.validation.constraints.NotBlank;
import org.springframework.lang.Nullable;

public record ChatMessage(
        @NotBlank String role,
        String content,
        @Nullable String model
) {

    public static ChatMessage user(String content) {
        return new ChatMessage(InputItem.USER, content, null);
    }

    public static ChatMessage assistant(String content, String model) {
        return new ChatMessage(InputItem.ASSISTANT, content, model);
    }
}
