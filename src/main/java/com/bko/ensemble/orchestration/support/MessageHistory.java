package com.bko.ensemble.orchestration.support;

import com.bko.ensemble.orchestration.model.ChatMessage;
import com.bko.ensemble.orchestration.model.HistoryMode;
import com.bko.ensemble.orchestration.model.InputItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class MessageHistory {

    private MessageHistory() {
    }

    public static List<ChatMessage> filter(List<ChatMessage> history, HistoryMode mode, String modelId) {
        if (mode == HistoryMode.ALL) {
            return history;
        }
        return history.stream()
                .filter(message -> InputItem.USER.equals(message.role())
                        || (InputItem.ASSISTANT.equals(message.role()) && Objects.equals(message.model(), modelId)))
                .toList();
    }

    public static List<InputItem> toInputItems(List<ChatMessage> messages) {
        List<InputItem> items = new ArrayList<>(messages.size());
        for (ChatMessage message : messages) {
            if (message.content() == null || message.content().isEmpty()) {
                continue;
            }
            items.add(new InputItem(message.role(), message.content()));
        }
        return items;
    }

    public static List<InputItem> historyInput(List<ChatMessage> history, HistoryMode mode, String modelId) {
        return toInputItems(filter(history, mode, modelId));
    }

    public static List<InputItem> conversationInput(List<ChatMessage> history, HistoryMode mode, String modelId,
                                                    String userContent) {
        List<InputItem> items = historyInput(history, mode, modelId);
        items.add(InputItem.user(userContent));
        return items;
    }
}
