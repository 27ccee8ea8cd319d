package com.bko.ensemble.orchestration.support;

import com.bko.ensemble.orchestration.model.ChatMessage;
import com.bko.ensemble.orchestration.model.HistoryMode;
import com.bko.ensemble.orchestration.model.InputItem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessageHistoryTest {

    private final List<ChatMessage> history = List.of(
            ChatMessage.user("first question"),
            ChatMessage.assistant("gpt answer", "openai/gpt-4o"),
            ChatMessage.assistant("claude answer", "anthropic/claude"),
            ChatMessage.assistant("", "openai/gpt-4o"),
            ChatMessage.user("follow up"));

    @Test
    void testAllModeKeepsEveryNonEmptyMessage() {
        List<InputItem> items = MessageHistory.historyInput(history, HistoryMode.ALL, "openai/gpt-4o");

        assertEquals(4, items.size());
        assertEquals(InputItem.assistant("claude answer"), items.get(2));
    }

    @Test
    void testSameModelKeepsOnlyOwnAssistantTurns() {
        List<InputItem> items = MessageHistory.historyInput(history, HistoryMode.SAME_MODEL, "openai/gpt-4o");

        assertEquals(List.of(
                InputItem.user("first question"),
                InputItem.assistant("gpt answer"),
                InputItem.user("follow up")), items);
    }

    @Test
    void testConversationInputAppendsUserTurn() {
        List<InputItem> items = MessageHistory.conversationInput(List.of(), HistoryMode.ALL, "any", "new question");

        assertEquals(List.of(InputItem.user("new question")), items);
    }
}
