package com.bko.ensemble.orchestration.service;

import com.bko.ensemble.orchestration.ModeConstants;
import com.bko.ensemble.orchestration.model.ModeConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModePromptServiceTest {

    private final ModePromptService promptService = new ModePromptService();

    @Test
    void testRenderIsSinglePass() {
        String rendered = promptService.render("Q: {question} / {answer}",
                Map.of("question", "what is {answer}?", "answer", "42"));
        assertEquals("Q: what is {answer}? / 42", rendered);
    }

    @Test
    void testRenderKeepsUnknownPlaceholders() {
        assertEquals("Hello {name}", promptService.render("Hello {name}", Map.of("other", "x")));
    }

    @Test
    void testRenderValueWithDollarSign() {
        assertEquals("Cost: $5", promptService.render("Cost: {price}", Map.of("price", "$5")));
    }

    @Test
    void testCustomPromptReplacesTemplate() {
        ModeConfig config = ModeConfig.builder().critiquePrompt("Be harsh about: {response}").build();
        assertEquals("Be harsh about: draft", promptService.critiquePrompt(config, "draft"));
    }

    @Test
    void testBlankCustomPromptUsesTemplate() {
        ModeConfig config = ModeConfig.builder().critiquePrompt("   ").build();
        String prompt = promptService.critiquePrompt(config, "draft");
        assertTrue(prompt.startsWith("Review the answer below"));
        assertTrue(prompt.contains("draft"));
    }

    @Test
    void testRoleAssignmentListsMembers() {
        String prompt = promptService.councilRoleAssignmentPrompt("Should we migrate?", List.of("gpt-4o", "claude"));
        assertTrue(prompt.contains("There are 2 members:\n- gpt-4o\n- claude"));
        assertTrue(prompt.contains("{\"member-one\": \"Security Reviewer\""));
    }

    @Test
    void testAudienceGuidelines() {
        assertEquals(ModeConstants.AUDIENCE_GUIDELINES.get("expert"), promptService.audienceGuidelines("Expert"));
        assertEquals(ModeConstants.GENERIC_AUDIENCE_GUIDELINES, promptService.audienceGuidelines("astronaut"));
    }

    @Test
    void testExplainerSimplifyPrompt() {
        String prompt = promptService.explainerSimplifyPrompt("beginner", "Black holes", "Dense objects...");
        assertTrue(prompt.startsWith("Adapt an existing explanation for a beginner audience."));
        assertTrue(prompt.contains("Dense objects..."));
        assertTrue(prompt.contains("Lean on analogies"));
    }
}
