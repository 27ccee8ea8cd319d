package com.bko.ensemble.orchestration.mode;

import static com.bko.ensemble.orchestration.ModeConstants.*;

import com.bko.ensemble.orchestration.model.ModeConfig;
import com.bko.ensemble.orchestration.model.ModeResult;
import com.bko.ensemble.orchestration.model.ResultKind;
import com.bko.ensemble.orchestration.runner.InvocationRequest;
import com.bko.ensemble.orchestration.runner.ScriptedInvoker;
import com.bko.ensemble.orchestration.state.DebatedState;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DebatedModeTest extends ModeScenarioSupport {

    private final DebatedMode mode = new DebatedMode(promptService, properties);
    private final ModeConfig oneRound = ModeConfig.builder().debateRounds(1).build();

    @Test
    void testPositionsAlternate() {
        Map<String, String> positions = DebatedMode.assignPositions(instances(3));

        assertEquals(Map.of("m1", POSITION_PRO, "m2", POSITION_CON, "m3", POSITION_PRO), positions);
    }

    @Test
    void testOneRoundDebateWithSummary() {
        ScriptedInvoker invoker = new ScriptedInvoker(DebatedModeTest::script);

        List<ModeResult> results = run(mode, "Is remote work better?", instances(2), oneRound, invoker);

        assertEquals(5, invoker.requests().size());
        assertEquals("balanced summary", results.get(0).content());
        assertNull(results.get(1));
        assertEquals(ResultKind.SYNTHESIS, results.get(0).metadata().kind());
        assertEquals("model-1", results.get(0).metadata().label());
        assertEquals(75, results.get(0).metadata().aggregateUsage().totalTokens());

        DebatedState state = finalState(DebatedState.class);
        assertEquals(DebatedState.Phase.DONE, state.phase());
        assertEquals(4, state.turns().size());
        assertEquals(2, state.turns().stream().filter(turn -> turn.round() == 1).count());
        assertTrue(state.currentRoundTurns().isEmpty());

        String rebuttalPrompt = invoker.requests().stream()
                .filter(request -> DEBATE_REBUTTAL_INSTRUCTION.equals(ScriptedInvoker.lastUserMessage(request)))
                .map(ScriptedInvoker::systemPrompt)
                .findFirst()
                .orElseThrow();
        assertTrue(rebuttalPrompt.contains("**model-1** (pro): opening from provider/model-1"));
        assertTrue(rebuttalPrompt.contains("**model-2** (con): opening from provider/model-2"));

        String summaryPrompt = invoker.requests().stream()
                .filter(request -> DEBATE_SUMMARY_INSTRUCTION.equals(ScriptedInvoker.lastUserMessage(request)))
                .map(ScriptedInvoker::systemPrompt)
                .findFirst()
                .orElseThrow();
        assertTrue(summaryPrompt.contains("### Opening Statements"));
        assertTrue(summaryPrompt.contains("### Round 1 Rebuttals"));
    }

    @Test
    void testFailedSummaryUsesFallbackText() {
        ScriptedInvoker invoker = new ScriptedInvoker(request ->
                DEBATE_SUMMARY_INSTRUCTION.equals(ScriptedInvoker.lastUserMessage(request)) ? null : script(request));

        List<ModeResult> results = run(mode, "question", instances(2), oneRound, invoker);

        assertEquals(DEBATE_SUMMARY_FALLBACK, results.get(0).content());
    }

    @Test
    void testSingleOpeningEndsDebateEarly() {
        ScriptedInvoker invoker = new ScriptedInvoker(request ->
                request.modelId().equals("provider/model-1") ? null : script(request));

        List<ModeResult> results = run(mode, "question", instances(2), oneRound, invoker);

        assertEquals(2, invoker.requests().size());
        assertNull(results.get(0));
        assertEquals("opening from provider/model-2", results.get(1).content());
        assertEquals(ResultKind.DIRECT, results.get(1).metadata().kind());
        assertEquals(POSITION_CON, results.get(1).metadata().label());
    }

    @Test
    void testDefaultRoundCountComesFromProperties() {
        properties.getModes().setDebateRounds(2);
        ScriptedInvoker invoker = new ScriptedInvoker(DebatedModeTest::script);

        run(mode, "question", instances(2), invoker);

        assertEquals(2 + 2 * 2 + 1, invoker.requests().size());
        assertEquals(2, finalState(DebatedState.class).totalRounds());
    }

    private static String script(InvocationRequest request) {
        String instruction = ScriptedInvoker.lastUserMessage(request);
        if (DEBATE_OPENING_INSTRUCTION.equals(instruction)) {
            return "opening from " + request.modelId();
        }
        if (DEBATE_REBUTTAL_INSTRUCTION.equals(instruction)) {
            return "rebuttal from " + request.modelId();
        }
        return "balanced summary";
    }
}
