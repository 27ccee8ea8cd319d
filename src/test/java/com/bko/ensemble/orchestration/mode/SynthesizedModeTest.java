package com.bko.ensemble.orchestration.mode;

import com.bko.ensemble.orchestration.model.ModeConfig;
import com.bko.ensemble.orchestration.model.ModeResult;
import com.bko.ensemble.orchestration.model.ResultKind;
import com.bko.ensemble.orchestration.runner.InvocationRequest;
import com.bko.ensemble.orchestration.runner.ScriptedInvoker;
import com.bko.ensemble.orchestration.state.SynthesizedState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SynthesizedModeTest extends ModeScenarioSupport {

    private final SynthesizedMode mode = new SynthesizedMode(promptService);

    @Test
    void testSynthesizerMergesOtherAnswers() {
        ScriptedInvoker invoker = new ScriptedInvoker(request ->
                request.modelId().equals("provider/model-1") ? "merged answer" : "answer from " + request.modelId());

        List<ModeResult> results = run(mode, "What is Java?", instances(3), invoker);

        assertEquals(3, results.size());
        assertEquals("merged answer", results.get(0).content());
        assertNull(results.get(1));
        assertNull(results.get(2));
        assertEquals(ResultKind.SYNTHESIS, results.get(0).metadata().kind());
        assertEquals(45, results.get(0).metadata().aggregateUsage().totalTokens());

        InvocationRequest synthesis = invoker.requestsTo("provider/model-1").get(0);
        String prompt = ScriptedInvoker.systemPrompt(synthesis);
        assertTrue(prompt.contains("[provider/model-2]:\nanswer from provider/model-2"));
        assertTrue(prompt.contains("[provider/model-3]:\nanswer from provider/model-3"));
        assertEquals("What is Java?", ScriptedInvoker.lastUserMessage(synthesis));

        SynthesizedState state = finalState(SynthesizedState.class);
        assertEquals(SynthesizedState.Phase.DONE, state.phase());
        assertEquals(2, state.sourceResponses().size());
    }

    @Test
    void testConfiguredSynthesizerModel() {
        ScriptedInvoker invoker = new ScriptedInvoker(request ->
                request.modelId().equals("provider/model-3") ? "merged" : "answer");
        ModeConfig config = ModeConfig.builder().synthesizerModel("provider/model-3").build();

        List<ModeResult> results = run(mode, "question", instances(3), config, invoker);

        assertNull(results.get(0));
        assertEquals("merged", results.get(2).content());
        assertEquals(1, invoker.requestsTo("provider/model-3").size());
    }

    @Test
    void testNoSynthesisWhenEveryResponderFails() {
        ScriptedInvoker invoker = new ScriptedInvoker(request ->
                request.modelId().equals("provider/model-1") ? "merged" : null);

        List<ModeResult> results = run(mode, "question", instances(3), invoker);

        assertEquals(0, nonNull(results));
        assertTrue(invoker.requestsTo("provider/model-1").isEmpty());
    }

    @Test
    void testCustomSynthesisPromptIsRendered() {
        ScriptedInvoker invoker = new ScriptedInvoker(request -> "text");
        ModeConfig config = ModeConfig.builder().synthesisPrompt("Combine these: {responses}").build();

        run(mode, "question", instances(2), config, invoker);

        String prompt = ScriptedInvoker.systemPrompt(invoker.requestsTo("provider/model-1").get(0));
        assertEquals("Combine these: [provider/model-2]:\ntext", prompt);
    }
}
