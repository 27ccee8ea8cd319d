package com.bko.ensemble.orchestration.mode;

import com.bko.ensemble.orchestration.model.ModeConfig;
import com.bko.ensemble.orchestration.model.ModeResult;
import com.bko.ensemble.orchestration.model.ResultKind;
import com.bko.ensemble.orchestration.runner.InvocationRequest;
import com.bko.ensemble.orchestration.runner.ScriptedInvoker;
import com.bko.ensemble.orchestration.state.CritiquedState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CritiquedModeTest extends ModeScenarioSupport {

    private final CritiquedMode mode = new CritiquedMode(promptService);

    @Test
    void testPrimaryRevisesAfterCritiques() {
        ScriptedInvoker invoker = new ScriptedInvoker(request -> script(request, "provider/model-1"));

        List<ModeResult> results = run(mode, "Explain recursion", instances(3), invoker);

        assertEquals("revised answer", results.get(0).content());
        assertEquals(ResultKind.SYNTHESIS, results.get(0).metadata().kind());
        assertEquals(60, results.get(0).metadata().aggregateUsage().totalTokens());

        CritiquedState state = finalState(CritiquedState.class);
        assertEquals("initial answer", state.initialResponse());
        assertEquals(2, state.critiques().size());
        assertEquals(List.of("provider/model-2", "provider/model-3"), state.critiqueModels());

        String revisionPrompt = ScriptedInvoker.systemPrompt(invoker.requestsTo("provider/model-1").get(1));
        assertTrue(revisionPrompt.contains("initial answer"));
        assertTrue(revisionPrompt.contains("[provider/model-2]:\ncritique from provider/model-2"));
    }

    @Test
    void testNoCritiquesReturnsInitialAnswer() {
        ScriptedInvoker invoker = new ScriptedInvoker(request ->
                request.modelId().equals("provider/model-1") ? "initial answer" : null);

        List<ModeResult> results = run(mode, "question", instances(3), invoker);

        assertEquals("initial answer", results.get(0).content());
        assertEquals(ResultKind.DIRECT, results.get(0).metadata().kind());
        assertEquals(3, invoker.requests().size());
    }

    @Test
    void testFailedRevisionKeepsInitialAnswer() {
        ScriptedInvoker invoker = new ScriptedInvoker(request -> isRevision(request) ? null
                : script(request, "provider/model-1"));

        List<ModeResult> results = run(mode, "question", instances(2), invoker);

        assertEquals("initial answer", results.get(0).content());
        assertEquals(ResultKind.DIRECT, results.get(0).metadata().kind());
    }

    @Test
    void testConfiguredPrimary() {
        ScriptedInvoker invoker = new ScriptedInvoker(request -> script(request, "provider/model-3"));

        List<ModeResult> results = run(mode, "question", instances(3),
                ModeConfig.builder().primaryInstanceId("m3").build(), invoker);

        assertEquals("revised answer", results.get(2).content());
        assertEquals(List.of("provider/model-1", "provider/model-2"),
                finalState(CritiquedState.class).critiqueModels());
    }

    @Test
    void testSingleInstanceHasNoCritics() {
        ScriptedInvoker invoker = new ScriptedInvoker(request -> "anything");

        List<ModeResult> results = run(mode, "question", instances(1), invoker);

        assertTrue(results.isEmpty());
        assertTrue(invoker.requests().isEmpty());
    }

    private static String script(InvocationRequest request, String primaryModel) {
        if (!request.modelId().equals(primaryModel)) {
            return "critique from " + request.modelId();
        }
        return isRevision(request) ? "revised answer" : "initial answer";
    }

    private static boolean isRevision(InvocationRequest request) {
        return ScriptedInvoker.systemPrompt(request).startsWith("Reviewers critiqued");
    }
}
