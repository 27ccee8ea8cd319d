package com.bko.ensemble.orchestration.mode;

import static com.bko.ensemble.orchestration.ModeConstants.CONSENSUS_INSTRUCTION;

import com.bko.ensemble.orchestration.model.ModeConfig;
import com.bko.ensemble.orchestration.model.ModeResult;
import com.bko.ensemble.orchestration.model.ResultKind;
import com.bko.ensemble.orchestration.runner.ScriptedInvoker;
import com.bko.ensemble.orchestration.state.CandidateResponse;
import com.bko.ensemble.orchestration.state.ConsensusState;
import com.bko.ensemble.orchestration.support.TextSimilarity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsensusModeTest extends ModeScenarioSupport {

    private final ConsensusMode mode = new ConsensusMode(promptService, properties);

    @Test
    void testIdenticalRevisionsReachConsensusInFirstRound() {
        ScriptedInvoker invoker = new ScriptedInvoker(request -> "The capital of France is Paris.");

        List<ModeResult> results = run(mode, "Capital of France?", instances(3), invoker);

        assertEquals(1, nonNull(results));
        ModeResult selected = results.stream().filter(result -> result != null).findFirst().orElseThrow();
        assertEquals("The capital of France is Paris.", selected.content());
        assertEquals(ResultKind.SELECTION, selected.metadata().kind());

        ConsensusState state = finalState(ConsensusState.class);
        assertTrue(state.consensusReached());
        assertEquals(1.0, state.finalScore());
        assertEquals(2, state.rounds().size());
        assertEquals(6, invoker.requests().size());
        assertEquals(90, selected.metadata().aggregateUsage().totalTokens());
    }

    @Test
    void testDisagreementRunsUntilMaxRounds() {
        ScriptedInvoker invoker = new ScriptedInvoker(request -> request.modelId().equals("provider/model-1")
                ? "apples oranges bananas"
                : "trucks planes trains");
        ModeConfig config = ModeConfig.builder().maxConsensusRounds(3).consensusThreshold(0.9).build();

        run(mode, "question", instances(2), config, invoker);

        ConsensusState state = finalState(ConsensusState.class);
        assertFalse(state.consensusReached());
        assertEquals(3, state.rounds().size());
        assertEquals(0.0, state.finalScore());
        assertEquals(6, invoker.requests().size());
        assertNotNull(state.representative());
    }

    @Test
    void testRevisionPromptCarriesPreviousAnswers() {
        ScriptedInvoker invoker = new ScriptedInvoker(request -> CONSENSUS_INSTRUCTION.equals(
                ScriptedInvoker.lastUserMessage(request)) ? "shared final wording" : "first draft from " + request.modelId());

        run(mode, "question", instances(2), invoker);

        String revisionPrompt = invoker.requests().stream()
                .filter(request -> CONSENSUS_INSTRUCTION.equals(ScriptedInvoker.lastUserMessage(request)))
                .map(ScriptedInvoker::systemPrompt)
                .findFirst()
                .orElseThrow();
        assertTrue(revisionPrompt.contains("--- provider/model-1 ---\nfirst draft from provider/model-1"));
        assertTrue(revisionPrompt.contains("--- provider/model-2 ---\nfirst draft from provider/model-2"));
        assertTrue(finalState(ConsensusState.class).consensusReached());
    }

    @Test
    void testSingleInitialResponseSkipsRevision() {
        ScriptedInvoker invoker = new ScriptedInvoker(request ->
                request.modelId().equals("provider/model-2") ? "lonely answer" : null);

        List<ModeResult> results = run(mode, "question", instances(3), invoker);

        assertEquals("lonely answer", results.get(1).content());
        assertEquals(3, invoker.requests().size());
        assertFalse(finalState(ConsensusState.class).consensusReached());
    }

    @Test
    void testFailedRevisionRoundKeepsInitialAnswers() {
        ScriptedInvoker invoker = new ScriptedInvoker(request -> {
            if (CONSENSUS_INSTRUCTION.equals(ScriptedInvoker.lastUserMessage(request))) {
                return null;
            }
            return request.modelId().equals("provider/model-1")
                    ? "paris is the capital city"
                    : "lyon is the largest city";
        });
        ModeConfig config = ModeConfig.builder().maxConsensusRounds(2).consensusThreshold(0.95).build();

        List<ModeResult> results = run(mode, "question", instances(2), config, invoker);

        ConsensusState state = finalState(ConsensusState.class);
        assertEquals(2, state.rounds().size());
        List<CandidateResponse> initial = state.rounds().get(0).responses();
        assertEquals(2, initial.size());
        assertTrue(state.rounds().get(1).responses().isEmpty());
        assertFalse(state.consensusReached());
        double initialScore = TextSimilarity.roundScore(initial.stream().map(CandidateResponse::content).toList());
        assertEquals(initialScore, state.finalScore());
        assertEquals(initialScore, state.rounds().get(1).consensusScore());
        assertTrue(initial.contains(state.representative()));
        assertEquals(4, invoker.requests().size());
        assertEquals(1, nonNull(results));
    }

    @Test
    void testFormatResponses() {
        String formatted = ConsensusMode.formatResponses(List.of(
                new CandidateResponse("a", "alpha", "one", null),
                new CandidateResponse("b", "beta", "two", null)));

        assertEquals("--- alpha ---\none\n\n--- beta ---\ntwo", formatted);
    }
}
