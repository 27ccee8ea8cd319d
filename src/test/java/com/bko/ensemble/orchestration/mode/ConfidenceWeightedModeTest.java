package com.bko.ensemble.orchestration.mode;

import com.bko.ensemble.orchestration.mode.ConfidenceWeightedMode.ParsedConfidence;
import com.bko.ensemble.orchestration.model.ModeResult;
import com.bko.ensemble.orchestration.model.ResultKind;
import com.bko.ensemble.orchestration.runner.ScriptedInvoker;
import com.bko.ensemble.orchestration.state.ConfidenceState;
import com.bko.ensemble.orchestration.state.ConfidenceState.ConfidenceResponse;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceWeightedModeTest extends ModeScenarioSupport {

    private final ConfidenceWeightedMode mode = new ConfidenceWeightedMode(promptService);

    @Test
    void testParseFractionalConfidence() {
        ParsedConfidence parsed = ConfidenceWeightedMode.parseConfidence("Paris is the capital.\nCONFIDENCE: 0.85");
        assertEquals("Paris is the capital.", parsed.content());
        assertEquals(0.85, parsed.confidence(), 1e-9);
    }

    @Test
    void testParsePercentageConfidence() {
        ParsedConfidence parsed = ConfidenceWeightedMode.parseConfidence("Probably.\nConfidence: 85");
        assertEquals("Probably.", parsed.content());
        assertEquals(0.85, parsed.confidence(), 1e-9);
    }

    @Test
    void testOutOfRangeConfidenceFallsBackToDefault() {
        ParsedConfidence parsed = ConfidenceWeightedMode.parseConfidence("Sure.\nCONFIDENCE: 250");
        assertEquals("Sure.", parsed.content());
        assertEquals(ConfidenceWeightedMode.DEFAULT_CONFIDENCE, parsed.confidence());
    }

    @Test
    void testMissingTrailerKeepsContent() {
        ParsedConfidence parsed = ConfidenceWeightedMode.parseConfidence("No score here.");
        assertEquals("No score here.", parsed.content());
        assertEquals(ConfidenceWeightedMode.DEFAULT_CONFIDENCE, parsed.confidence());
    }

    @Test
    void testSynthesisOrdersResponsesByConfidence() {
        ScriptedInvoker invoker = new ScriptedInvoker(request -> {
            switch (request.modelId()) {
                case "provider/model-2":
                    return "Low answer\nCONFIDENCE: 0.2";
                case "provider/model-3":
                    return "High answer\nCONFIDENCE: 0.9";
                default:
                    return "weighted synthesis";
            }
        });

        List<ModeResult> results = run(mode, "question", instances(3), invoker);

        assertEquals("weighted synthesis", results.get(0).content());
        assertEquals(ResultKind.SYNTHESIS, results.get(0).metadata().kind());
        String prompt = ScriptedInvoker.systemPrompt(invoker.requestsTo("provider/model-1").get(0));
        int high = prompt.indexOf("[provider/model-3] (Confidence: 90%):\nHigh answer");
        int low = prompt.indexOf("[provider/model-2] (Confidence: 20%):\nLow answer");
        assertTrue(high >= 0);
        assertTrue(low > high);

        ConfidenceState state = finalState(ConfidenceState.class);
        assertEquals(2, state.responses().size());
        assertTrue(state.responses().stream().map(ConfidenceResponse::content).noneMatch(c -> c.contains("CONFIDENCE")));
    }
}
