package com.bko.ensemble.stream;

import com.bko.ensemble.orchestration.model.ModeResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ModeStreamServiceTest {

    private ModeStreamHub hub;
    private ModeStreamService service;

    @BeforeEach
    void setUp() {
        hub = mock(ModeStreamHub.class);
        service = new ModeStreamService(hub);
    }

    @Test
    void testLongOutputIsSplitIntoSequencedChunks() {
        String content = "x".repeat(ModeStreamService.CHUNK_SIZE * 2 + 100);

        service.emitInstanceOutput("run-1", "m1", "openai/gpt-4o", content);

        ArgumentCaptor<Object> payloads = ArgumentCaptor.forClass(Object.class);
        verify(hub, times(3)).emit(eq("run-1"), eq(StreamEventType.INSTANCE_OUTPUT), payloads.capture());
        List<Object> captured = payloads.getAllValues();
        for (int i = 0; i < 3; i++) {
            Map<?, ?> chunk = payloadMap(captured.get(i));
            assertEquals(i, chunk.get("sequence"));
            assertEquals("m1", chunk.get("streamId"));
            assertEquals("openai/gpt-4o", chunk.get("model"));
            assertEquals(i == 2, chunk.get("done"));
        }
        assertEquals(100, assertInstanceOf(String.class, payloadMap(captured.get(2)).get("chunk")).length());
    }

    @Test
    void testFailedCallSendsSingleDoneChunk() {
        service.emitInstanceOutput("run-1", "m2", "anthropic/claude", null);

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(hub).emit(eq("run-1"), eq(StreamEventType.INSTANCE_OUTPUT), payload.capture());
        Map<?, ?> chunk = payloadMap(payload.getValue());
        assertEquals(true, chunk.get("done"));
        assertEquals(true, chunk.get("failed"));
        assertEquals("", chunk.get("chunk"));
    }

    @Test
    void testEmptyOutputIsNotMarkedFailed() {
        service.emitInstanceOutput("run-1", "m2", "anthropic/claude", "");

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(hub).emit(eq("run-1"), eq(StreamEventType.INSTANCE_OUTPUT), payload.capture());
        assertEquals(false, payloadMap(payload.getValue()).get("failed"));
    }

    @Test
    void testResultsKeepEmptyPositions() {
        List<ModeResult> results = Arrays.asList(null, null);

        service.emitResults("run-1", results);

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(hub).emit(eq("run-1"), eq(StreamEventType.RESULT), payload.capture());
        List<?> sent = assertInstanceOf(List.class, payloadMap(payload.getValue()).get("results"));
        assertEquals(2, sent.size());
        assertNull(sent.get(0));
    }

    @Test
    void testErrorWithoutMessage() {
        service.emitError("run-1", null);

        verify(hub).emit("run-1", StreamEventType.ERROR, Map.of("message", "Unknown error"));
    }

    private static Map<?, ?> payloadMap(Object payload) {
        return assertInstanceOf(Map.class, payload);
    }
}
