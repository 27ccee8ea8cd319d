package com.bko.ensemble.api;

import com.bko.ensemble.orchestration.ModeExecutionService;
import com.bko.ensemble.orchestration.mode.MultipleMode;
import com.bko.ensemble.orchestration.mode.ScattershotMode;
import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.ModeResult;
import com.bko.ensemble.orchestration.model.ModeRunCommand;
import com.bko.ensemble.orchestration.model.ModeRunOutcome;
import com.bko.ensemble.orchestration.runner.ModeSpec;
import com.bko.ensemble.orchestration.state.MultipleState;
import com.bko.ensemble.stream.ModeStreamService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ModeController.class)
class ModeControllerTest {

    private static final String RUN_BODY = """
            {
              "mode": "%s",
              "message": "What is Java?",
              "instances": [
                {"id": "a", "modelId": "openai/gpt-4o"},
                {"id": "%s", "modelId": "google/gemini"}
              ]
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ModeExecutionService executionService;

    @MockitoBean
    private ModeStreamService streamService;

    @MockitoBean(name = "orchestrationExecutor")
    private ExecutorService orchestrationExecutor;

    @Test
    void testListModesInDeclarationOrder() throws Exception {
        when(executionService.availableModes()).thenReturn(List.<ModeSpec<?>>of(new ScattershotMode(), new MultipleMode()));

        mockMvc.perform(get("/api/modes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("multiple"))
                .andExpect(jsonPath("$[1].id").value("scattershot"))
                .andExpect(jsonPath("$[1].minInstances").value(1));
    }

    @Test
    void testRunReturnsPositionalResults() throws Exception {
        List<ModeResult> results = Arrays.asList(new ModeResult("Java is a language.", null, null), null);
        when(executionService.run(any())).thenReturn(new ModeRunOutcome(ConversationMode.MULTIPLE, results,
                new MultipleState(MultipleState.Phase.DONE, List.of())));

        mockMvc.perform(post("/api/modes/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RUN_BODY.formatted("multiple", "b")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("multiple"))
                .andExpect(jsonPath("$.results[0].content").value("Java is a language."))
                .andExpect(jsonPath("$.results[1]").doesNotExist())
                .andExpect(jsonPath("$.finalState.mode").value("multiple"))
                .andExpect(jsonPath("$.finalState.phase").value("done"));

        ArgumentCaptor<ModeRunCommand> command = ArgumentCaptor.forClass(ModeRunCommand.class);
        verify(executionService).run(command.capture());
        assertEquals(ConversationMode.MULTIPLE, command.getValue().mode());
        assertEquals(2, command.getValue().instances().size());
        assertEquals("What is Java?", command.getValue().message());
    }

    @Test
    void testUnknownModeIsRejected() throws Exception {
        mockMvc.perform(post("/api/modes/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RUN_BODY.formatted("freestyle", "b")))
                .andExpect(status().isBadRequest());

        verify(executionService, never()).run(any());
    }

    @Test
    void testDuplicateInstanceIdsAreRejected() throws Exception {
        mockMvc.perform(post("/api/modes/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RUN_BODY.formatted("multiple", "a")))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testMissingInstancesFailValidation() throws Exception {
        mockMvc.perform(post("/api/modes/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mode\": \"multiple\", \"message\": \"hi\", \"instances\": []}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testIllegalArgumentBecomesBadRequest() throws Exception {
        when(executionService.run(any())).thenThrow(new IllegalArgumentException("Mode not available: multiple"));

        mockMvc.perform(post("/api/modes/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RUN_BODY.formatted("multiple", "b")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Mode not available: multiple"));
    }

    @Test
    void testStreamQueuesRun() throws Exception {
        when(streamService.createRun(ConversationMode.SYNTHESIZED)).thenReturn("run-1");

        mockMvc.perform(post("/api/modes/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RUN_BODY.formatted("synthesized", "b")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value("run-1"));

        verify(streamService).emitStatus("run-1", "Queued");
        verify(orchestrationExecutor).execute(any(Runnable.class));
    }

    @Test
    void testCancelRun() throws Exception {
        when(streamService.cancelRun("run-1")).thenReturn(true);

        mockMvc.perform(post("/api/modes/cancel/{runId}", "run-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"));

        mockMvc.perform(post("/api/modes/cancel/{runId}", "missing"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("not-found"));

        verify(streamService).cancelRun("run-1");
    }
}
