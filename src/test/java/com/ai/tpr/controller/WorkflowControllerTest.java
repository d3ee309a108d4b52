package com.ai.tpr.controller;

import com.ai.tpr.calculation.AgeGroup;
import com.ai.tpr.calculation.FacilityRecord;
import com.ai.tpr.conversation.IntentKind;
import com.ai.tpr.conversation.IntentResult;
import com.ai.tpr.conversation.WorkflowStage;
import com.ai.tpr.dto.DatasetSummary;
import com.ai.tpr.dto.WorkflowResponse;
import com.ai.tpr.dto.WorkflowResponse.ResponseType;
import com.ai.tpr.exception.MalformedIntentException;
import com.ai.tpr.exception.SessionConflictException;
import com.ai.tpr.exception.SessionNotFoundException;
import com.ai.tpr.service.DatasetProfiler;
import com.ai.tpr.service.DatasetRegistry;
import com.ai.tpr.service.WorkflowEngine;
import com.ai.tpr.service.WorkflowOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class WorkflowControllerTest {

    @Mock
    private DatasetRegistry datasetRegistry;

    @Mock
    private DatasetProfiler profiler;

    @Mock
    private WorkflowEngine workflowEngine;

    @Mock
    private WorkflowOrchestrator orchestrator;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new WorkflowController(datasetRegistry, profiler, workflowEngine, orchestrator))
                .setControllerAdvice(new WorkflowExceptionHandler())
                .build();
    }

    private static WorkflowResponse response(ResponseType type, WorkflowStage stage) {
        return WorkflowResponse.builder()
                .sessionId("s1")
                .type(type)
                .message("ok")
                .stage(stage)
                .selections(Map.of())
                .build();
    }

    @Test
    @SuppressWarnings("unchecked")
    void registersDatasetAndReturnsProfile() throws Exception {
        when(profiler.summarize(eq("upload-1"), anyList()))
                .thenReturn(DatasetSummary.builder().datasetHandle("upload-1").recordCount(1).states(List.of()).build());

        mockMvc.perform(put("/api/tpr/datasets/upload-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"facilityName\":\"PHC Gwale\",\"ward\":\"Gwale\",\"lga\":\"Gwale\",\"state\":\"Kano\","
                                + "\"facilityLevel\":\"phc\",\"tests\":{\"UNDER_FIVE\":{\"rdtTested\":10,\"rdtPositive\":2}}}]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.datasetHandle").value("upload-1"));

        ArgumentCaptor<List<FacilityRecord>> records = ArgumentCaptor.forClass(List.class);
        verify(datasetRegistry).register(eq("upload-1"), records.capture());
        FacilityRecord record = records.getValue().get(0);
        assertThat(record.getFacilityName()).isEqualTo("PHC Gwale");
        assertThat(record.testsFor(AgeGroup.UNDER_FIVE).getRdtPositive()).isEqualTo(2.0);
    }

    @Test
    void startsWorkflowForRegisteredDataset() throws Exception {
        DatasetSummary summary = DatasetSummary.builder().datasetHandle("upload-1").states(List.of()).build();
        when(datasetRegistry.find("upload-1")).thenReturn(Optional.of(List.of()));
        when(profiler.summarize("upload-1", List.of())).thenReturn(summary);
        when(workflowEngine.startWorkflow("s1", summary))
                .thenReturn(response(ResponseType.OPTIONS, WorkflowStage.STATE_SELECTION));

        mockMvc.perform(post("/api/tpr/sessions/s1/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"datasetHandle\":\"upload-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("OPTIONS"))
                .andExpect(jsonPath("$.stage").value("STATE_SELECTION"))
                .andExpect(jsonPath("$.wards").doesNotExist());
    }

    @Test
    void unknownDatasetIsNotFound() throws Exception {
        when(datasetRegistry.find("missing")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/tpr/sessions/s1/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"datasetHandle\":\"missing\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.sessionId").value("s1"));
    }

    @Test
    void messagesGoThroughTheOrchestrator() throws Exception {
        when(orchestrator.process("s1", "go back"))
                .thenReturn(response(ResponseType.NAVIGATED_BACK, WorkflowStage.STATE_SELECTION));

        mockMvc.perform(post("/api/tpr/sessions/s1/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"go back\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("NAVIGATED_BACK"));
    }

    @Test
    void typedIntentsGoStraightToTheEngine() throws Exception {
        when(workflowEngine.handleInput(eq("s1"), any(IntentResult.class)))
                .thenReturn(response(ResponseType.OPTIONS, WorkflowStage.FACILITY_LEVEL_SELECTION));

        mockMvc.perform(post("/api/tpr/sessions/s1/intents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"SELECTION\",\"extractedValue\":\"Kano\",\"confidence\":0.9}"))
                .andExpect(status().isOk());

        ArgumentCaptor<IntentResult> intent = ArgumentCaptor.forClass(IntentResult.class);
        verify(workflowEngine).handleInput(eq("s1"), intent.capture());
        assertThat(intent.getValue().getKind()).isEqualTo(IntentKind.SELECTION);
        assertThat(intent.getValue().getExtractedValue()).isEqualTo("Kano");
    }

    @Test
    void malformedIntentIsUnprocessable() throws Exception {
        when(workflowEngine.handleInput(eq("s1"), any(IntentResult.class)))
                .thenThrow(new MalformedIntentException("s1", null));

        mockMvc.perform(post("/api/tpr/sessions/s1/intents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"extractedValue\":\"Kano\",\"confidence\":0.9}"))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void intentWithoutConfidenceIsUnprocessable() throws Exception {
        when(workflowEngine.handleInput(eq("s1"), argThat(intent -> !intent.isWellFormed())))
                .thenThrow(new MalformedIntentException("s1", null));

        mockMvc.perform(post("/api/tpr/sessions/s1/intents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"SELECTION\",\"extractedValue\":\"1\"}"))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void unknownSessionIsNotFound() throws Exception {
        when(workflowEngine.status("nobody")).thenThrow(new SessionNotFoundException("nobody"));

        mockMvc.perform(get("/api/tpr/sessions/nobody"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Not Found"));
    }

    @Test
    void exhaustedConflictIsConflict() throws Exception {
        when(orchestrator.process("s1", "1")).thenThrow(new SessionConflictException("s1", 1L, 2L));

        mockMvc.perform(post("/api/tpr/sessions/s1/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"1\"}"))
                .andExpect(status().isConflict());
    }
}
