package com.ai.tpr.controller;

import com.ai.tpr.calculation.FacilityRecord;
import com.ai.tpr.conversation.IntentResult;
import com.ai.tpr.dto.DatasetSummary;
import com.ai.tpr.dto.MessageRequest;
import com.ai.tpr.dto.StartWorkflowRequest;
import com.ai.tpr.dto.WorkflowResponse;
import com.ai.tpr.exception.DatasetNotFoundException;
import com.ai.tpr.service.DatasetProfiler;
import com.ai.tpr.service.DatasetRegistry;
import com.ai.tpr.service.WorkflowEngine;
import com.ai.tpr.service.WorkflowOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/tpr")
public class WorkflowController {

    private static final Logger log = LoggerFactory.getLogger(WorkflowController.class);

    private final DatasetRegistry datasetRegistry;
    private final DatasetProfiler profiler;
    private final WorkflowEngine workflowEngine;
    private final WorkflowOrchestrator orchestrator;

    public WorkflowController(DatasetRegistry datasetRegistry, DatasetProfiler profiler,
                              WorkflowEngine workflowEngine, WorkflowOrchestrator orchestrator) {
        this.datasetRegistry = datasetRegistry;
        this.profiler = profiler;
        this.workflowEngine = workflowEngine;
        this.orchestrator = orchestrator;
    }

    @PutMapping("/datasets/{handle}")
    public ResponseEntity<DatasetSummary> registerDataset(@PathVariable String handle,
                                                          @RequestBody List<FacilityRecord> records) {
        datasetRegistry.register(handle, records);
        return ResponseEntity.ok(profiler.summarize(handle, records));
    }

    @PostMapping("/sessions/{sessionId}/start")
    public ResponseEntity<WorkflowResponse> start(@PathVariable String sessionId,
                                                  @RequestBody StartWorkflowRequest request) {
        String handle = request.getDatasetHandle();
        List<FacilityRecord> records = datasetRegistry.find(handle)
                .orElseThrow(() -> new DatasetNotFoundException(sessionId, handle));
        log.info("[{}] start requested for dataset {}", sessionId, handle);
        return ResponseEntity.ok(workflowEngine.startWorkflow(sessionId, profiler.summarize(handle, records)));
    }

    @PostMapping("/sessions/{sessionId}/messages")
    public ResponseEntity<WorkflowResponse> message(@PathVariable String sessionId,
                                                    @RequestBody MessageRequest request) {
        return ResponseEntity.ok(orchestrator.process(sessionId, request.getMessage()));
    }

    @PostMapping("/sessions/{sessionId}/intents")
    public ResponseEntity<WorkflowResponse> intent(@PathVariable String sessionId,
                                                   @RequestBody IntentResult intent) {
        return ResponseEntity.ok(workflowEngine.handleInput(sessionId, intent));
    }

    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<WorkflowResponse> status(@PathVariable String sessionId) {
        return ResponseEntity.ok(workflowEngine.status(sessionId));
    }
}
