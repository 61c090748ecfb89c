package com.openforge.toolflow.workflow;

import com.openforge.toolflow.workflow.dto.WorkflowDefinitionRequest;
import com.openforge.toolflow.workflow.dto.WorkflowExecuteRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * REST API for workflows.
 *
 * Endpoints:
 *   GET  /api/workflows                    : list definitions
 *   POST /api/workflows                    : define (or replace) a workflow
 *   GET  /api/workflows/{name}             : get one definition
 *   GET  /api/workflows/{name}/status      : current status of a definition
 *   POST /api/workflows/{name}/execute     : run synchronously, returns the execution trace
 *   GET  /api/workflows/history            : finished executions (optional ?workflow_name=)
 *
 * A failed run is still HTTP 200; the trace carries status "failed".
 */
@Slf4j
@RestController
@RequestMapping("/api/workflows")
@RequiredArgsConstructor
public class WorkflowController {

    private final WorkflowEngine workflowEngine;

    @GetMapping
    public List<WorkflowDefinition> listWorkflows() {
        return workflowEngine.listWorkflows();
    }

    @PostMapping
    public ResponseEntity<WorkflowDefinition> defineWorkflow(@Valid @RequestBody WorkflowDefinitionRequest request) {
        try {
            WorkflowDefinition definition = workflowEngine.defineWorkflow(request.name(), request.steps());
            return ResponseEntity.status(HttpStatus.CREATED).body(definition);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }

    @GetMapping("/history")
    public List<WorkflowExecution> history(@RequestParam(name = "workflow_name", required = false) String name) {
        return workflowEngine.getExecutionHistory(name);
    }

    @GetMapping("/{name}")
    public WorkflowDefinition getWorkflow(@PathVariable String name) {
        return workflowEngine.getWorkflow(name)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Workflow not found: " + name));
    }

    @GetMapping("/{name}/status")
    public Map<String, Object> status(@PathVariable String name) {
        try {
            return Map.of("workflow_name", name, "status", workflowEngine.getWorkflowStatus(name).value());
        } catch (WorkflowEngine.WorkflowNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    @PostMapping("/{name}/execute")
    public WorkflowExecution execute(@PathVariable String name,
                                     @RequestBody(required = false) WorkflowExecuteRequest request) {
        Map<String, Object> context = request == null ? Map.of() : request.contextOrEmpty();
        try {
            return workflowEngine.executeWorkflow(name, context);
        } catch (WorkflowEngine.WorkflowNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }
}
