package com.openforge.toolflow.workflow;

import com.openforge.toolflow.agent.AgentInvocationResult;
import com.openforge.toolflow.agent.AgentService;
import com.openforge.toolflow.tool.DynamicToolExecutor;
import com.openforge.toolflow.tool.ToolDescriptor;
import com.openforge.toolflow.tool.ToolRegistry;
import com.openforge.toolflow.tool.ToolResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Executes pre-declared workflows against a shared, mutable context.
 *
 * Run shape:
 *   for each step, strictly in order:
 *     1. RESOLVE : substitute {{placeholders}} from the context
 *     2. RUN     : tool_call | agent_call | condition
 *     3. MERGE   : successful output is merged into the context
 *     4. CHECK   : a failed step ends the run (fail-fast)
 *
 * Every finished run is appended to an in-memory history and never mutated
 * afterwards.  Steps are never retried.
 */
@Slf4j
@Service
public class WorkflowEngine {

    private final ToolRegistry        toolRegistry;
    private final DynamicToolExecutor toolExecutor;
    private final TemplateResolver    templateResolver;
    private final ConditionEvaluator  conditionEvaluator;
    private final AgentService        agentService;

    private final Map<String, WorkflowDefinition> workflows = new ConcurrentHashMap<>();
    private final List<WorkflowExecution>         history   = Collections.synchronizedList(new ArrayList<>());

    /**
     * @param agentService model collaborator for agent_call steps; when null
     *                     every agent_call step fails
     */
    public WorkflowEngine(ToolRegistry toolRegistry,
                          DynamicToolExecutor toolExecutor,
                          TemplateResolver templateResolver,
                          ConditionEvaluator conditionEvaluator,
                          @Nullable AgentService agentService) {
        this.toolRegistry       = toolRegistry;
        this.toolExecutor       = toolExecutor;
        this.templateResolver   = templateResolver;
        this.conditionEvaluator = conditionEvaluator;
        this.agentService       = agentService;
    }

    // ── Definitions ──────────────────────────────────────────────────────────

    /** Defines (or replaces) a workflow; its status starts as "defined". */
    public WorkflowDefinition defineWorkflow(String name, List<WorkflowStep> steps) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Workflow name must not be blank");
        }
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("Workflow '%s' must have at least one step".formatted(name));
        }
        WorkflowDefinition definition = new WorkflowDefinition(name, steps, WorkflowStatus.DEFINED, Instant.now());
        if (workflows.put(name, definition) != null) {
            log.info("[Workflow:{}] Redefined with {} step(s)", name, steps.size());
        } else {
            log.info("[Workflow:{}] Defined with {} step(s)", name, steps.size());
        }
        return definition;
    }

    public Optional<WorkflowDefinition> getWorkflow(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(workflows.get(name));
    }

    public List<WorkflowDefinition> listWorkflows() {
        return workflows.values().stream()
                .sorted(Comparator.comparing(WorkflowDefinition::name))
                .toList();
    }

    /** @throws WorkflowNotFoundException for an unknown name */
    public WorkflowStatus getWorkflowStatus(String name) {
        return getWorkflow(name).map(WorkflowDefinition::status)
                .orElseThrow(() -> new WorkflowNotFoundException(name));
    }

    /** Finished executions, oldest first; all workflows when {@code name} is null. */
    public List<WorkflowExecution> getExecutionHistory(@Nullable String name) {
        synchronized (history) {
            return history.stream()
                    .filter(execution -> name == null || execution.workflowName().equals(name))
                    .toList();
        }
    }

    // ── Execution ────────────────────────────────────────────────────────────

    /**
     * Runs the workflow.  {@code context} is copied; the caller's map is not modified.
     *
     * @throws WorkflowNotFoundException for an unknown name
     */
    public WorkflowExecution executeWorkflow(String name, Map<String, Object> context) {
        WorkflowDefinition definition = getWorkflow(name).orElseThrow(() -> new WorkflowNotFoundException(name));
        String executionId = UUID.randomUUID().toString();
        Instant start = Instant.now();
        Map<String, Object> shared = new LinkedHashMap<>();
        if (context != null) {
            shared.putAll(context);
        }

        updateStatus(name, WorkflowStatus.RUNNING);
        log.info("[Workflow:{}] Execution {} started ({} step(s))", name, executionId, definition.steps().size());

        List<StepResult> results = new ArrayList<>();
        WorkflowStatus status = WorkflowStatus.COMPLETED;
        String error = null;

        for (WorkflowStep step : definition.steps()) {
            StepResult result = executeStep(name, step, shared);
            results.add(result);
            if (!result.success()) {
                status = WorkflowStatus.FAILED;
                error = result.error();
                log.warn("[Workflow:{}] Step '{}' failed: {}", name, step.name(), error);
                break;
            }
            shared.putAll(result.output());
        }

        updateStatus(name, status);
        WorkflowExecution execution = new WorkflowExecution(executionId, name, status, List.copyOf(results),
                Collections.unmodifiableMap(new LinkedHashMap<>(shared)), error, start, Instant.now());
        history.add(execution);
        log.info("[Workflow:{}] Execution {} finished: {}", name, executionId, status.value());
        return execution;
    }

    private StepResult executeStep(String workflow, WorkflowStep step, Map<String, Object> context) {
        Instant start = Instant.now();
        log.debug("[Workflow:{}] Step '{}' ({})", workflow, step.name(), step.type().value());
        try {
            Map<String, Object> output = switch (step.type()) {
                case TOOL_CALL -> runTool(step, context);
                case AGENT_CALL -> runAgent(step, context);
                case CONDITION -> runCondition(step, context);
            };
            return StepResult.succeeded(step, output, start);
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.toString();
            return StepResult.failed(step, message, start);
        }
    }

    // ── Step kinds ───────────────────────────────────────────────────────────

    private Map<String, Object> runTool(WorkflowStep step, Map<String, Object> context) {
        ToolDescriptor tool = toolRegistry.get(step.toolName())
                .orElseThrow(() -> new StepFailedException("Tool '%s' not found".formatted(step.toolName())));
        Map<String, Object> parameters = templateResolver.resolveMap(step.parameters(), context);

        ToolResponse response = toolExecutor.execute(tool, parameters);
        if (!response.success()) {
            throw new StepFailedException(response.errorMessage());
        }
        Map<String, Object> output = new LinkedHashMap<>();
        if (response.result() instanceof Map<?, ?> map) {
            map.forEach((key, value) -> output.put(String.valueOf(key), value));
        } else {
            output.put("result", response.result());
        }
        return output;
    }

    private Map<String, Object> runAgent(WorkflowStep step, Map<String, Object> context) {
        if (agentService == null) {
            throw new StepFailedException("No model service available for agent '%s'".formatted(step.agentName()));
        }
        String prompt = templateResolver.render(step.promptTemplate(), context);
        AgentInvocationResult response = agentService.invokeAgent(step.agentName(), prompt,
                null, null, null, true, null);

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("agent_response", response.text());
        output.put("tools_used", response.toolsUsed());
        return output;
    }

    private Map<String, Object> runCondition(WorkflowStep step, Map<String, Object> context) {
        boolean result = conditionEvaluator.evaluate(step.condition(), context);
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("condition_result", result);
        return output;
    }

    private void updateStatus(String name, WorkflowStatus status) {
        workflows.computeIfPresent(name, (key, current) -> current.withStatus(status));
    }

    // ── Exception types ──────────────────────────────────────────────────────

    public static class WorkflowNotFoundException extends RuntimeException {
        public WorkflowNotFoundException(String name) {
            super("Workflow '%s' not found".formatted(name));
        }
    }

    static class StepFailedException extends RuntimeException {
        StepFailedException(String message) {
            super(message);
        }
    }
}
