package com.openforge.toolflow.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolflow.llm.LlmClient;
import com.openforge.toolflow.llm.LlmRouter;
import com.openforge.toolflow.llm.model.ChatRequest;
import com.openforge.toolflow.llm.model.ChatResponse;
import com.openforge.toolflow.llm.model.Message;
import com.openforge.toolflow.llm.model.Tool;
import com.openforge.toolflow.llm.model.ToolCall;
import com.openforge.toolflow.tool.DynamicToolExecutor;
import com.openforge.toolflow.tool.ToolDescriptor;
import com.openforge.toolflow.tool.ToolResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bounded function-calling loop against an OpenAI-compatible backend.
 *
 * Loop shape:
 *   for round in 1..maxToolCalls:
 *     1. THINK   : send the transcript with the advertised tools
 *     2. DECIDE  : no tool calls? return the text (completed)
 *     3. ACT     : execute every requested call, append one tool message each
 *   FINALIZE     : one last call without tools (max_iterations_reached)
 *
 * So a run makes at most maxToolCalls + 1 backend calls.  Tool failures and
 * unknown tool names are reported back to the model and never abort the run.
 * A backend failure ({@link LlmClient.LlmException}) ends the run with the
 * fallback answer; the tool calls made before it stay in the outcome.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolOrchestrator {

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {};

    private final LlmRouter           llmRouter;
    private final DynamicToolExecutor toolExecutor;
    private final FallbackResponder   fallbackResponder;
    private final ObjectMapper        objectMapper;

    public OrchestrationOutcome run(String label,
                                    List<Message> seed,
                                    List<ToolDescriptor> tools,
                                    int maxToolCalls,
                                    GenerationSettings settings) {
        List<Message> transcript = new ArrayList<>(seed);
        Map<String, ToolDescriptor> available = new LinkedHashMap<>();
        tools.forEach(tool -> available.put(tool.name(), tool));
        List<Tool> advertised = tools.stream().map(this::toTool).toList();

        Set<String> toolsUsed = new LinkedHashSet<>();
        List<ToolInvocation> toolResults = new ArrayList<>();

        try {
            for (int round = 1; round <= maxToolCalls; round++) {
                log.debug("[Orchestrator:{}] Round {}/{}", label, round, maxToolCalls);

                // ── THINK ────────────────────────────────────────────────────────
                ChatResponse response = llmRouter.chat(ChatRequest.withTools(List.copyOf(transcript), advertised,
                        settings.maxTokens(), settings.temperature(), settings.stop()));

                // ── DECIDE ───────────────────────────────────────────────────────
                if (!response.hasToolCalls()) {
                    log.info("[Orchestrator:{}] Completed in {} round(s)", label, round);
                    return new OrchestrationOutcome(response.text(), List.copyOf(toolsUsed),
                            List.copyOf(toolResults), round, RunStatus.COMPLETED);
                }

                // ── ACT ──────────────────────────────────────────────────────────
                Message assistant = response.firstMessage();
                List<ToolCall> calls = withIds(assistant.toolCalls(), round);
                transcript.add(Message.assistantToolCalls(assistant.content(), calls));

                for (ToolCall call : calls) {
                    String toolName = call.functionName();
                    Map<String, Object> arguments = parseArguments(label, call);
                    ToolDescriptor tool = available.get(toolName);

                    if (tool == null) {
                        String error = "Tool '%s' not found".formatted(toolName);
                        log.warn("[Orchestrator:{}] {}", label, error);
                        toolResults.add(ToolInvocation.failed(toolName, arguments, error));
                        transcript.add(Message.toolResult(call.id(), error));
                        continue;
                    }

                    log.info("[Orchestrator:{}] Executing tool '{}' args={}", label, toolName, arguments);
                    ToolResponse outcome = toolExecutor.execute(tool, arguments);
                    toolsUsed.add(toolName);
                    if (outcome.success()) {
                        toolResults.add(ToolInvocation.succeeded(toolName, arguments, outcome.result()));
                        transcript.add(Message.toolResult(call.id(), toJson(outcome.result())));
                    } else {
                        toolResults.add(ToolInvocation.failed(toolName, arguments, outcome.errorMessage()));
                        transcript.add(Message.toolResult(call.id(), "Error: " + outcome.errorMessage()));
                    }
                }
            }

            // ── FINALIZE ─────────────────────────────────────────────────────────
            log.warn("[Orchestrator:{}] Tool budget ({}) exhausted, requesting final answer", label, maxToolCalls);
            ChatResponse last = llmRouter.chat(ChatRequest.simple(List.copyOf(transcript),
                    settings.maxTokens(), settings.temperature(), settings.stop()));
            return new OrchestrationOutcome(last.text(), List.copyOf(toolsUsed),
                    List.copyOf(toolResults), maxToolCalls, RunStatus.MAX_ITERATIONS_REACHED);
        } catch (LlmClient.LlmException e) {
            log.warn("[Orchestrator:{}] Backend unavailable after {} tool call(s), answering in fallback mode: {}",
                    label, toolResults.size(), e.getMessage());
            return new OrchestrationOutcome(fallbackResponder.respond(lastUserPrompt(seed), llmRouter.modelName()),
                    List.copyOf(toolsUsed), List.copyOf(toolResults), 0, RunStatus.FALLBACK);
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    Tool toTool(ToolDescriptor descriptor) {
        JsonNode parameters = objectMapper.valueToTree(descriptor.parameterSchema());
        return Tool.function(descriptor.name(), descriptor.description(), parameters);
    }

    private static String lastUserPrompt(List<Message> seed) {
        for (int i = seed.size() - 1; i >= 0; i--) {
            if (Message.USER.equals(seed.get(i).role())) {
                return seed.get(i).content();
            }
        }
        return "";
    }

    /** Malformed or missing arguments are treated as an empty map. */
    private Map<String, Object> parseArguments(String label, ToolCall call) {
        String raw = call.function() == null ? null : call.function().arguments();
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(raw, ARGUMENTS_TYPE);
            return parsed == null ? Map.of() : parsed;
        } catch (JsonProcessingException e) {
            log.warn("[Orchestrator:{}] Malformed tool arguments, using empty map: {}", label, raw);
            return Map.of();
        }
    }

    /** Backends are not required to send call ids; tool messages need one. */
    private static List<ToolCall> withIds(List<ToolCall> calls, int round) {
        List<ToolCall> result = new ArrayList<>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            ToolCall call = calls.get(i);
            if (call.id() == null || call.id().isBlank()) {
                call = call.withId("call_%d_%d".formatted(round, i));
            }
            result.add(call);
        }
        return result;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
