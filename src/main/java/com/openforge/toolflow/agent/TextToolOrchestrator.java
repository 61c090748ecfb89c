package com.openforge.toolflow.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolflow.llm.LlmClient;
import com.openforge.toolflow.llm.LlmRouter;
import com.openforge.toolflow.llm.model.ChatRequest;
import com.openforge.toolflow.llm.model.Message;
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
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tool loop for backends without native function calling.
 *
 * The tools are described in the prompt and the model is asked to answer with
 * either {@code <tool_call>{"tool_name": "...", "arguments": {...}}</tool_call>}
 * or {@code <final>...</final>}.  Output with neither marker (or with a tool
 * call that is not valid JSON) is returned as the answer, unchanged.  Never
 * throws: backend failures produce the fallback answer.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TextToolOrchestrator {

    private static final Pattern FINAL = Pattern.compile("<final>(.*?)</final>", Pattern.DOTALL);
    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {};
    private static final Pattern TOOL_CALL = Pattern.compile("<tool_call>(.*?)</tool_call>", Pattern.DOTALL);

    private final LlmRouter           llmRouter;
    private final DynamicToolExecutor toolExecutor;
    private final FallbackResponder   fallbackResponder;
    private final ObjectMapper        objectMapper;

    public OrchestrationOutcome run(String label,
                                    String systemPrompt,
                                    String userPrompt,
                                    List<ToolDescriptor> tools,
                                    int maxToolCalls,
                                    GenerationSettings settings) {
        Map<String, ToolDescriptor> available = new LinkedHashMap<>();
        tools.forEach(tool -> available.put(tool.name(), tool));
        Set<String> toolsUsed = new LinkedHashSet<>();
        List<ToolInvocation> toolResults = new ArrayList<>();

        StringBuilder prompt = new StringBuilder()
                .append("System:\n").append(systemPrompt).append("\n\n")
                .append(toolsPrompt(tools)).append("\n\n")
                .append("User:\n").append(userPrompt).append('\n');

        try {
            for (int round = 1; round <= maxToolCalls + 1; round++) {
                String output = complete(prompt.toString(), settings);

                Optional<String> answer = finalAnswer(output);
                if (answer.isPresent()) {
                    return outcome(answer.get(), toolsUsed, toolResults, round, RunStatus.COMPLETED);
                }
                Matcher call = TOOL_CALL.matcher(output);
                if (!call.find()) {
                    return outcome(output, toolsUsed, toolResults, round, RunStatus.COMPLETED);
                }
                JsonNode request;
                try {
                    request = objectMapper.readTree(call.group(1).strip());
                } catch (JsonProcessingException e) {
                    log.debug("[TextOrchestrator:{}] Unparseable tool call, returning raw output", label);
                    return outcome(output, toolsUsed, toolResults, round, RunStatus.COMPLETED);
                }

                String toolName = request.path("tool_name").asText(null);
                Map<String, Object> arguments = request.path("arguments").isObject()
                        ? objectMapper.convertValue(request.get("arguments"), ARGUMENTS_TYPE)
                        : Map.of();
                String result = execute(label, available, toolName, arguments, toolsUsed, toolResults);

                prompt.append("\nTool '").append(toolName).append("' result:\n").append(result)
                        .append("\nNow, based on the tool result, either call another tool or provide the final answer.\n");
            }

            log.warn("[TextOrchestrator:{}] Tool budget ({}) exhausted, requesting final answer", label, maxToolCalls);
            String output = complete(prompt
                    + "\nPlease provide the final answer wrapped in <final> ... </final>.", settings);
            return outcome(finalAnswer(output).orElse(output), toolsUsed, toolResults,
                    maxToolCalls + 1, RunStatus.MAX_ITERATIONS_REACHED);
        } catch (LlmClient.LlmException e) {
            log.warn("[TextOrchestrator:{}] Backend unavailable, answering in fallback mode: {}", label, e.getMessage());
            return new OrchestrationOutcome(fallbackResponder.respond(userPrompt, llmRouter.modelName()),
                    List.copyOf(toolsUsed), List.copyOf(toolResults), 0, RunStatus.FALLBACK);
        }
    }

    String toolsPrompt(List<ToolDescriptor> tools) {
        if (tools.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder()
                .append("You have access to the following tools. To call a tool, output exactly a JSON object ")
                .append("wrapped in <tool_call> tags.\n")
                .append("Use this format: <tool_call>{\"tool_name\": \"name\", \"arguments\": { ... }}</tool_call>\n")
                .append("If you are ready to provide the final answer, wrap it in <final> ... </final>.\n")
                .append("Tools:");
        for (ToolDescriptor tool : tools) {
            sb.append("\n- name: ").append(tool.name())
              .append("\n  description: ").append(tool.description())
              .append("\n  json_input_schema:\n").append(toJson(tool.parameterSchema()));
        }
        return sb.toString();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String complete(String prompt, GenerationSettings settings) {
        return llmRouter.chat(ChatRequest.simple(List.of(Message.user(prompt)),
                settings.maxTokens(), settings.temperature(), settings.stop())).text();
    }

    private String execute(String label,
                           Map<String, ToolDescriptor> available,
                           String toolName,
                           Map<String, Object> arguments,
                           Set<String> toolsUsed,
                           List<ToolInvocation> toolResults) {
        ToolDescriptor tool = toolName == null ? null : available.get(toolName);
        if (tool == null) {
            String error = "Tool '%s' not found".formatted(toolName);
            toolResults.add(ToolInvocation.failed(toolName, arguments, error));
            return error;
        }
        log.info("[TextOrchestrator:{}] Executing tool '{}' args={}", label, toolName, arguments);
        ToolResponse response = toolExecutor.execute(tool, arguments);
        toolsUsed.add(toolName);
        if (response.success()) {
            toolResults.add(ToolInvocation.succeeded(toolName, arguments, response.result()));
            return toJson(response.result());
        }
        toolResults.add(ToolInvocation.failed(toolName, arguments, response.errorMessage()));
        return "Error: " + response.errorMessage();
    }

    private static Optional<String> finalAnswer(String output) {
        Matcher matcher = FINAL.matcher(output);
        return matcher.find() ? Optional.of(matcher.group(1).strip()) : Optional.empty();
    }

    private static OrchestrationOutcome outcome(String text, Set<String> toolsUsed, List<ToolInvocation> results,
                                                int iterations, RunStatus status) {
        return new OrchestrationOutcome(text, List.copyOf(toolsUsed), List.copyOf(results), iterations, status);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
