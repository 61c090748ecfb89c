package com.openforge.toolflow.agent;

import com.openforge.toolflow.agent.dto.AgentInvocationRequest;
import com.openforge.toolflow.agent.dto.GenerateRequest;
import com.openforge.toolflow.agent.dto.GenerateResponse;
import com.openforge.toolflow.llm.LlmClient;
import com.openforge.toolflow.llm.LlmRouter;
import com.openforge.toolflow.llm.model.ChatRequest;
import com.openforge.toolflow.llm.model.Message;
import com.openforge.toolflow.tool.ToolDescriptor;
import com.openforge.toolflow.tool.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for agent invocations and plain generation.
 *
 * Mode selection for {@link #invokeAgent}:
 *   - textMode                      → text-marker tool loop      (mode "text_tools")
 *   - useTools and the agent has tools → native function calling (mode "function_calling")
 *   - otherwise                     → one completion, no tools   (mode "basic")
 * A backend that stays unreachable after retry and failover yields the
 * fallback answer (mode "fallback").
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AgentService {

    private final AgentRegistry           agentRegistry;
    private final ToolRegistry            toolRegistry;
    private final ToolOrchestrator        toolOrchestrator;
    private final TextToolOrchestrator    textToolOrchestrator;
    private final FallbackResponder       fallbackResponder;
    private final LlmRouter               llmRouter;
    private final OrchestrationProperties properties;

    /**
     * @throws AgentRegistry.AgentNotFoundException if the agent is not registered
     */
    public AgentInvocationResult invokeAgent(String agentName, String prompt, Integer maxTokens, Double temperature,
                                             List<String> stop, boolean useTools, Integer maxToolCalls) {
        return invokeAgent(agentName,
                AgentInvocationRequest.of(prompt, maxTokens, temperature, stop, useTools, maxToolCalls));
    }

    /**
     * @throws AgentRegistry.AgentNotFoundException if the agent is not registered
     * @throws IllegalArgumentException             if toolForUse is not one of the agent's tools
     */
    public AgentInvocationResult invokeAgent(String agentName, AgentInvocationRequest request) {
        AgentDefinition agent = agentRegistry.getOrThrow(agentName);
        List<ToolDescriptor> tools = resolveTools(agent, request);
        GenerationSettings settings = settingsOf(request.maxTokens(), request.temperature(), request.stop());
        int maxToolCalls = request.maxToolCalls() != null ? request.maxToolCalls() : properties.defaultMaxToolCalls();
        boolean useTools = !Boolean.FALSE.equals(request.useTools()) && !tools.isEmpty();

        String mode;
        OrchestrationOutcome outcome;
        try {
            if (Boolean.TRUE.equals(request.textMode())) {
                mode = "text_tools";
                outcome = textToolOrchestrator.run(agent.name(), systemPromptOf(agent), request.prompt(),
                        useTools ? tools : List.of(), maxToolCalls, settings);
            } else if (useTools) {
                mode = "function_calling";
                outcome = toolOrchestrator.run(agent.name(), seed(agent, request.prompt()), tools,
                        maxToolCalls, settings);
            } else {
                mode = "basic";
                String text = llmRouter.chat(ChatRequest.simple(seed(agent, request.prompt()),
                        settings.maxTokens(), settings.temperature(), settings.stop())).text();
                outcome = new OrchestrationOutcome(text, List.of(), List.of(), 1, RunStatus.COMPLETED);
            }
        } catch (LlmClient.LlmException e) {
            log.warn("[Agent:{}] Backend unavailable, answering in fallback mode: {}", agent.name(), e.getMessage());
            mode = "fallback";
            outcome = OrchestrationOutcome.fallback(fallbackResponder.respond(request.prompt(), llmRouter.modelName()));
        }
        if (outcome.status() == RunStatus.FALLBACK) {
            mode = "fallback";
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("agent_name", agent.name());
        metadata.put("mode", mode);
        metadata.put("iterations", outcome.iterations());
        metadata.put("tools_available", useTools ? tools.size() : 0);
        metadata.put("status", outcome.status().value());
        if (request.sessionId() != null && !request.sessionId().isBlank()) {
            metadata.put("session_id", request.sessionId());
        }
        log.info("[Agent:{}] mode={} status={} tools_used={}", agent.name(), mode,
                outcome.status().value(), outcome.toolsUsed());
        return new AgentInvocationResult(outcome.text(), outcome.toolsUsed(), outcome.toolResults(), metadata);
    }

    /**
     * Agent-less generation.  With tools enabled every tool of the client's
     * scope is offered through the text-marker protocol.
     */
    public GenerateResponse generate(GenerateRequest request) {
        GenerationSettings settings = settingsOf(request.maxTokens(), request.temperature(), request.stop());
        int maxToolCalls = request.maxToolCalls() != null ? request.maxToolCalls() : properties.defaultMaxToolCalls();
        List<ToolDescriptor> tools = Boolean.TRUE.equals(request.useTools())
                ? toolRegistry.list(request.clientId())
                : List.of();

        OrchestrationOutcome outcome;
        if (!tools.isEmpty()) {
            outcome = textToolOrchestrator.run("generate", properties.systemPrompt(), request.prompt(),
                    tools, maxToolCalls, settings);
        } else {
            try {
                String text = llmRouter.chat(ChatRequest.simple(List.of(Message.user(request.prompt())),
                        settings.maxTokens(), settings.temperature(), settings.stop())).text();
                outcome = new OrchestrationOutcome(text, List.of(), List.of(), 1, RunStatus.COMPLETED);
            } catch (LlmClient.LlmException e) {
                log.warn("[Generate] Backend unavailable, answering in fallback mode: {}", e.getMessage());
                outcome = OrchestrationOutcome.fallback(
                        fallbackResponder.respond(request.prompt(), llmRouter.modelName()));
            }
        }
        return new GenerateResponse(outcome.text(), outcome.toolsUsed(), outcome.toolResults(),
                outcome.status().value());
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private List<ToolDescriptor> resolveTools(AgentDefinition agent, AgentInvocationRequest request) {
        List<String> names = agent.tools();
        String toolForUse = request.toolForUse();
        if (toolForUse != null && !toolForUse.isBlank()) {
            if (!names.contains(toolForUse)) {
                throw new IllegalArgumentException("Tool '%s' is not assigned to agent '%s'"
                        .formatted(toolForUse, agent.name()));
            }
            names = List.of(toolForUse);
        }
        List<ToolDescriptor> tools = new ArrayList<>();
        for (String name : names) {
            Optional<ToolDescriptor> tool = toolRegistry.get(request.clientId(), name)
                    .or(() -> toolRegistry.get(name));
            tool.ifPresentOrElse(tools::add,
                    () -> log.warn("[Agent:{}] Assigned tool '{}' is no longer registered", agent.name(), name));
        }
        return tools;
    }

    private List<Message> seed(AgentDefinition agent, String prompt) {
        return List.of(Message.system(systemPromptOf(agent)), Message.user(prompt));
    }

    private String systemPromptOf(AgentDefinition agent) {
        return agent.rolePrompt().isBlank() ? properties.systemPrompt() : agent.rolePrompt();
    }

    private GenerationSettings settingsOf(Integer maxTokens, Double temperature, List<String> stop) {
        return new GenerationSettings(
                maxTokens != null ? maxTokens : properties.defaultMaxTokens(),
                temperature != null ? temperature : properties.defaultTemperature(),
                stop);
    }
}
