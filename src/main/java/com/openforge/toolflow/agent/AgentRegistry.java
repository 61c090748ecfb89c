package com.openforge.toolflow.agent;

import com.openforge.toolflow.tool.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of agents.  Tool names are validated against the
 * default scope of the {@link ToolRegistry} on registration and assignment.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentRegistry {

    private final ToolRegistry toolRegistry;

    private final Map<String, AgentDefinition> agents = new ConcurrentHashMap<>();

    /**
     * @throws DuplicateAgentException  if the name is taken
     * @throws IllegalArgumentException if a tool name is not registered
     */
    public AgentDefinition register(AgentDefinition agent) {
        requireKnownTools(agent.name(), agent.tools());
        AgentDefinition existing = agents.putIfAbsent(agent.name(), agent);
        if (existing != null) {
            throw new DuplicateAgentException(agent.name());
        }
        log.info("[AgentRegistry] Registered agent '{}' with tools {}", agent.name(), agent.tools());
        return agent;
    }

    public Optional<AgentDefinition> get(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(agents.get(name));
    }

    /** @throws AgentNotFoundException if no agent has this name */
    public AgentDefinition getOrThrow(String name) {
        return get(name).orElseThrow(() -> new AgentNotFoundException(name));
    }

    public List<AgentDefinition> list() {
        return agents.values().stream()
                .sorted(Comparator.comparing(AgentDefinition::name))
                .toList();
    }

    public boolean delete(String name) {
        boolean removed = name != null && agents.remove(name) != null;
        if (removed) {
            log.info("[AgentRegistry] Deleted agent '{}'", name);
        }
        return removed;
    }

    /** Replaces the agent's tool list. */
    public AgentDefinition assignTools(String name, List<String> tools) {
        requireKnownTools(name, tools);
        AgentDefinition updated = agents.computeIfPresent(name, (key, current) -> current.withTools(tools));
        if (updated == null) {
            throw new AgentNotFoundException(name);
        }
        log.info("[AgentRegistry] Assigned tools {} to agent '{}'", updated.tools(), name);
        return updated;
    }

    private void requireKnownTools(String agentName, List<String> tools) {
        if (tools == null) {
            return;
        }
        for (String tool : tools) {
            if (toolRegistry.get(tool).isEmpty()) {
                throw new IllegalArgumentException("Agent '%s' references unknown tool '%s'".formatted(agentName, tool));
            }
        }
    }

    // ── Exception types ──────────────────────────────────────────────────────

    public static class DuplicateAgentException extends RuntimeException {
        public DuplicateAgentException(String name) {
            super("Agent with name '%s' is already registered".formatted(name));
        }
    }

    public static class AgentNotFoundException extends RuntimeException {
        public AgentNotFoundException(String name) {
            super("Agent '%s' not found".formatted(name));
        }
    }
}
