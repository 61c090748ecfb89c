package com.openforge.toolflow.tool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of tool descriptors, optionally namespaced per client.
 *
 * Unscoped methods operate on {@link #DEFAULT_SCOPE}.  Names are unique within
 * a scope.  All maps are concurrent so that many orchestration runs can read
 * while tools are being registered or removed; no lock is ever held while a
 * tool executes.
 */
@Slf4j
@Component
public class ToolRegistry {

    public static final String DEFAULT_SCOPE = "default";

    private final Map<String, Map<String, ToolDescriptor>> scopes = new ConcurrentHashMap<>();

    // ── Default scope ────────────────────────────────────────────────────────

    public ToolDescriptor register(ToolDescriptor descriptor) {
        return register(DEFAULT_SCOPE, descriptor);
    }

    public Optional<ToolDescriptor> get(String name) {
        return get(DEFAULT_SCOPE, name);
    }

    public List<ToolDescriptor> list() {
        return list(DEFAULT_SCOPE);
    }

    public boolean remove(String name) {
        return remove(DEFAULT_SCOPE, name);
    }

    public boolean updateConfig(String name, Map<String, Object> config) {
        return updateConfig(DEFAULT_SCOPE, name, config);
    }

    public List<ToolDescriptor> relevantTo(String query) {
        return relevantTo(DEFAULT_SCOPE, query);
    }

    // ── Scoped ───────────────────────────────────────────────────────────────

    /**
     * @throws DuplicateToolException if the scope already holds a tool with this name
     */
    public ToolDescriptor register(String scope, ToolDescriptor descriptor) {
        Map<String, ToolDescriptor> tools = scopes.computeIfAbsent(normalize(scope), s -> new ConcurrentHashMap<>());
        ToolDescriptor existing = tools.putIfAbsent(descriptor.name(), descriptor);
        if (existing != null) {
            throw new DuplicateToolException(descriptor.name(), normalize(scope));
        }
        log.info("[ToolRegistry:{}] Registered tool '{}' kind={}", normalize(scope),
                descriptor.name(), descriptor.kind().value());
        return descriptor;
    }

    public Optional<ToolDescriptor> get(String scope, String name) {
        if (name == null) {
            return Optional.empty();
        }
        Map<String, ToolDescriptor> tools = scopes.get(normalize(scope));
        return tools == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
    }

    public List<ToolDescriptor> list(String scope) {
        Map<String, ToolDescriptor> tools = scopes.get(normalize(scope));
        if (tools == null) {
            return List.of();
        }
        return tools.values().stream()
                .sorted(Comparator.comparing(ToolDescriptor::name))
                .toList();
    }

    public boolean remove(String scope, String name) {
        Map<String, ToolDescriptor> tools = scopes.get(normalize(scope));
        boolean removed = tools != null && name != null && tools.remove(name) != null;
        if (removed) {
            log.info("[ToolRegistry:{}] Removed tool '{}'", normalize(scope), name);
        }
        return removed;
    }

    /**
     * Merges {@code config} into an existing tool's configuration.
     *
     * @return false if the tool does not exist
     */
    public boolean updateConfig(String scope, String name, Map<String, Object> config) {
        Map<String, ToolDescriptor> tools = scopes.get(normalize(scope));
        if (tools == null || name == null) {
            return false;
        }
        return tools.computeIfPresent(name, (key, current) -> current.withMergedConfig(config)) != null;
    }

    /**
     * Tools whose name or description shares at least one word with the query.
     * Simple keyword overlap, case-insensitive.
     */
    public List<ToolDescriptor> relevantTo(String scope, String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String[] words = query.toLowerCase(Locale.ROOT).split("\\s+");
        List<ToolDescriptor> relevant = new ArrayList<>();
        for (ToolDescriptor tool : list(scope)) {
            String keywords = (tool.description() + " " + tool.name()).toLowerCase(Locale.ROOT);
            for (String word : words) {
                if (!word.isEmpty() && keywords.contains(word)) {
                    relevant.add(tool);
                    break;
                }
            }
        }
        return relevant;
    }

    private static String normalize(String scope) {
        return scope == null || scope.isBlank() ? DEFAULT_SCOPE : scope;
    }

    // ── Exception types ──────────────────────────────────────────────────────

    public static class DuplicateToolException extends RuntimeException {

        private final String toolName;

        public DuplicateToolException(String toolName, String scope) {
            super("Tool with name '%s' is already registered in scope '%s'".formatted(toolName, scope));
            this.toolName = toolName;
        }

        public String getToolName() {
            return toolName;
        }
    }
}
