package com.openforge.toolflow.tool;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named tool definition.
 *
 * The parameter schema is a JSON-Schema object that is advertised verbatim to
 * the model; only its "required" list is enforced locally.  The config map is
 * kind-specific:
 * <ul>
 *   <li>api: url / base_url, method, headers, timeout_seconds</li>
 *   <li>calculation: none</li>
 *   <li>function: source (JavaScript), timeout_ms</li>
 *   <li>database: url (optional, defaults to the shared DataSource), username, password, max_rows</li>
 * </ul>
 */
public record ToolDescriptor(
        String name,
        String description,
        @JsonProperty("parameters_schema") Map<String, Object> parameterSchema,
        @JsonProperty("tool_type") ToolKind kind,
        Map<String, Object> config
) {

    public ToolDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Tool '%s' has no tool type".formatted(name));
        }
        description = description == null ? "" : description;
        parameterSchema = parameterSchema == null
                ? Map.of("type", "object", "properties", Map.of())
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameterSchema));
        config = config == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    /** Names listed under "required" in the parameter schema. */
    public List<String> requiredParameters() {
        Object required = parameterSchema.get("required");
        if (required instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }

    /** Returns a copy whose config is this config overlaid with {@code updates}; the kind never changes. */
    public ToolDescriptor withMergedConfig(Map<String, Object> updates) {
        Map<String, Object> merged = new LinkedHashMap<>(config);
        if (updates != null) {
            merged.putAll(updates);
        }
        return new ToolDescriptor(name, description, parameterSchema, kind, merged);
    }
}
