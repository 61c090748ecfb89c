package com.openforge.toolflow.tool;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * Invocation mechanism backing a tool.  The set is closed: every kind has
 * exactly one handler in {@link DynamicToolExecutor}.
 */
public enum ToolKind {

    /** HTTP call to a configured or caller-supplied endpoint. */
    API("api"),

    /** Restricted arithmetic expression over whitelisted math functions. */
    CALCULATION("calculation"),

    /** Caller-supplied JavaScript executed in an isolated polyglot context. */
    FUNCTION("function"),

    /** Single SQL statement over a per-call JDBC connection. */
    DATABASE("database");

    private final String value;

    ToolKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ToolKind fromValue(String value) {
        for (ToolKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Invalid tool type '%s'. Must be one of: %s"
                .formatted(value, supportedValues()));
    }

    public static List<String> supportedValues() {
        return Arrays.stream(values()).map(ToolKind::value).toList();
    }
}
