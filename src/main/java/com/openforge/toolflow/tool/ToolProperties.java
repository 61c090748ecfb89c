package com.openforge.toolflow.tool;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Defaults for the tool kinds, bound from "agent.tools":
 *
 * agent:
 *   tools:
 *     api:
 *       timeout-seconds: 30
 *     function:
 *       timeout-ms: 5000
 *       statement-limit: 1000000
 *     database:
 *       max-rows: 1000
 */
@ConfigurationProperties(prefix = "agent.tools")
public record ToolProperties(
        @DefaultValue Api api,
        @DefaultValue Function function,
        @DefaultValue Database database
) {

    public record Api(@DefaultValue("30") int timeoutSeconds) {}

    public record Function(
            @DefaultValue("5000") long timeoutMs,
            @DefaultValue("1000000") long statementLimit
    ) {}

    public record Database(@DefaultValue("1000") int maxRows) {}

    /** Defaults used when no configuration is bound (tests, standalone use). */
    public static ToolProperties defaults() {
        return new ToolProperties(new Api(30), new Function(5000, 1_000_000), new Database(1000));
    }
}
