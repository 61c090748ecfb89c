package com.openforge.toolflow.agent;

import java.util.List;

/**
 * Result of one orchestration run, before agent metadata is attached.
 *
 * @param toolsUsed   distinct tool names in first-use order, failed calls included
 * @param toolResults every tool call in execution order
 * @param iterations  backend round trips that advertised tools
 */
public record OrchestrationOutcome(
        String text,
        List<String> toolsUsed,
        List<ToolInvocation> toolResults,
        int iterations,
        RunStatus status
) {

    public static OrchestrationOutcome fallback(String text) {
        return new OrchestrationOutcome(text, List.of(), List.of(), 0, RunStatus.FALLBACK);
    }
}
