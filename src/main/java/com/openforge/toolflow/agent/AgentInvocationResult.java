package com.openforge.toolflow.agent;

import java.util.List;
import java.util.Map;

/**
 * Response of POST /api/agents/{name}/invoke.
 *
 * Metadata keys: agent_name, mode, iterations, tools_available, status and,
 * when the request carried one, session_id.
 */
public record AgentInvocationResult(
        String text,
        List<String> toolsUsed,
        List<ToolInvocation> toolResults,
        Map<String, Object> metadata
) {}
