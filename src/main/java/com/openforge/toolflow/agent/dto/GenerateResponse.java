package com.openforge.toolflow.agent.dto;

import com.openforge.toolflow.agent.ToolInvocation;

import java.util.List;

public record GenerateResponse(
        String text,
        List<String> toolsUsed,
        List<ToolInvocation> toolResults,
        String status
) {}
