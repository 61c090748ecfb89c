package com.openforge.toolflow.agent;

import java.util.List;

/** Sampling parameters forwarded unchanged to every backend call of one run. */
public record GenerationSettings(
        Integer maxTokens,
        Double temperature,
        List<String> stop
) {}
