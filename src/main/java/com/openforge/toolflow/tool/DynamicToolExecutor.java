package com.openforge.toolflow.tool;

import com.openforge.toolflow.tool.handler.ApiToolHandler;
import com.openforge.toolflow.tool.handler.CalculationToolHandler;
import com.openforge.toolflow.tool.handler.DatabaseToolHandler;
import com.openforge.toolflow.tool.handler.FunctionToolHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Executes one tool invocation and always answers with a {@link ToolResponse}.
 *
 * Required parameters (the schema's "required" list) are checked before any
 * side effect.  Handler failures of any kind become error responses; nothing
 * propagates to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DynamicToolExecutor {

    private final ApiToolHandler apiHandler;
    private final CalculationToolHandler calculationHandler;
    private final FunctionToolHandler functionHandler;
    private final DatabaseToolHandler databaseHandler;

    public ToolResponse execute(ToolDescriptor tool, Map<String, Object> parameters) {
        long start = System.nanoTime();
        if (tool == null) {
            return ToolResponse.error("No tool given", elapsedMs(start));
        }
        Map<String, Object> params = parameters == null ? Map.of() : parameters;

        for (String required : tool.requiredParameters()) {
            if (!params.containsKey(required) || params.get(required) == null) {
                log.debug("[ToolExecutor:{}] Missing required parameter '{}'", tool.name(), required);
                return ToolResponse.error("Invalid parameters provided: missing '%s'".formatted(required),
                        elapsedMs(start));
            }
        }

        try {
            Object result = switch (tool.kind()) {
                case API -> apiHandler.execute(tool, params);
                case CALCULATION -> calculationHandler.execute(tool, params);
                case FUNCTION -> functionHandler.execute(tool, params);
                case DATABASE -> databaseHandler.execute(tool, params);
            };
            double elapsed = elapsedMs(start);
            log.debug("[ToolExecutor:{}] Completed in {} ms", tool.name(), elapsed);
            return ToolResponse.ok(result, elapsed);
        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : e.toString();
            log.warn("[ToolExecutor:{}] Failed: {}", tool.name(), message);
            return ToolResponse.error(message, elapsedMs(start));
        }
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
