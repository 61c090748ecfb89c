package com.openforge.toolflow.tool.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolflow.tool.ToolDescriptor;
import com.openforge.toolflow.tool.ToolExecutionException;
import com.openforge.toolflow.tool.ToolProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.EnvironmentAccess;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.ResourceLimits;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.io.IOAccess;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handler for {@code function} tools: user-supplied JavaScript executed in a
 * GraalVM polyglot context.
 *
 * Each call gets a fresh context with no host access, no IO, no threads, no
 * processes and no environment.  Execution is bounded by a statement limit and
 * by a wall-clock timeout enforced from the watchdog scheduler, which cancels
 * the context.  Parameters are bound as JS globals; the tool's {@code main}
 * function (or the first function the source declares) is called with no
 * arguments and its return value is converted through {@code JSON.stringify}.
 */
@Slf4j
@Component
public class FunctionToolHandler {

    private static final List<String> FORBIDDEN_KEYWORDS = List.of(
            "eval", "Function(", "import", "require", "Java", "Polyglot", "Packages",
            "load(", "quit(", "exit(", "__proto__");

    private static final String ENTRY_POINT = "main";

    private final ObjectMapper objectMapper;
    private final ToolProperties properties;
    private final ScheduledExecutorService watchdog;
    private final Engine engine;

    public FunctionToolHandler(ObjectMapper objectMapper,
                               ToolProperties properties,
                               @Qualifier("sandboxWatchdog") ScheduledExecutorService watchdog) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.watchdog = watchdog;
        this.engine = Engine.newBuilder("js")
                .option("engine.WarnInterpreterOnly", "false")
                .build();
    }

    public Map<String, Object> execute(ToolDescriptor tool, Map<String, Object> parameters) {
        String source = Values.string(tool.config().get("source"));
        if (source == null) {
            throw new ToolExecutionException("No function source configured for tool '%s'".formatted(tool.name()));
        }
        for (String keyword : FORBIDDEN_KEYWORDS) {
            if (source.contains(keyword)) {
                throw new ToolExecutionException("Function source contains forbidden keyword: " + keyword);
            }
        }

        Map<String, Object> functionParams = parameters.containsKey("function_params")
                ? Values.map(parameters.get("function_params"))
                : new LinkedHashMap<>(parameters);
        long timeoutMs = Values.longValue(tool.config().get("timeout_ms"), properties.function().timeoutMs());

        Object value = run(tool.name(), source, functionParams, timeoutMs);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("function_executed", true);
        result.put("result", value);
        result.put("function_params", functionParams);
        return result;
    }

    @PreDestroy
    public void close() {
        engine.close();
    }

    // ── Sandbox ──────────────────────────────────────────────────────────────

    private Object run(String toolName, String source, Map<String, Object> params, long timeoutMs) {
        AtomicBoolean timedOut = new AtomicBoolean();
        try (Context context = newContext()) {
            ScheduledFuture<?> guard = watchdog.schedule(() -> {
                timedOut.set(true);
                context.close(true);
            }, timeoutMs, TimeUnit.MILLISECONDS);
            try {
                Value bindings = context.getBindings("js");
                Value parseJson = context.eval("js", "JSON.parse");
                for (Map.Entry<String, Object> param : params.entrySet()) {
                    bindings.putMember(param.getKey(), parseJson.execute(toJson(param.getValue())));
                }
                Set<String> predefined = new HashSet<>(bindings.getMemberKeys());

                context.eval(Source.create("js", source));
                Value function = entryPoint(bindings, predefined);
                if (function == null) {
                    throw new ToolExecutionException("Function source of tool '%s' defines no callable function"
                            .formatted(toolName));
                }
                Value returned = function.execute();
                return fromJs(context, returned);
            } finally {
                guard.cancel(false);
            }
        } catch (PolyglotException e) {
            if (timedOut.get()) {
                throw new ToolExecutionException("Function execution timed out after %d ms".formatted(timeoutMs), e);
            }
            if (e.isResourceExhausted() || e.isCancelled()) {
                throw new ToolExecutionException("Function execution exceeded its statement limit", e);
            }
            log.debug("[FunctionTool:{}] Guest error: {}", toolName, e.getMessage());
            throw new ToolExecutionException("Function execution error: " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            if (timedOut.get()) {
                throw new ToolExecutionException("Function execution timed out after %d ms".formatted(timeoutMs), e);
            }
            throw e;
        }
    }

    private Context newContext() {
        return Context.newBuilder("js")
                .engine(engine)
                .allowHostAccess(HostAccess.NONE)
                .allowHostClassLookup(className -> false)
                .allowIO(IOAccess.NONE)
                .allowCreateThread(false)
                .allowCreateProcess(false)
                .allowNativeAccess(false)
                .allowEnvironmentAccess(EnvironmentAccess.NONE)
                .resourceLimits(ResourceLimits.newBuilder()
                        .statementLimit(properties.function().statementLimit(), null)
                        .build())
                .build();
    }

    private static Value entryPoint(Value bindings, Set<String> predefined) {
        Value main = bindings.getMember(ENTRY_POINT);
        if (main != null && main.canExecute()) {
            return main;
        }
        for (String key : bindings.getMemberKeys()) {
            if (predefined.contains(key) || key.startsWith("_")) {
                continue;
            }
            Value candidate = bindings.getMember(key);
            if (candidate != null && candidate.canExecute()) {
                return candidate;
            }
        }
        return null;
    }

    private Object fromJs(Context context, Value value) {
        if (value == null || value.isNull()) {
            return null;
        }
        Value json = context.eval("js", "JSON.stringify").execute(value);
        if (json.isNull()) {
            return null;
        }
        try {
            return objectMapper.readValue(json.asString(), Object.class);
        } catch (JsonProcessingException e) {
            throw new ToolExecutionException("Function returned a value that cannot be converted: " + e.getMessage(), e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ToolExecutionException("Function parameter is not JSON-serializable: " + e.getMessage(), e);
        }
    }
}
