package com.openforge.toolflow.tool.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolflow.tool.ToolDescriptor;
import com.openforge.toolflow.tool.ToolExecutionException;
import com.openforge.toolflow.tool.ToolKind;
import com.openforge.toolflow.tool.ToolProperties;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;

class FunctionToolHandlerTest {

    private static ScheduledExecutorService watchdog;
    private static FunctionToolHandler handler;

    @BeforeAll
    static void startEngine() {
        watchdog = Executors.newSingleThreadScheduledExecutor();
        ToolProperties properties = new ToolProperties(new ToolProperties.Api(30),
                new ToolProperties.Function(2000, 100_000), new ToolProperties.Database(100));
        handler = new FunctionToolHandler(new ObjectMapper(), properties, watchdog);
    }

    @AfterAll
    static void stopEngine() {
        handler.close();
        watchdog.shutdownNow();
    }

    private static ToolDescriptor function(String source) {
        return new ToolDescriptor("fn", "", null, ToolKind.FUNCTION, Map.of("source", source));
    }

    // ==================== Execution ====================

    @Test
    void shouldCallMainWithParametersBoundAsGlobals() {
        Map<String, Object> result = handler.execute(
                function("function main() { return { msg: msg }; }"), Map.of("msg", "hi"));

        assertEquals(true, result.get("function_executed"));
        assertEquals(Map.of("msg", "hi"), result.get("result"));
        assertEquals(Map.of("msg", "hi"), result.get("function_params"));
    }

    @Test
    void shouldCallFirstDeclaredFunctionWithoutMain() {
        Map<String, Object> result = handler.execute(
                function("function add() { return a + b; }"), Map.of("a", 2, "b", 3));

        assertEquals(5, result.get("result"));
    }

    @Test
    void shouldPreferFunctionParamsWhenPresent() {
        Map<String, Object> result = handler.execute(
                function("function main() { return x * 2; }"), Map.of("function_params", Map.of("x", 4)));

        assertEquals(8, result.get("result"));
        assertEquals(Map.of("x", 4), result.get("function_params"));
    }

    @Test
    void shouldConvertArraysAndStrings() {
        Map<String, Object> result = handler.execute(
                function("function main() { return items.map(function (i) { return i + '!'; }); }"),
                Map.of("items", List.of("a", "b")));

        assertEquals(List.of("a!", "b!"), result.get("result"));
    }

    @Test
    void shouldReturnNullForUndefined() {
        Map<String, Object> result = handler.execute(function("function main() { }"), Map.of());

        assertTrue(result.containsKey("result"));
        assertNull(result.get("result"));
    }

    // ==================== Isolation ====================

    @Test
    void shouldRejectForbiddenKeywordsBeforeRunning() {
        ToolExecutionException error = assertThrows(ToolExecutionException.class, () -> handler.execute(
                function("function main() { return Java.type('java.lang.System'); }"), Map.of()));

        assertTrue(error.getMessage().contains("forbidden"));
    }

    @Test
    void shouldStopRunawayLoops() {
        ToolExecutionException error = assertThrows(ToolExecutionException.class, () -> handler.execute(
                function("function main() { while (true) { } }"), Map.of()));

        assertTrue(error.getMessage().contains("statement limit") || error.getMessage().contains("timed out"),
                error.getMessage());
    }

    @Test
    void shouldReportGuestErrors() {
        ToolExecutionException error = assertThrows(ToolExecutionException.class, () -> handler.execute(
                function("function main() { throw new Error('bad input'); }"), Map.of()));

        assertTrue(error.getMessage().contains("bad input"));
    }

    @Test
    void shouldFailWithoutCallableFunction() {
        assertThrows(ToolExecutionException.class, () -> handler.execute(function("var x = 1;"), Map.of()));
    }

    @Test
    void shouldFailWithoutSource() {
        ToolDescriptor tool = new ToolDescriptor("fn", "", null, ToolKind.FUNCTION, null);

        assertThrows(ToolExecutionException.class, () -> handler.execute(tool, Map.of()));
    }
}
