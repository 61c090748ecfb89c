package com.openforge.toolflow.agent;

import com.openforge.toolflow.agent.dto.AgentInvocationRequest;
import com.openforge.toolflow.agent.dto.GenerateRequest;
import com.openforge.toolflow.agent.dto.GenerateResponse;
import com.openforge.toolflow.llm.LlmClient;
import com.openforge.toolflow.llm.LlmRouter;
import com.openforge.toolflow.llm.model.ChatRequest;
import com.openforge.toolflow.llm.model.ChatResponse;
import com.openforge.toolflow.llm.model.Message;
import com.openforge.toolflow.tool.ToolDescriptor;
import com.openforge.toolflow.tool.ToolKind;
import com.openforge.toolflow.tool.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class AgentServiceTest {

    private static final ToolDescriptor CALC = new ToolDescriptor("calc", "", null, ToolKind.CALCULATION, null);
    private static final ToolDescriptor SENSORS = new ToolDescriptor("sensors", "", null, ToolKind.DATABASE, null);

    private ToolRegistry toolRegistry;
    private AgentRegistry agentRegistry;
    private ToolOrchestrator toolOrchestrator;
    private TextToolOrchestrator textToolOrchestrator;
    private LlmRouter llmRouter;
    private AgentService service;

    @BeforeEach
    void setUp() {
        toolRegistry = new ToolRegistry();
        toolRegistry.register(CALC);
        toolRegistry.register(SENSORS);
        agentRegistry = new AgentRegistry(toolRegistry);
        agentRegistry.register(new AgentDefinition("ops", "Operations", "You run the plant.",
                List.of("calc", "sensors")));
        agentRegistry.register(new AgentDefinition("chatty", null, null, null));

        toolOrchestrator = mock(ToolOrchestrator.class);
        textToolOrchestrator = mock(TextToolOrchestrator.class);
        llmRouter = mock(LlmRouter.class);
        when(llmRouter.modelName()).thenReturn("test-model");

        service = new AgentService(agentRegistry, toolRegistry, toolOrchestrator, textToolOrchestrator,
                new FallbackResponder(), llmRouter, OrchestrationProperties.defaults());
    }

    private static OrchestrationOutcome completed(String text, List<String> toolsUsed) {
        return new OrchestrationOutcome(text, toolsUsed, List.of(), 2, RunStatus.COMPLETED);
    }

    // ==================== Mode selection ====================

    @Test
    void shouldUseFunctionCallingWhenAgentHasTools() {
        when(toolOrchestrator.run(eq("ops"), anyList(), anyList(), anyInt(), any()))
                .thenReturn(completed("done", List.of("calc")));

        AgentInvocationResult result = service.invokeAgent("ops", "What is 2+3?", 64, 0.1, null, true, 5);

        assertEquals("done", result.text());
        assertEquals(List.of("calc"), result.toolsUsed());
        assertEquals("function_calling", result.metadata().get("mode"));
        assertEquals("ops", result.metadata().get("agent_name"));
        assertEquals(2, result.metadata().get("tools_available"));
        assertEquals("completed", result.metadata().get("status"));
        assertEquals(2, result.metadata().get("iterations"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Message>> seed = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<GenerationSettings> settings = ArgumentCaptor.forClass(GenerationSettings.class);
        verify(toolOrchestrator).run(eq("ops"), seed.capture(), eq(List.of(CALC, SENSORS)), eq(5),
                settings.capture());
        assertEquals(List.of(Message.system("You run the plant."), Message.user("What is 2+3?")), seed.getValue());
        assertEquals(64, settings.getValue().maxTokens());
        assertEquals(0.1, settings.getValue().temperature());
    }

    @Test
    void shouldUseConfiguredDefaultsForMissingSettings() {
        when(toolOrchestrator.run(anyString(), anyList(), anyList(), anyInt(), any()))
                .thenReturn(completed("done", List.of()));

        service.invokeAgent("ops", "hi", null, null, null, true, null);

        ArgumentCaptor<GenerationSettings> settings = ArgumentCaptor.forClass(GenerationSettings.class);
        verify(toolOrchestrator).run(eq("ops"), anyList(), anyList(), eq(3), settings.capture());
        assertEquals(1024, settings.getValue().maxTokens());
        assertEquals(0.7, settings.getValue().temperature());
    }

    @Test
    void shouldUseBasicCompletionWhenToolsAreDisabled() {
        when(llmRouter.chat(any())).thenReturn(ChatResponse.ofMessage(Message.assistantText("plain")));

        AgentInvocationResult result = service.invokeAgent("ops", "hi", null, null, null, false, null);

        assertEquals("plain", result.text());
        assertEquals("basic", result.metadata().get("mode"));
        assertEquals(0, result.metadata().get("tools_available"));
        verifyNoInteractions(toolOrchestrator);

        ArgumentCaptor<ChatRequest> request = ArgumentCaptor.forClass(ChatRequest.class);
        verify(llmRouter).chat(request.capture());
        assertNull(request.getValue().tools());
    }

    @Test
    void shouldUseBasicCompletionForAgentWithoutTools() {
        when(llmRouter.chat(any())).thenReturn(ChatResponse.ofMessage(Message.assistantText("hello")));

        AgentInvocationResult result = service.invokeAgent("chatty", "hi", null, null, null, true, null);

        assertEquals("basic", result.metadata().get("mode"));
        ArgumentCaptor<ChatRequest> request = ArgumentCaptor.forClass(ChatRequest.class);
        verify(llmRouter).chat(request.capture());
        assertEquals(OrchestrationProperties.defaults().systemPrompt(),
                request.getValue().messages().get(0).content());
    }

    @Test
    void shouldUseTextToolsWhenRequested() {
        when(textToolOrchestrator.run(anyString(), anyString(), anyString(), anyList(), anyInt(), any()))
                .thenReturn(completed("text answer", List.of()));
        AgentInvocationRequest request = new AgentInvocationRequest("hi", null, null, null, true, 2,
                null, true, "s-1", null);

        AgentInvocationResult result = service.invokeAgent("ops", request);

        assertEquals("text_tools", result.metadata().get("mode"));
        assertEquals("s-1", result.metadata().get("session_id"));
        verify(textToolOrchestrator).run(eq("ops"), eq("You run the plant."), eq("hi"),
                eq(List.of(CALC, SENSORS)), eq(2), any());
    }

    @Test
    void shouldNarrowToolsToToolForUse() {
        when(toolOrchestrator.run(anyString(), anyList(), anyList(), anyInt(), any()))
                .thenReturn(completed("done", List.of("sensors")));
        AgentInvocationRequest request = new AgentInvocationRequest("hi", null, null, null, true, null,
                "sensors", false, null, null);

        AgentInvocationResult result = service.invokeAgent("ops", request);

        assertEquals(1, result.metadata().get("tools_available"));
        assertFalse(result.metadata().containsKey("session_id"));
        verify(toolOrchestrator).run(eq("ops"), anyList(), eq(List.of(SENSORS)), eq(3), any());
    }

    @Test
    void shouldRejectToolForUseNotAssignedToAgent() {
        AgentInvocationRequest request = new AgentInvocationRequest("hi", null, null, null, true, null,
                "weather", false, null, null);

        assertThrows(IllegalArgumentException.class, () -> service.invokeAgent("ops", request));
    }

    @Test
    void shouldSkipToolsRemovedAfterAssignment() {
        toolRegistry.remove("sensors");
        when(toolOrchestrator.run(anyString(), anyList(), anyList(), anyInt(), any()))
                .thenReturn(completed("done", List.of()));

        service.invokeAgent("ops", "hi", null, null, null, true, null);

        verify(toolOrchestrator).run(eq("ops"), anyList(), eq(List.of(CALC)), eq(3), any());
    }

    // ==================== Errors ====================

    @Test
    void shouldThrowForUnknownAgent() {
        assertThrows(AgentRegistry.AgentNotFoundException.class,
                () -> service.invokeAgent("nobody", "hi", null, null, null, true, null));
    }

    @Test
    void shouldReportToolsThatRanBeforeFallback() {
        ToolInvocation ran = ToolInvocation.succeeded("calc", Map.of("expression", "2+3"), Map.of("result", 5));
        when(toolOrchestrator.run(anyString(), anyList(), anyList(), anyInt(), any()))
                .thenReturn(new OrchestrationOutcome("fallback text", List.of("calc"), List.of(ran), 0,
                        RunStatus.FALLBACK));

        AgentInvocationResult result = service.invokeAgent("ops", "What is 2+3?", null, null, null, true, null);

        assertEquals("fallback", result.metadata().get("mode"));
        assertEquals("fallback", result.metadata().get("status"));
        assertEquals(List.of("calc"), result.toolsUsed());
        assertEquals(List.of(ran), result.toolResults());
    }

    @Test
    void shouldFallBackWhenBackendIsUnavailable() {
        when(toolOrchestrator.run(anyString(), anyList(), anyList(), anyInt(), any()))
                .thenThrow(new LlmClient.LlmException("down"));

        AgentInvocationResult result = service.invokeAgent("ops", "Pressure is high", null, null, null, true, null);

        assertEquals("fallback", result.metadata().get("mode"));
        assertEquals("fallback", result.metadata().get("status"));
        assertTrue(result.text().contains("fallback mode"));
        assertTrue(result.text().contains("pressure anomaly"));
        assertTrue(result.toolsUsed().isEmpty());
    }

    @Test
    void shouldReportFallbackModeFromTextOrchestrator() {
        when(textToolOrchestrator.run(anyString(), anyString(), anyString(), anyList(), anyInt(), any()))
                .thenReturn(OrchestrationOutcome.fallback("canned"));
        AgentInvocationRequest request = new AgentInvocationRequest("hi", null, null, null, true, null,
                null, true, null, null);

        AgentInvocationResult result = service.invokeAgent("ops", request);

        assertEquals("fallback", result.metadata().get("mode"));
        assertEquals("canned", result.text());
    }

    // ==================== Generate ====================

    @Test
    void shouldGenerateDirectlyWithoutTools() {
        when(llmRouter.chat(any())).thenReturn(ChatResponse.ofMessage(Message.assistantText("generated")));

        GenerateResponse response = service.generate(new GenerateRequest("hi", null, null, null, null, false, null));

        assertEquals("generated", response.text());
        assertEquals("completed", response.status());
        verifyNoInteractions(textToolOrchestrator);
    }

    @Test
    void shouldGenerateWithScopeToolsThroughTextLoop() {
        when(textToolOrchestrator.run(anyString(), anyString(), anyString(), anyList(), anyInt(), any()))
                .thenReturn(completed("with tools", List.of("calc")));

        GenerateResponse response = service.generate(new GenerateRequest("hi", null, null, null, null, true, 1));

        assertEquals("with tools", response.text());
        assertEquals(List.of("calc"), response.toolsUsed());
        verify(textToolOrchestrator).run(eq("generate"), anyString(), eq("hi"), eq(List.of(CALC, SENSORS)),
                eq(1), any());
    }

    @Test
    void shouldGenerateFallbackAnswerWhenBackendIsDown() {
        when(llmRouter.chat(any())).thenThrow(new LlmClient.LlmException("down"));

        GenerateResponse response = service.generate(
                new GenerateRequest("temperature?", null, null, null, null, false, null));

        assertEquals("fallback", response.status());
        assertTrue(response.text().contains("temperature sensor anomaly"));
    }
}
