package com.openforge.toolflow;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class ToolflowApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    private void registerTool(String json, int expectedStatus) throws Exception {
        mockMvc.perform(post("/api/tools").contentType(MediaType.APPLICATION_JSON).content(json))
                .andExpect(status().is(expectedStatus));
    }

    // ==================== Tools ====================

    @Test
    void shouldRegisterAndExecuteCalculationTool() throws Exception {
        registerTool("""
                {"name": "it_calc", "description": "Arithmetic", "tool_type": "calculation",
                 "parameters_schema": {"type": "object", "required": ["expression"]}}""", 201);

        mockMvc.perform(post("/api/tools/execute").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tool_name\": \"it_calc\", \"parameters\": {\"expression\": \"2+3\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.result.result").value(5));

        mockMvc.perform(get("/api/tools/it_calc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tool_type").value("calculation"));
    }

    @Test
    void shouldRejectDuplicateAndUnknownKind() throws Exception {
        String tool = """
                {"name": "it_dup", "tool_type": "calculation"}""";
        registerTool(tool, 201);
        registerTool(tool, 409);
        registerTool("""
                {"name": "it_bad", "tool_type": "teleport"}""", 400);
    }

    @Test
    void shouldReturnNotFoundForUnknownTool() throws Exception {
        mockMvc.perform(delete("/api/tools/it_ghost")).andExpect(status().isNotFound());
        mockMvc.perform(post("/api/tools/execute").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tool_name\": \"it_ghost\"}"))
                .andExpect(status().isNotFound());
    }

    // ==================== Workflows ====================

    @Test
    void shouldDefineAndExecuteWorkflow() throws Exception {
        registerTool("""
                {"name": "it_flow_calc", "tool_type": "calculation"}""", 201);

        mockMvc.perform(post("/api/workflows").contentType(MediaType.APPLICATION_JSON).content("""
                        {"name": "it_flow", "steps": [
                          {"name": "add", "type": "tool_call", "tool_name": "it_flow_calc",
                           "parameters": {"expression": "a + 1", "variables": {"a": "{{start}}"}}},
                          {"name": "check", "type": "condition", "condition": "result > 5"}]}"""))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/api/workflows/it_flow/execute").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"context\": {\"start\": 9}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.steps.length()").value(2))
                .andExpect(jsonPath("$.context.result").value(10))
                .andExpect(jsonPath("$.context.condition_result").value(true));

        mockMvc.perform(get("/api/workflows/it_flow/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"));
    }

    @Test
    void shouldReturnNotFoundForUnknownWorkflow() throws Exception {
        mockMvc.perform(post("/api/workflows/it_none/execute").contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isNotFound());
    }

    // ==================== Agents ====================

    @Test
    void shouldRejectAgentWithUnknownTool() throws Exception {
        mockMvc.perform(post("/api/agents").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"it_agent\", \"tools\": [\"it_missing\"]}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/api/agents/it_nobody/invoke").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\": \"hi\"}"))
                .andExpect(status().isNotFound());
    }
}
