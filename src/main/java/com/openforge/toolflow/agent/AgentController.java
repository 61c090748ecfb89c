package com.openforge.toolflow.agent;

import com.openforge.toolflow.agent.dto.AgentInvocationRequest;
import com.openforge.toolflow.agent.dto.AgentRegistrationRequest;
import com.openforge.toolflow.agent.dto.GenerateRequest;
import com.openforge.toolflow.agent.dto.GenerateResponse;
import com.openforge.toolflow.agent.dto.ToolAssignmentRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API for agents and direct generation.
 *
 * Endpoints:
 *   GET    /api/agents                : list agents
 *   POST   /api/agents                : register an agent
 *   GET    /api/agents/{name}         : get one agent
 *   DELETE /api/agents/{name}         : delete an agent
 *   PUT    /api/agents/{name}/tools   : replace the agent's tool list
 *   POST   /api/agents/{name}/invoke  : run the agent on a prompt
 *   POST   /api/generate              : prompt without an agent, optional text-marker tools
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AgentController {

    private final AgentRegistry agentRegistry;
    private final AgentService  agentService;

    @GetMapping("/agents")
    public List<AgentDefinition> listAgents() {
        return agentRegistry.list();
    }

    @PostMapping("/agents")
    public ResponseEntity<AgentDefinition> registerAgent(@Valid @RequestBody AgentRegistrationRequest request) {
        try {
            AgentDefinition agent = agentRegistry.register(request.toDefinition());
            return ResponseEntity.status(HttpStatus.CREATED).body(agent);
        } catch (AgentRegistry.DuplicateAgentException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }

    @GetMapping("/agents/{name}")
    public AgentDefinition getAgent(@PathVariable String name) {
        return agentRegistry.get(name)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Agent not found: " + name));
    }

    @DeleteMapping("/agents/{name}")
    public ResponseEntity<Void> deleteAgent(@PathVariable String name) {
        if (!agentRegistry.delete(name)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Agent not found: " + name);
        }
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/agents/{name}/tools")
    public AgentDefinition assignTools(@PathVariable String name,
                                       @Valid @RequestBody ToolAssignmentRequest request) {
        try {
            return agentRegistry.assignTools(name, request.toolNames());
        } catch (AgentRegistry.AgentNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }

    @PostMapping("/agents/{name}/invoke")
    public AgentInvocationResult invoke(@PathVariable String name,
                                        @Valid @RequestBody AgentInvocationRequest request) {
        try {
            return agentService.invokeAgent(name, request);
        } catch (AgentRegistry.AgentNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }

    @PostMapping("/generate")
    public GenerateResponse generate(@Valid @RequestBody GenerateRequest request) {
        return agentService.generate(request);
    }
}
