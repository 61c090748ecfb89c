package com.openforge.toolflow.tool;

import com.openforge.toolflow.tool.dto.ToolRegistrationRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * REST API for the tool registry and direct tool execution.
 *
 * Endpoints:
 *   GET    /api/tools                 : list tools (optional ?client_id=)
 *   POST   /api/tools                 : register a tool
 *   GET    /api/tools/{name}          : get one tool
 *   DELETE /api/tools/{name}          : remove a tool
 *   PUT    /api/tools/{name}/config   : merge config into a tool (kind is immutable)
 *   GET    /api/tools/relevant?query= : tools sharing a keyword with the query
 *   POST   /api/tools/execute         : execute a tool once
 */
@Slf4j
@RestController
@RequestMapping("/api/tools")
@RequiredArgsConstructor
public class ToolController {

    private final ToolRegistry        toolRegistry;
    private final DynamicToolExecutor toolExecutor;

    @GetMapping
    public List<ToolDescriptor> listTools(@RequestParam(name = "client_id", required = false) String clientId) {
        return toolRegistry.list(clientId);
    }

    @PostMapping
    public ResponseEntity<ToolDescriptor> registerTool(@Valid @RequestBody ToolRegistrationRequest request) {
        ToolDescriptor descriptor;
        try {
            descriptor = request.toDescriptor();
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        try {
            toolRegistry.register(request.clientId(), descriptor);
        } catch (ToolRegistry.DuplicateToolException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(descriptor);
    }

    @GetMapping("/relevant")
    public List<ToolDescriptor> relevantTools(@RequestParam String query,
                                              @RequestParam(name = "client_id", required = false) String clientId) {
        return toolRegistry.relevantTo(clientId, query);
    }

    @GetMapping("/{name}")
    public ToolDescriptor getTool(@PathVariable String name,
                                  @RequestParam(name = "client_id", required = false) String clientId) {
        return findOrThrow(clientId, name);
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<Void> removeTool(@PathVariable String name,
                                           @RequestParam(name = "client_id", required = false) String clientId) {
        if (!toolRegistry.remove(clientId, name)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Tool not found: " + name);
        }
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{name}/config")
    public ToolDescriptor updateConfig(@PathVariable String name,
                                       @RequestBody Map<String, Object> config,
                                       @RequestParam(name = "client_id", required = false) String clientId) {
        if (!toolRegistry.updateConfig(clientId, name, config)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Tool not found: " + name);
        }
        return findOrThrow(clientId, name);
    }

    /** Tool failures are reported in the body with HTTP 200; only an unknown tool is a 404. */
    @PostMapping("/execute")
    public ToolResponse execute(@Valid @RequestBody ToolRequest request) {
        ToolDescriptor tool = findOrThrow(request.clientId(), request.toolName());
        log.info("[ToolController] Executing tool '{}'", tool.name());
        return toolExecutor.execute(tool, request.parametersOrEmpty());
    }

    private ToolDescriptor findOrThrow(String clientId, String name) {
        return toolRegistry.get(clientId, name)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Tool not found: " + name));
    }
}
