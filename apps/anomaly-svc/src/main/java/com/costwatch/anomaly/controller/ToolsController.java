package com.costwatch.anomaly.controller;

import com.costwatch.anomaly.agent.DetectCostAnomaliesTool;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Tool execution endpoint for the assistant agent loop.
 */
@RestController
@RequestMapping("/tools")
public class ToolsController {

    private final DetectCostAnomaliesTool detectCostAnomaliesTool;
    private final ObjectMapper objectMapper;

    public ToolsController(DetectCostAnomaliesTool detectCostAnomaliesTool, ObjectMapper objectMapper) {
        this.detectCostAnomaliesTool = detectCostAnomaliesTool;
        this.objectMapper = objectMapper;
    }

    @GetMapping
    public List<ObjectNode> definitions() {
        return List.of(detectCostAnomaliesTool.specification());
    }

    @PostMapping("/{name}")
    public ResponseEntity<ObjectNode> execute(@PathVariable("name") String name,
                                              @RequestBody(required = false) JsonNode input) {
        if (!DetectCostAnomaliesTool.NAME.equals(name)) {
            ObjectNode error = objectMapper.createObjectNode();
            error.put("error", "Unknown tool: " + name);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
        }
        return ResponseEntity.ok(detectCostAnomaliesTool.execute(input));
    }
}
