package com.demo.companion.controller;

import com.demo.companion.infrastructure.BackboneConnection;
import com.demo.companion.infrastructure.ConnectionRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class HealthController {

    private final BackboneConnection backbone;
    private final ConnectionRegistry registry;

    public HealthController(BackboneConnection backbone, ConnectionRegistry registry) {
        this.backbone = backbone;
        this.registry = registry;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "healthy");
        response.put("backbone", backbone.isAvailable() ? "connected" : "single-instance");
        response.put("nodeId", backbone.getNodeId());
        response.put("connections", registry.getActiveConnectionCount());
        return response;
    }
}
