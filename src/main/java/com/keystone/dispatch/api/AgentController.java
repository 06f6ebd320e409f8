package com.keystone.dispatch.api;

import com.keystone.core.error.DuplicateAgentException;
import com.keystone.core.model.AgentDescriptor;
import com.keystone.core.model.AgentHealth;
import com.keystone.core.model.CircuitBreakerState;
import com.keystone.core.registry.AgentRegistry;
import com.keystone.core.resilience.CircuitBreakerRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * REST controller for the worker-agent registry and circuit administration.
 */
@RestController
@RequestMapping("/api/v1/agents")
public class AgentController {

    private final AgentRegistry registry;
    private final CircuitBreakerRegistry breakers;

    public AgentController(AgentRegistry registry, CircuitBreakerRegistry breakers) {
        this.registry = registry;
        this.breakers = breakers;
    }

    @GetMapping
    public ResponseEntity<List<AgentDescriptor>> list(@RequestParam(name = "capability", required = false)
                                                      String capability) {
        return ResponseEntity.ok(capability != null ? registry.listByCapability(capability) : registry.listAll());
    }

    @PostMapping
    public ResponseEntity<?> register(@RequestBody AgentRegistrationRequest request) {
        if (request.id() == null || request.id().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "id is required"));
        }
        if (request.endpoint() == null || request.endpoint().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "endpoint is required"));
        }
        if (request.capabilities() == null || request.capabilities().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "at least one capability is required"));
        }
        try {
            AgentDescriptor descriptor = registry.register(request.id(), new HashSet<>(request.capabilities()),
                    request.endpoint(), request.maxLoad());
            return ResponseEntity.status(HttpStatus.CREATED).body(descriptor);
        } catch (DuplicateAgentException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deregister(@PathVariable String id) {
        if (registry.deregister(id)) {
            breakers.remove(id);
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.notFound().build();
    }

    @PostMapping("/{id}/heartbeat")
    public ResponseEntity<?> heartbeat(@PathVariable String id,
                                       @RequestBody(required = false) HeartbeatRequest request) {
        AgentHealth reported = AgentHealth.HEALTHY;
        if (request != null && request.status() != null) {
            try {
                reported = AgentHealth.valueOf(request.status().toUpperCase());
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest().body(Map.of("error", "Invalid status: " + request.status()));
            }
        }
        return registry.heartbeat(id, reported)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "Unknown agent: " + id)));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        return ResponseEntity.ok(registry.stats());
    }

    @GetMapping("/circuits")
    public ResponseEntity<List<CircuitBreakerState>> circuits() {
        return ResponseEntity.ok(breakers.all());
    }

    @PostMapping("/{id}/circuit/reset")
    public ResponseEntity<Map<String, Object>> resetCircuit(@PathVariable String id) {
        if (breakers.reset(id)) {
            return ResponseEntity.ok(Map.of("agent_id", id, "state", "CLOSED"));
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "No circuit for agent " + id));
    }
}
