package com.platform.relay.api;

import com.platform.relay.agent.AgentRegistry;
import com.platform.relay.dispatch.CommandDispatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

/**
 * Unauthenticated liveness summary. Detailed health is served by Actuator.
 */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

    private final AgentRegistry registry;
    private final CommandDispatcher dispatcher;
    private final Clock clock;

    @GetMapping
    public HealthStatus health() {
        return new HealthStatus("ok", registry.connectedCount(), dispatcher.pendingCount(), clock.instant());
    }

    public record HealthStatus(String status, int agents, int pendingCommands, Instant timestamp) {}
}
