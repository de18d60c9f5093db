package com.platform.relay.agent;

import com.platform.relay.config.RelayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Closes connections whose agent stopped sending heartbeats.
 */
@Slf4j
@Component
public class AgentLivenessMonitor {

    private final AgentRegistry registry;
    private final Duration staleAfter;

    public AgentLivenessMonitor(AgentRegistry registry, RelayProperties properties) {
        this.registry = registry;
        this.staleAfter = properties.getAgents().getStaleAfter();
    }

    @Scheduled(fixedDelayString = "${relay.agents.liveness-check-interval:PT30S}")
    public void evictStaleAgents() {
        int evicted = registry.evictStale(staleAfter);
        if (evicted > 0) {
            log.warn("Evicted {} agent(s) silent for more than {}s", evicted, staleAfter.toSeconds());
        }
    }
}
