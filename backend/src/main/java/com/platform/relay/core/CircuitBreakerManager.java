package com.platform.relay.core;

import com.platform.relay.error.ResourceNotFoundException;
import com.platform.relay.observability.RelayMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Manages circuit breakers for the relay's external dependencies.
 */
@Slf4j
@Component
public class CircuitBreakerManager {

    public static final String DOCKER = "docker";

    static final List<String> SYSTEMS = List.of(DOCKER);

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RelayMetrics metrics;

    public CircuitBreakerManager(CircuitBreakerRegistry circuitBreakerRegistry, RelayMetrics metrics) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.metrics = metrics;
        for (String system : SYSTEMS) {
            registerEventListeners(circuitBreakerRegistry.circuitBreaker(system), system);
        }
    }

    public CircuitBreaker get(String system) {
        return circuitBreakerRegistry.circuitBreaker(system);
    }

    private void registerEventListeners(CircuitBreaker circuitBreaker, String system) {
        circuitBreaker.getEventPublisher()
            .onStateTransition(event -> {
                String fromState = event.getStateTransition().getFromState().name();
                String toState = event.getStateTransition().getToState().name();
                log.info("Circuit breaker {} state change: {} -> {}", system, fromState, toState);
                metrics.recordCircuitBreakerStateChange(system, toState);
            })
            .onError(event -> log.debug("Circuit breaker {} recorded error: {}",
                system, event.getThrowable().getMessage()));
    }

    public Map<String, CircuitBreakerStatus> getAllStates() {
        Map<String, CircuitBreakerStatus> states = new LinkedHashMap<>();
        for (String system : SYSTEMS) {
            CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(system);
            CircuitBreaker.Metrics cbMetrics = cb.getMetrics();
            states.put(system, new CircuitBreakerStatus(
                cb.getState().name(),
                cbMetrics.getNumberOfSuccessfulCalls(),
                cbMetrics.getNumberOfFailedCalls(),
                cbMetrics.getFailureRate()));
        }
        return states;
    }

    /**
     * Reset circuit breaker (clear metrics and transition to closed).
     */
    public void reset(String system) {
        if (!SYSTEMS.contains(system)) {
            throw new ResourceNotFoundException("Circuit breaker", system);
        }
        get(system).reset();
        log.info("Reset circuit breaker {}", system);
    }

    public record CircuitBreakerStatus(
        String state,
        int successfulCalls,
        int failedCalls,
        float failureRate
    ) {}
}
