package com.platform.relay.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Central registry for relay metrics.
 * Commands by outcome, command latency, key cache efficiency, payloads and networks.
 */
@Slf4j
@Component
public class RelayMetrics {

    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    public RelayMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Register a gauge backed by live component state (connected agents, pending commands).
     */
    public void registerGauge(String name, Supplier<Number> valueSupplier) {
        Gauge.builder(name, valueSupplier)
            .register(meterRegistry);
        log.debug("Registered gauge {}", name);
    }

    public void recordCommandSent(String type) {
        incrementCounter("relay.commands.sent", "type", type);
    }

    /**
     * Record the terminal outcome of a command and how long it was pending.
     */
    public void recordCommandOutcome(String type, String outcome, Duration elapsed) {
        incrementCounter("relay.commands.completed", "type", type, "outcome", outcome);
        timers.computeIfAbsent(type + "." + outcome, k ->
            Timer.builder("relay.commands.latency")
                .tag("type", type)
                .tag("outcome", outcome)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry))
            .record(elapsed);
    }

    public void recordKeyCacheHit() {
        incrementCounter("relay.keystore.cache", "result", "hit");
    }

    public void recordKeyCacheMiss() {
        incrementCounter("relay.keystore.cache", "result", "miss");
    }

    public void recordKeyGenerated() {
        incrementCounter("relay.keystore.keys.generated");
    }

    public void recordPayloadBuilt(String tool, int helperCount) {
        incrementCounter("relay.payloads.built", "tool", tool);
        if (helperCount > 0) {
            counters.computeIfAbsent("relay.payloads.helpers", k ->
                Counter.builder("relay.payloads.helpers").register(meterRegistry))
                .increment(helperCount);
        }
    }

    public void recordHelperScriptSkipped(String script) {
        incrementCounter("relay.payloads.helpers.skipped", "script", script);
    }

    public void recordAgentConnected() {
        incrementCounter("relay.agents.connections", "event", "connected");
    }

    public void recordAgentDisconnected(String reason) {
        incrementCounter("relay.agents.connections", "event", "disconnected", "reason", reason);
    }

    public void recordNetworkOperation(String operation, boolean success) {
        incrementCounter("relay.networks.operations", "operation", operation, "success", String.valueOf(success));
    }

    /**
     * Record circuit breaker state change.
     */
    public void recordCircuitBreakerStateChange(String name, String state) {
        incrementCounter("relay.circuitbreaker.state", "name", name, "state", state);
    }

    public void incrementCounter(String name) {
        counters.computeIfAbsent(name, k ->
            Counter.builder(name)
                .register(meterRegistry))
            .increment();
    }

    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k ->
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
}
