package com.platform.relay.lifecycle;

import com.platform.relay.agent.AgentRegistry;
import com.platform.relay.dispatch.CommandDispatcher;
import com.platform.relay.observability.RelayMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Graceful shutdown manager.
 *
 * Order:
 * 1. Close agent connections, which rejects their pending commands
 * 2. Report anything still pending
 * 3. Stop the scheduler (timeouts, sweeps, liveness checks)
 */
@Slf4j
@Component
public class GracefulShutdownManager implements ApplicationListener<ContextClosedEvent> {

    static final String SHUTDOWN_REASON = "Relay shutting down";

    private final AgentRegistry registry;
    private final CommandDispatcher dispatcher;
    private final ThreadPoolTaskScheduler taskScheduler;
    private final RelayMetrics metrics;
    private final Clock clock;

    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public GracefulShutdownManager(
            AgentRegistry registry,
            CommandDispatcher dispatcher,
            ThreadPoolTaskScheduler taskScheduler,
            RelayMetrics metrics,
            Clock clock) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.taskScheduler = taskScheduler;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        performGracefulShutdown();
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    public void performGracefulShutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            log.debug("Shutdown already in progress");
            return;
        }

        Instant started = clock.instant();
        log.info("========== GRACEFUL SHUTDOWN INITIATED ==========");

        log.info("[1/3] Closing {} agent connection(s)...", registry.connectedCount());
        registry.closeAll(SHUTDOWN_REASON);

        int pending = dispatcher.pendingCount();
        if (pending > 0) {
            log.warn("[2/3] {} command(s) still pending after agents closed", pending);
        } else {
            log.info("[2/3] No pending commands");
        }

        log.info("[3/3] Stopping scheduler...");
        taskScheduler.shutdown();

        metrics.incrementCounter("relay.lifecycle.shutdown", "status", "complete");
        log.info("========== GRACEFUL SHUTDOWN COMPLETE ({} ms) ==========",
            Duration.between(started, clock.instant()).toMillis());
    }
}
