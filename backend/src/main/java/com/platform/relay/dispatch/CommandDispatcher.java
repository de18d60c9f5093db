package com.platform.relay.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.relay.agent.AgentConnection;
import com.platform.relay.agent.AgentDisconnectListener;
import com.platform.relay.agent.AgentMessageCodec;
import com.platform.relay.agent.AgentRecord;
import com.platform.relay.agent.AgentRegistry;
import com.platform.relay.config.RelayProperties;
import com.platform.relay.error.AgentDisconnectedException;
import com.platform.relay.error.AgentUnavailableException;
import com.platform.relay.error.CommandFailedException;
import com.platform.relay.error.CommandTimeoutException;
import com.platform.relay.observability.LoggingConfig;
import com.platform.relay.observability.RelayMetrics;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sends commands to agents and correlates their replies.
 *
 * Each command is SENT until exactly one of reply, agent error, timeout,
 * disconnect or send failure removes it from the pending map. Only the caller
 * that wins the removal completes the future and ends the command's span, so
 * later attempts are no-ops.
 */
@Slf4j
@Service
public class CommandDispatcher implements AgentDisconnectListener {

    private final Map<String, PendingCommand> pending = new ConcurrentHashMap<>();

    private final AgentRegistry registry;
    private final AgentMessageCodec codec;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final RelayMetrics metrics;
    private final Tracer tracer;
    private final Duration defaultTimeout;

    public CommandDispatcher(
            AgentRegistry registry,
            AgentMessageCodec codec,
            TaskScheduler scheduler,
            Clock clock,
            RelayMetrics metrics,
            Tracer tracer,
            RelayProperties properties) {
        this.registry = registry;
        this.codec = codec;
        this.scheduler = scheduler;
        this.clock = clock;
        this.metrics = metrics;
        this.tracer = tracer;
        this.defaultTimeout = properties.getCommands().getTimeout();

        registry.addDisconnectListener(this);
        metrics.registerGauge("relay.commands.pending", pending::size);
    }

    public CompletableFuture<JsonNode> send(String agentId, String type, Object payload) {
        return send(agentId, type, payload, defaultTimeout);
    }

    /**
     * Send a command and return a future for its result.
     *
     * @throws AgentUnavailableException if the agent has no live connection
     */
    public CompletableFuture<JsonNode> send(String agentId, String type, Object payload, Duration timeout) {
        AgentRecord agent = registry.get(agentId)
            .filter(AgentRecord::isConnected)
            .orElseThrow(() -> new AgentUnavailableException(agentId));
        AgentConnection connection = agent.getConnection();
        String connectionId = connection.id();

        String commandId = UUID.randomUUID().toString();
        Span span = tracer.spanBuilder("relay.command " + type)
            .setSpanKind(SpanKind.CLIENT)
            .setAttribute("messaging.system", "websocket")
            .setAttribute("relay.command.id", commandId)
            .setAttribute("relay.command.type", type)
            .setAttribute("relay.agent.id", agentId)
            .setAttribute("relay.agent.connection", connectionId)
            .startSpan();
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        PendingCommand command = new PendingCommand(
            commandId, agentId, connectionId, type, Instant.now(clock), future, span);
        pending.put(commandId, command);

        LoggingConfig.setCommandContext(agentId, commandId);
        try {
            // A removal that ran before the put may have missed this command
            if (!holdsConnection(agentId, connectionId)) {
                log.warn("Agent {} disconnected before command {} could be sent", agentId, commandId);
                resolve(command, CommandState.DISCONNECTED, new AgentDisconnectedException(agentId, commandId));
                return future;
            }

            command.attachTimeout(scheduler.schedule(
                () -> expire(command, timeout),
                scheduler.getClock().instant().plus(timeout)));

            connection.send(codec.encodeCommand(commandId, type, payload));
            metrics.recordCommandSent(type);
            log.info("Sent command {} ({}) to agent {}", commandId, type, agentId);
        } catch (TaskRejectedException e) {
            log.warn("Command {} to agent {} not sent: scheduler rejected its timeout", commandId, agentId);
            resolve(command, CommandState.FAILED, new AgentUnavailableException(agentId, e));
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to send command {} to agent {}: {}", commandId, agentId, e.getMessage());
            resolve(command, CommandState.FAILED, new AgentUnavailableException(agentId, e));
        } finally {
            LoggingConfig.clearCommandContext();
        }
        return future;
    }

    /**
     * Agent reported success for a command.
     */
    public void onResponse(String agentId, String commandId, JsonNode result) {
        PendingCommand command = claim(agentId, commandId, "response");
        if (command != null) {
            log.info("Command {} completed successfully", commandId);
            finish(command, CommandState.COMPLETED, result, null);
        }
    }

    /**
     * Agent reported failure for a command.
     */
    public void onError(String agentId, String commandId, String error) {
        PendingCommand command = claim(agentId, commandId, "error");
        if (command != null) {
            log.warn("Command {} failed on agent {}: {}", commandId, agentId, error);
            finish(command, CommandState.FAILED, null, new CommandFailedException(agentId, commandId, error));
        }
    }

    @Override
    public void onAgentDisconnected(String agentId, String connectionId, String reason) {
        List<PendingCommand> affected = pending.values().stream()
            .filter(command -> command.connectionId().equals(connectionId))
            .toList();

        int rejected = 0;
        for (PendingCommand command : affected) {
            if (pending.remove(command.commandId(), command)) {
                rejected++;
                finish(command, CommandState.DISCONNECTED, null,
                    new AgentDisconnectedException(agentId, command.commandId()));
            }
        }
        if (rejected > 0) {
            log.warn("Rejected {} pending command(s) of agent {} ({})", rejected, agentId, reason);
        }
    }

    public int pendingCount() {
        return pending.size();
    }

    public int pendingFor(String agentId) {
        return (int) pending.values().stream()
            .filter(command -> command.agentId().equals(agentId))
            .count();
    }

    /**
     * Number of pending commands whose timeout timer is still scheduled.
     */
    int liveTimers() {
        return (int) pending.values().stream().filter(PendingCommand::hasLiveTimer).count();
    }

    private void expire(PendingCommand command, Duration timeout) {
        if (resolve(command, CommandState.TIMED_OUT,
                new CommandTimeoutException(command.agentId(), command.commandId(), timeout))) {
            log.warn("Command {} to agent {} timed out after {}ms",
                command.commandId(), command.agentId(), timeout.toMillis());
        }
    }

    private PendingCommand claim(String agentId, String commandId, String kind) {
        PendingCommand command = pending.get(commandId);
        if (command == null) {
            log.warn("Dropping {} for unknown or already resolved command {} from agent {}", kind, commandId, agentId);
            return null;
        }
        if (!command.agentId().equals(agentId)) {
            log.warn("Dropping {} for command {} from agent {}: command belongs to agent {}",
                kind, commandId, agentId, command.agentId());
            return null;
        }
        return pending.remove(commandId, command) ? command : null;
    }

    private boolean holdsConnection(String agentId, String connectionId) {
        return registry.get(agentId)
            .map(record -> record.getConnection().id().equals(connectionId))
            .orElse(false);
    }

    private boolean resolve(PendingCommand command, CommandState state, RuntimeException failure) {
        if (!pending.remove(command.commandId(), command)) {
            return false;
        }
        finish(command, state, null, failure);
        return true;
    }

    private void finish(PendingCommand command, CommandState state, JsonNode result, RuntimeException failure) {
        command.cancelTimeout();
        command.endSpan(state, failure);
        metrics.recordCommandOutcome(command.type(), state.metricTag(),
            Duration.between(command.issuedAt(), Instant.now(clock)));
        if (failure == null) {
            command.future().complete(result);
        } else {
            command.future().completeExceptionally(failure);
        }
    }
}
