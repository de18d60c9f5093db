package com.platform.relay.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * A command awaiting its agent's reply. Owned by {@link CommandDispatcher};
 * whoever removes it from the pending map resolves it.
 */
final class PendingCommand {

    private final String commandId;
    private final String agentId;
    private final String connectionId;
    private final String type;
    private final Instant issuedAt;
    private final CompletableFuture<JsonNode> future;
    private final Span span;

    private ScheduledFuture<?> timeout;

    PendingCommand(String commandId, String agentId, String connectionId, String type,
                   Instant issuedAt, CompletableFuture<JsonNode> future, Span span) {
        this.commandId = commandId;
        this.agentId = agentId;
        this.connectionId = connectionId;
        this.type = type;
        this.issuedAt = issuedAt;
        this.future = future;
        this.span = span;
    }

    /**
     * Attach the timer. If the command already resolved the timer is cancelled at once.
     */
    synchronized void attachTimeout(ScheduledFuture<?> scheduled) {
        this.timeout = scheduled;
        if (future.isDone()) {
            scheduled.cancel(false);
        }
    }

    synchronized void cancelTimeout() {
        if (timeout != null) {
            timeout.cancel(false);
        }
    }

    synchronized boolean hasLiveTimer() {
        return timeout != null && !timeout.isDone();
    }

    /**
     * Close the command's span with its terminal state.
     */
    void endSpan(CommandState state, Throwable failure) {
        span.setAttribute("relay.command.outcome", state.metricTag());
        if (failure != null) {
            span.recordException(failure);
            span.setStatus(StatusCode.ERROR, failure.getMessage());
        } else {
            span.setStatus(StatusCode.OK);
        }
        span.end();
    }

    String commandId() {
        return commandId;
    }

    String agentId() {
        return agentId;
    }

    String connectionId() {
        return connectionId;
    }

    String type() {
        return type;
    }

    Instant issuedAt() {
        return issuedAt;
    }

    CompletableFuture<JsonNode> future() {
        return future;
    }
}
