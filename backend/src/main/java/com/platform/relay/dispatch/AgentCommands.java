package com.platform.relay.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.relay.config.RelayProperties;
import com.platform.relay.payload.EncryptedExecutionUnit;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Typed commands understood by executors.
 */
@Component
public class AgentCommands {

    public static final String CONTAINER_CREATE = "container.create";
    public static final String CONTAINER_START = "container.start";
    public static final String CONTAINER_STOP = "container.stop";
    public static final String CONTAINER_REMOVE = "container.remove";
    public static final String CONTAINER_LIST = "container.list";
    public static final String CONTAINER_EXEC = "container.exec";
    public static final String CONTAINER_LOGS = "container.logs";
    public static final String CONTAINER_INSPECT = "container.inspect";
    public static final String TOOL_EXECUTE = "tool.execute";

    private final CommandDispatcher dispatcher;
    private final int defaultLogTail;

    public AgentCommands(CommandDispatcher dispatcher, RelayProperties properties) {
        this.dispatcher = dispatcher;
        this.defaultLogTail = properties.getCommands().getDefaultLogTail();
    }

    public CompletableFuture<JsonNode> createContainer(String agentId, Map<String, Object> options) {
        return dispatcher.send(agentId, CONTAINER_CREATE, options == null ? Map.of() : options);
    }

    public CompletableFuture<JsonNode> startContainer(String agentId, String containerId) {
        return dispatcher.send(agentId, CONTAINER_START, Map.of("containerId", containerId));
    }

    public CompletableFuture<JsonNode> stopContainer(String agentId, String containerId) {
        return dispatcher.send(agentId, CONTAINER_STOP, Map.of("containerId", containerId));
    }

    public CompletableFuture<JsonNode> removeContainer(String agentId, String containerId) {
        return dispatcher.send(agentId, CONTAINER_REMOVE, Map.of("containerId", containerId));
    }

    public CompletableFuture<JsonNode> listContainers(String agentId) {
        return dispatcher.send(agentId, CONTAINER_LIST, Map.of());
    }

    public CompletableFuture<JsonNode> execInContainer(String agentId, String containerId, Object command) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("containerId", containerId);
        payload.put("command", command);
        return dispatcher.send(agentId, CONTAINER_EXEC, payload);
    }

    public CompletableFuture<JsonNode> containerLogs(String agentId, String containerId, Integer tail) {
        return dispatcher.send(agentId, CONTAINER_LOGS,
            Map.of("containerId", containerId, "tail", tail == null ? defaultLogTail : tail));
    }

    public CompletableFuture<JsonNode> inspectContainer(String agentId, String containerId) {
        return dispatcher.send(agentId, CONTAINER_INSPECT, Map.of("containerId", containerId));
    }

    /**
     * Relay an encrypted execution unit for the agent to decrypt and run.
     */
    public CompletableFuture<JsonNode> executeTool(String agentId, EncryptedExecutionUnit unit) {
        return dispatcher.send(agentId, TOOL_EXECUTE, unit);
    }
}
