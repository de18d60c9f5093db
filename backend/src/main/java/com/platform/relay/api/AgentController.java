package com.platform.relay.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.relay.agent.AgentRecord;
import com.platform.relay.agent.AgentRegistry;
import com.platform.relay.agent.AgentSummary;
import com.platform.relay.dispatch.AgentCommands;
import com.platform.relay.dispatch.CommandDispatcher;
import com.platform.relay.error.AgentUnavailableException;
import com.platform.relay.error.ResourceNotFoundException;
import com.platform.relay.payload.EncryptedExecutionUnit;
import com.platform.relay.payload.PayloadBuilder;
import com.platform.relay.security.TenantContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * REST API for a tenant's connected agents and the commands relayed to them.
 * Agents of other tenants are invisible: they read as not found or not connected.
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/agents")
@RequiredArgsConstructor
public class AgentController {

    private final AgentRegistry registry;
    private final CommandDispatcher dispatcher;
    private final AgentCommands commands;
    private final PayloadBuilder payloadBuilder;

    @GetMapping
    public Map<String, Object> listAgents(@RequestAttribute(TenantContext.ATTRIBUTE) TenantContext tenant) {
        List<AgentSummary> agents = registry.list(tenant.tenantId());
        return Map.of("success", true, "agents", agents);
    }

    @GetMapping("/{agentId}")
    public AgentSummary getAgent(@RequestAttribute(TenantContext.ATTRIBUTE) TenantContext tenant,
                                 @PathVariable String agentId) {
        return registry.getForTenant(agentId, tenant.tenantId())
            .map(AgentRecord::toSummary)
            .orElseThrow(() -> ResourceNotFoundException.agent(agentId));
    }

    /**
     * Build an encrypted execution unit for the tool and relay it to the agent.
     */
    @PostMapping("/{agentId}/execute")
    public CompletableFuture<CommandResult> executeTool(
            @RequestAttribute(TenantContext.ATTRIBUTE) TenantContext tenant,
            @PathVariable String agentId,
            @Valid @RequestBody ApiRequests.ToolRequest request) {
        requireAgent(tenant, agentId);
        EncryptedExecutionUnit unit = payloadBuilder.buildForTool(
            request.getTool(), request.getArguments(), tenant.toTenantKey());
        return commands.executeTool(agentId, unit).thenApply(CommandResult::of);
    }

    @PostMapping("/{agentId}/commands")
    public CompletableFuture<CommandResult> sendCommand(
            @RequestAttribute(TenantContext.ATTRIBUTE) TenantContext tenant,
            @PathVariable String agentId,
            @Valid @RequestBody ApiRequests.CommandRequest request) {
        requireAgent(tenant, agentId);
        Object payload = request.getPayload() == null ? Map.of() : request.getPayload();
        return dispatcher.send(agentId, request.getType(), payload).thenApply(CommandResult::of);
    }

    // ==================== Containers ====================

    @PostMapping("/{agentId}/containers")
    public CompletableFuture<CommandResult> createContainer(
            @RequestAttribute(TenantContext.ATTRIBUTE) TenantContext tenant,
            @PathVariable String agentId,
            @RequestBody(required = false) Map<String, Object> options) {
        requireAgent(tenant, agentId);
        return wrap(commands.createContainer(agentId, options));
    }

    @GetMapping("/{agentId}/containers")
    public CompletableFuture<CommandResult> listContainers(
            @RequestAttribute(TenantContext.ATTRIBUTE) TenantContext tenant,
            @PathVariable String agentId) {
        requireAgent(tenant, agentId);
        return wrap(commands.listContainers(agentId));
    }

    @GetMapping("/{agentId}/containers/{containerId}")
    public CompletableFuture<CommandResult> inspectContainer(
            @RequestAttribute(TenantContext.ATTRIBUTE) TenantContext tenant,
            @PathVariable String agentId,
            @PathVariable String containerId) {
        requireAgent(tenant, agentId);
        return wrap(commands.inspectContainer(agentId, containerId));
    }

    @PostMapping("/{agentId}/containers/{containerId}/start")
    public CompletableFuture<CommandResult> startContainer(
            @RequestAttribute(TenantContext.ATTRIBUTE) TenantContext tenant,
            @PathVariable String agentId,
            @PathVariable String containerId) {
        requireAgent(tenant, agentId);
        return wrap(commands.startContainer(agentId, containerId));
    }

    @PostMapping("/{agentId}/containers/{containerId}/stop")
    public CompletableFuture<CommandResult> stopContainer(
            @RequestAttribute(TenantContext.ATTRIBUTE) TenantContext tenant,
            @PathVariable String agentId,
            @PathVariable String containerId) {
        requireAgent(tenant, agentId);
        return wrap(commands.stopContainer(agentId, containerId));
    }

    @DeleteMapping("/{agentId}/containers/{containerId}")
    public CompletableFuture<CommandResult> removeContainer(
            @RequestAttribute(TenantContext.ATTRIBUTE) TenantContext tenant,
            @PathVariable String agentId,
            @PathVariable String containerId) {
        requireAgent(tenant, agentId);
        return wrap(commands.removeContainer(agentId, containerId));
    }

    @PostMapping("/{agentId}/containers/{containerId}/exec")
    public CompletableFuture<CommandResult> execInContainer(
            @RequestAttribute(TenantContext.ATTRIBUTE) TenantContext tenant,
            @PathVariable String agentId,
            @PathVariable String containerId,
            @Valid @RequestBody ApiRequests.ExecRequest request) {
        requireAgent(tenant, agentId);
        return wrap(commands.execInContainer(agentId, containerId, request.getCommand()));
    }

    @GetMapping("/{agentId}/containers/{containerId}/logs")
    public CompletableFuture<CommandResult> containerLogs(
            @RequestAttribute(TenantContext.ATTRIBUTE) TenantContext tenant,
            @PathVariable String agentId,
            @PathVariable String containerId,
            @RequestParam(required = false) @Min(1) @Max(10000) Integer tail) {
        requireAgent(tenant, agentId);
        return wrap(commands.containerLogs(agentId, containerId, tail));
    }

    private void requireAgent(TenantContext tenant, String agentId) {
        if (registry.getForTenant(agentId, tenant.tenantId()).isEmpty()) {
            throw new AgentUnavailableException(agentId);
        }
    }

    private static CompletableFuture<CommandResult> wrap(CompletableFuture<JsonNode> result) {
        return result.thenApply(CommandResult::of);
    }
}
