package com.platform.relay.api;

import com.platform.relay.payload.EncryptedExecutionUnit;
import com.platform.relay.payload.PayloadBuilder;
import com.platform.relay.payload.ToolCatalog;
import com.platform.relay.security.TenantContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API for the tool catalog and encrypted payload generation.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ToolController {

    private final ToolCatalog toolCatalog;
    private final PayloadBuilder payloadBuilder;

    @GetMapping("/tools")
    public Map<String, Object> listTools() {
        List<ToolSummary> tools = toolCatalog.all().stream()
            .map(tool -> new ToolSummary(tool.name(), tool.description()))
            .toList();
        return Map.of("success", true, "tools", tools);
    }

    /**
     * Package a tool invocation for the caller to deliver to its executor.
     */
    @PostMapping("/execute")
    public EncryptedExecutionUnit execute(
            @RequestAttribute(TenantContext.ATTRIBUTE) TenantContext tenant,
            @Valid @RequestBody ApiRequests.ToolRequest request) {
        log.info("Building payload for tool {} (tenant {})", request.getTool(), tenant.tenantId());
        return payloadBuilder.buildForTool(request.getTool(), request.getArguments(), tenant.toTenantKey());
    }

    public record ToolSummary(String name, String description) {}
}
