package com.platform.relay.agent;

import com.platform.relay.error.AuthenticationException;
import com.platform.relay.keystore.KeyStore;
import com.platform.relay.keystore.TenantKey;
import com.platform.relay.lifecycle.GracefulShutdownManager;
import com.platform.relay.security.SecurityAuditLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Authenticates the agent handshake with the tenant's bearer secret and
 * records who is connecting in the session attributes.
 */
@Slf4j
@Component
public class AgentHandshakeInterceptor implements HandshakeInterceptor {

    static final String ATTR_AGENT_ID = "relay.agentId";
    static final String ATTR_TENANT_ID = "relay.tenantId";
    static final String ATTR_METADATA = "relay.metadata";

    private static final String BEARER_PREFIX = "Bearer ";

    private final KeyStore keyStore;
    private final SecurityAuditLogger auditLogger;
    private final GracefulShutdownManager shutdownManager;

    public AgentHandshakeInterceptor(KeyStore keyStore, SecurityAuditLogger auditLogger,
                                     GracefulShutdownManager shutdownManager) {
        this.keyStore = keyStore;
        this.auditLogger = auditLogger;
        this.shutdownManager = shutdownManager;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        MultiValueMap<String, String> params = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams();
        String clientIp = request.getRemoteAddress() == null ? null : request.getRemoteAddress().getHostString();

        // Agents closed by the shutdown reconnect at once; keep them out until the relay is gone
        if (shutdownManager.isShuttingDown()) {
            log.info("Rejected agent handshake from {}: relay is shutting down", clientIp);
            response.setStatusCode(HttpStatus.SERVICE_UNAVAILABLE);
            return false;
        }

        String agentId = param(params, "agentId");
        if (agentId == null || agentId.isBlank()) {
            log.warn("Rejected agent handshake from {}: agentId missing", clientIp);
            response.setStatusCode(HttpStatus.BAD_REQUEST);
            return false;
        }

        TenantKey tenant;
        try {
            tenant = keyStore.resolve(secret(request, params));
        } catch (AuthenticationException e) {
            log.warn("Rejected agent handshake for {} from {}: {}", agentId, clientIp, e.getMessage());
            auditLogger.logAuthentication(null, clientIp, false, "agent-handshake", e.getMessage());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }

        auditLogger.logAuthentication(tenant.tenantId(), clientIp, true, "agent-handshake", "agent " + agentId);
        attributes.put(ATTR_AGENT_ID, agentId);
        attributes.put(ATTR_TENANT_ID, tenant.tenantId());
        attributes.put(ATTR_METADATA, new AgentMetadata(
            param(params, "hostname"),
            param(params, "platform"),
            param(params, "executorVersion")));
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.warn("Agent handshake failed: {}", exception.getMessage());
        }
    }

    private static String secret(ServerHttpRequest request, MultiValueMap<String, String> params) {
        String header = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            return header.substring(BEARER_PREFIX.length()).trim();
        }
        return param(params, "token");
    }

    private static String param(MultiValueMap<String, String> params, String name) {
        String raw = params.getFirst(name);
        return raw == null ? null : UriUtils.decode(raw, StandardCharsets.UTF_8);
    }
}
