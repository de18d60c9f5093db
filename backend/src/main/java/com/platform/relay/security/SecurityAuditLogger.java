package com.platform.relay.security;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * Security audit logger for sensitive operations.
 *
 * Logs:
 * - Tenant authentication over HTTP and agent handshakes
 * - Agent connect/disconnect
 * - Tenant network allocation/release and relay attachment
 * - Rate limit violations
 */
@Slf4j
@Component
public class SecurityAuditLogger {

    private static final String AUDIT_PREFIX = "[AUDIT]";

    public void logAuthentication(String tenantId, String clientIp,
            boolean success, String method, String detail) {

        AuditEvent event = AuditEvent.builder()
            .eventType(success ? AuditEventType.AUTH_SUCCESS : AuditEventType.AUTH_FAILURE)
            .action("AUTHENTICATE")
            .resourceType("Tenant")
            .tenantId(tenantId)
            .clientIp(clientIp)
            .success(success)
            .detail(detail)
            .metadata(Map.of("method", method))
            .build();

        logAuditEvent(event);
    }

    public void logAgentConnected(String agentId, String tenantId, String hostname) {
        AuditEvent event = AuditEvent.builder()
            .eventType(AuditEventType.AGENT_CONNECTED)
            .action("CONNECT")
            .resourceType("Agent")
            .resourceId(agentId)
            .tenantId(tenantId)
            .success(true)
            .detail("hostname=" + hostname)
            .build();

        logAuditEvent(event);
    }

    public void logAgentDisconnected(String agentId, String tenantId, String reason) {
        AuditEvent event = AuditEvent.builder()
            .eventType(AuditEventType.AGENT_DISCONNECTED)
            .action("DISCONNECT")
            .resourceType("Agent")
            .resourceId(agentId)
            .tenantId(tenantId)
            .success(true)
            .detail(reason)
            .build();

        logAuditEvent(event);
    }

    /**
     * Log a tenant network lifecycle operation (ALLOCATE, ATTACH_RELAY, RELEASE).
     */
    public void logNetworkOperation(String tenantId, String action, String subnet, boolean success, String detail) {
        AuditEvent event = AuditEvent.builder()
            .eventType(AuditEventType.NETWORK_OPERATION)
            .action(action)
            .resourceType("TenantNetwork")
            .resourceId(subnet)
            .tenantId(tenantId)
            .success(success)
            .detail(detail)
            .build();

        logAuditEvent(event);
    }

    public void logRateLimitViolation(String clientIp, String path) {
        AuditEvent event = AuditEvent.builder()
            .eventType(AuditEventType.RATE_LIMIT_EXCEEDED)
            .action("BLOCK")
            .resourceType("RateLimit")
            .resourceId("global")
            .clientIp(clientIp)
            .success(false)
            .detail("Rate limit exceeded for " + path)
            .build();

        logAuditEvent(event);
    }

    private void logAuditEvent(AuditEvent event) {
        MDC.put("auditEventType", event.eventType().name());
        MDC.put("auditAction", event.action());
        MDC.put("auditResourceType", event.resourceType());
        if (event.resourceId() != null) MDC.put("auditResourceId", event.resourceId());
        if (event.tenantId() != null) MDC.put("auditTenantId", event.tenantId());
        if (event.clientIp() != null) MDC.put("auditClientIp", event.clientIp());
        MDC.put("auditSuccess", String.valueOf(event.success()));

        try {
            String logMessage = String.format(
                "%s %s %s %s resource=%s/%s tenant=%s ip=%s success=%s detail=\"%s\"",
                AUDIT_PREFIX,
                event.eventType(),
                event.action(),
                event.timestamp(),
                event.resourceType(),
                event.resourceId() != null ? event.resourceId() : "-",
                event.tenantId() != null ? event.tenantId() : "anonymous",
                event.clientIp() != null ? event.clientIp() : "-",
                event.success(),
                event.detail() != null ? event.detail() : ""
            );

            if (event.success()) {
                log.info(logMessage);
            } else {
                log.warn(logMessage);
            }
        } finally {
            MDC.remove("auditEventType");
            MDC.remove("auditAction");
            MDC.remove("auditResourceType");
            MDC.remove("auditResourceId");
            MDC.remove("auditTenantId");
            MDC.remove("auditClientIp");
            MDC.remove("auditSuccess");
        }
    }

    public enum AuditEventType {
        AUTH_SUCCESS,
        AUTH_FAILURE,
        AGENT_CONNECTED,
        AGENT_DISCONNECTED,
        NETWORK_OPERATION,
        RATE_LIMIT_EXCEEDED
    }

    @lombok.Builder
    public record AuditEvent(
        AuditEventType eventType,
        String action,
        String resourceType,
        String resourceId,
        String tenantId,
        String clientIp,
        boolean success,
        String detail,
        Map<String, Object> metadata,
        Instant timestamp
    ) {
        public AuditEvent {
            if (timestamp == null) {
                timestamp = Instant.now();
            }
        }
    }
}
