package com.platform.relay.security;

import com.platform.relay.error.AuthenticationException;
import com.platform.relay.keystore.KeyStore;
import com.platform.relay.keystore.TenantKey;
import com.platform.relay.observability.ClientAddresses;
import com.platform.relay.observability.LoggingConfig;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Authenticates tenant API calls by their bearer secret.
 * On success the resolved {@link TenantContext} is stored as a request attribute.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class BearerAuthenticationFilter extends OncePerRequestFilter {

    static final String PROTECTED_PREFIX = "/api/";
    static final String HEALTH_PATH = "/api/health";

    private static final String BEARER_PREFIX = "Bearer ";

    private final KeyStore keyStore;
    private final SecurityAuditLogger auditLogger;
    private final ErrorResponseWriter errorWriter;

    public BearerAuthenticationFilter(KeyStore keyStore, SecurityAuditLogger auditLogger,
                                      ErrorResponseWriter errorWriter) {
        this.keyStore = keyStore;
        this.auditLogger = auditLogger;
        this.errorWriter = errorWriter;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return !path.startsWith(PROTECTED_PREFIX) || path.equals(HEALTH_PATH);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String clientIp = ClientAddresses.of(request);
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        String secret = header != null && header.startsWith(BEARER_PREFIX)
            ? header.substring(BEARER_PREFIX.length()).trim()
            : null;

        TenantKey tenant;
        try {
            tenant = keyStore.resolve(secret);
        } catch (AuthenticationException e) {
            auditLogger.logAuthentication(null, clientIp, false, "bearer", e.getMessage());
            errorWriter.write(response, e.getErrorCode(), HttpStatus.UNAUTHORIZED.value(), request.getRequestURI());
            return;
        }

        request.setAttribute(TenantContext.ATTRIBUTE, TenantContext.of(tenant));
        LoggingConfig.setTenantContext(tenant.tenantId());
        log.debug("Authenticated {} {} for tenant {}", request.getMethod(), request.getRequestURI(), tenant.tenantId());
        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(LoggingConfig.MDC_TENANT_ID);
        }
    }
}
