package com.platform.relay.security;

import com.platform.relay.config.RelayProperties;
import com.platform.relay.error.ErrorCode;
import com.platform.relay.observability.ClientAddresses;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards the provisioning API with a shared token. Without a configured token the API is closed.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class InternalTokenFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Internal-Token";

    private static final String PROTECTED_PREFIX = "/internal/";

    private final RelayProperties properties;
    private final SecurityAuditLogger auditLogger;
    private final ErrorResponseWriter errorWriter;

    public InternalTokenFilter(RelayProperties properties, SecurityAuditLogger auditLogger,
                               ErrorResponseWriter errorWriter) {
        this.properties = properties;
        this.auditLogger = auditLogger;
        this.errorWriter = errorWriter;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().substring(request.getContextPath().length()).startsWith(PROTECTED_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String expected = properties.getSecurity().getInternalToken();
        String presented = request.getHeader(HEADER);

        if (expected == null || expected.isBlank()) {
            log.warn("Internal API called but relay.security.internal-token is not configured");
            errorWriter.write(response, ErrorCode.FORBIDDEN, HttpStatus.FORBIDDEN.value(), request.getRequestURI());
            return;
        }
        if (presented == null || !MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8))) {
            auditLogger.logAuthentication(null, ClientAddresses.of(request), false, "internal-token",
                presented == null ? "missing token" : "token mismatch");
            ErrorCode code = presented == null ? ErrorCode.MISSING_CREDENTIAL : ErrorCode.INVALID_CREDENTIAL;
            errorWriter.write(response, code, HttpStatus.UNAUTHORIZED.value(), request.getRequestURI());
            return;
        }
        chain.doFilter(request, response);
    }
}
