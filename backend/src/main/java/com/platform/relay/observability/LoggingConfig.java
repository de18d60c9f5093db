package com.platform.relay.observability;

import ch.qos.logback.classic.LoggerContext;
import jakarta.annotation.PostConstruct;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Logging configuration with correlation IDs and relay MDC helpers.
 */
@Slf4j
@Configuration
public class LoggingConfig {

    public static final String MDC_TENANT_ID = "tenantId";
    public static final String MDC_AGENT_ID = "agentId";
    public static final String MDC_COMMAND_ID = "commandId";

    @Value("${spring.application.name:tools-relay}")
    private String applicationName;

    @PostConstruct
    public void init() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.putProperty("application", applicationName);

        log.info("Logging configuration initialized for application: {}", applicationName);
    }

    /**
     * Filter to add correlation ID to all requests.
     */
    @Bean
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }

    public static class CorrelationIdFilter extends OncePerRequestFilter {

        static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
        private static final String MDC_CORRELATION_ID = "correlationId";
        private static final String MDC_REQUEST_PATH = "requestPath";
        private static final String MDC_REQUEST_METHOD = "requestMethod";

        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {

            try {
                String correlationId = request.getHeader(CORRELATION_ID_HEADER);
                if (correlationId == null || correlationId.isBlank()) {
                    correlationId = UUID.randomUUID().toString();
                }

                MDC.put(MDC_CORRELATION_ID, correlationId);
                MDC.put(MDC_REQUEST_PATH, request.getRequestURI());
                MDC.put(MDC_REQUEST_METHOD, request.getMethod());

                response.setHeader(CORRELATION_ID_HEADER, correlationId);

                filterChain.doFilter(request, response);

            } finally {
                MDC.remove(MDC_CORRELATION_ID);
                MDC.remove(MDC_REQUEST_PATH);
                MDC.remove(MDC_REQUEST_METHOD);
                MDC.remove(MDC_TENANT_ID);
            }
        }
    }

    /**
     * Set agent and command context for dispatcher logging.
     */
    public static void setCommandContext(String agentId, String commandId) {
        MDC.put(MDC_AGENT_ID, agentId);
        if (commandId != null) {
            MDC.put(MDC_COMMAND_ID, commandId);
        }
    }

    public static void clearCommandContext() {
        MDC.remove(MDC_AGENT_ID);
        MDC.remove(MDC_COMMAND_ID);
    }

    public static void setTenantContext(String tenantId) {
        MDC.put(MDC_TENANT_ID, tenantId);
    }
}
