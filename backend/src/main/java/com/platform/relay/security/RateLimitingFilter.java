package com.platform.relay.security;

import com.platform.relay.config.RelayProperties;
import com.platform.relay.error.ErrorResponse;
import com.platform.relay.observability.ClientAddresses;
import com.platform.relay.observability.RelayMetrics;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Token bucket rate limit per client IP on the tenant API.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RateLimitingFilter implements Filter {

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    private final RelayProperties.Security config;
    private final SecurityAuditLogger auditLogger;
    private final ErrorResponseWriter errorWriter;
    private final RelayMetrics metrics;

    public RateLimitingFilter(RelayProperties properties, SecurityAuditLogger auditLogger,
                              ErrorResponseWriter errorWriter, RelayMetrics metrics) {
        this.config = properties.getSecurity();
        this.auditLogger = auditLogger;
        this.errorWriter = errorWriter;
        this.metrics = metrics;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;
        String path = httpRequest.getRequestURI();

        if (!config.isRateLimitEnabled() || !path.startsWith("/api/")) {
            chain.doFilter(request, response);
            return;
        }

        String clientIp = ClientAddresses.of(httpRequest);
        Bucket bucket = buckets.computeIfAbsent(clientIp, ip -> createBucket(config.getRequestsPerMinute()));
        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1);

        if (!probe.isConsumed()) {
            long retryAfterSeconds = Math.max(1, TimeUnit.NANOSECONDS.toSeconds(probe.getNanosToWaitForRefill()));
            log.warn("[RATE_LIMIT] Blocked {} {} from {}", httpRequest.getMethod(), path, clientIp);
            auditLogger.logRateLimitViolation(clientIp, path);
            metrics.incrementCounter("relay.ratelimit.blocked");

            httpResponse.setHeader("Retry-After", String.valueOf(retryAfterSeconds));
            httpResponse.setHeader("X-RateLimit-Limit", String.valueOf(config.getRequestsPerMinute()));
            httpResponse.setHeader("X-RateLimit-Remaining", "0");
            errorWriter.write(httpResponse, ErrorResponse.builder()
                .success(false)
                .error("Rate limit exceeded")
                .code("RL-429")
                .message("Rate limit exceeded")
                .detail("Too many requests from " + clientIp)
                .fatal(false)
                .status(429)
                .timestamp(Instant.now())
                .path(path)
                .traceId(MDC.get("trace_id"))
                .metadata(Map.of("retryAfterSeconds", retryAfterSeconds))
                .build());
            return;
        }

        httpResponse.setHeader("X-RateLimit-Remaining", String.valueOf(probe.getRemainingTokens()));
        chain.doFilter(request, response);
    }

    private Bucket createBucket(int requestsPerMinute) {
        Bandwidth limit = Bandwidth.classic(
            requestsPerMinute,
            Refill.greedy(requestsPerMinute, Duration.ofMinutes(1))
        );
        return Bucket.builder().addLimit(limit).build();
    }
}
