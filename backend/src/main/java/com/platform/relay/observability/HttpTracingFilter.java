package com.platform.relay.observability;

import com.platform.relay.config.RelayProperties;
import com.platform.relay.security.TenantContext;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapGetter;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;

/**
 * Server span per HTTP request.
 *
 * Agent routes answer asynchronously, so the span of an async request ends
 * when the async cycle completes rather than when the filter chain returns.
 * The trace id is copied into the MDC and the X-Trace-ID response header.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class HttpTracingFilter extends OncePerRequestFilter {

    static final String MDC_TRACE_ID = "trace_id";
    static final String TRACE_HEADER = "X-Trace-ID";

    private static final TextMapGetter<HttpServletRequest> HEADERS = new TextMapGetter<>() {
        @Override
        public Iterable<String> keys(HttpServletRequest carrier) {
            return Collections.list(carrier.getHeaderNames());
        }

        @Override
        public String get(HttpServletRequest carrier, String key) {
            return carrier == null ? null : carrier.getHeader(key);
        }
    };

    private final Tracer tracer;
    private final OpenTelemetry openTelemetry;
    private final boolean enabled;

    public HttpTracingFilter(Tracer tracer, OpenTelemetry openTelemetry, RelayProperties properties) {
        this.tracer = tracer;
        this.openTelemetry = openTelemetry;
        this.enabled = properties.getTracing().isHttpEnabled();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !enabled || request.getRequestURI().startsWith("/actuator");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        Context parent = openTelemetry.getPropagators().getTextMapPropagator()
            .extract(Context.current(), request, HEADERS);

        Span span = tracer.spanBuilder(request.getMethod() + " " + routeOf(request.getRequestURI()))
            .setParent(parent)
            .setSpanKind(SpanKind.SERVER)
            .setAttribute("http.request.method", request.getMethod())
            .setAttribute("url.path", request.getRequestURI())
            .setAttribute("client.address", ClientAddresses.of(request))
            .startSpan();

        String traceId = span.getSpanContext().getTraceId();
        MDC.put(MDC_TRACE_ID, traceId);
        response.setHeader(TRACE_HEADER, traceId);

        boolean async = false;
        try (Scope ignored = span.makeCurrent()) {
            chain.doFilter(request, response);
            if (request.isAsyncStarted()) {
                async = true;
                request.getAsyncContext().addListener(new SpanEndingListener(span, request));
            }
        } catch (IOException | ServletException | RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getClass().getSimpleName());
            throw e;
        } finally {
            if (!async) {
                end(span, request, response);
            }
            MDC.remove(MDC_TRACE_ID);
        }
    }

    /**
     * Collapse agent, tenant and container ids so span names stay low-cardinality.
     */
    static String routeOf(String path) {
        return path.replaceAll("/(agents|tenants|containers|circuit-breakers)/[^/]+", "/$1/{id}");
    }

    private static void end(Span span, HttpServletRequest request, HttpServletResponse response) {
        int status = response.getStatus();
        span.setAttribute("http.response.status_code", status);
        if (request.getAttribute(TenantContext.ATTRIBUTE) instanceof TenantContext tenant) {
            span.setAttribute("relay.tenant.id", tenant.tenantId());
        }
        // 4xx is the caller's fault and leaves a server span unset
        if (status >= 500) {
            span.setStatus(StatusCode.ERROR, "HTTP " + status);
        }
        span.end();
    }

    private static final class SpanEndingListener implements AsyncListener {

        private final Span span;
        private final HttpServletRequest request;

        SpanEndingListener(Span span, HttpServletRequest request) {
            this.span = span;
            this.request = request;
        }

        @Override
        public void onComplete(AsyncEvent event) {
            end(span, request, (HttpServletResponse) event.getSuppliedResponse());
        }

        @Override
        public void onTimeout(AsyncEvent event) {
            span.setAttribute("relay.async.timeout", true);
        }

        @Override
        public void onError(AsyncEvent event) {
            if (event.getThrowable() != null) {
                span.recordException(event.getThrowable());
            }
        }

        @Override
        public void onStartAsync(AsyncEvent event) {
            event.getAsyncContext().addListener(this);
        }
    }
}
