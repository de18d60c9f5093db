package com.platform.relay.observability;

import com.platform.relay.config.RelayProperties;
import com.platform.relay.security.TenantContext;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

class HttpTracingFilterTest {

    private InMemorySpanExporter spans;
    private SdkTracerProvider tracerProvider;
    private HttpTracingFilter filter;

    @BeforeEach
    void setUp() {
        spans = InMemorySpanExporter.create();
        tracerProvider = SdkTracerProvider.builder()
            .addSpanProcessor(SimpleSpanProcessor.create(spans))
            .build();
        OpenTelemetry openTelemetry = OpenTelemetrySdk.builder()
            .setTracerProvider(tracerProvider)
            .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
            .build();
        filter = new HttpTracingFilter(openTelemetry.getTracer("test"), openTelemetry, new RelayProperties());
    }

    @AfterEach
    void tearDown() {
        tracerProvider.close();
    }

    @Test
    void requestSpanCollapsesIdsAndRecordsTenant() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/agents/agent-1/containers/c1/logs");
        MockHttpServletResponse response = new MockHttpServletResponse();
        String[] traceIdInChain = new String[1];

        filter.doFilter(request, response, (req, res) -> {
            traceIdInChain[0] = MDC.get(HttpTracingFilter.MDC_TRACE_ID);
            req.setAttribute(TenantContext.ATTRIBUTE, new TenantContext("tenant-1", "vm-1", "aa"));
            ((HttpServletResponse) res).setStatus(404);
        });

        SpanData span = onlySpan();
        assertThat(span.getName()).isEqualTo("GET /api/agents/{id}/containers/{id}/logs");
        assertThat(span.getAttributes().get(AttributeKey.longKey("http.response.status_code"))).isEqualTo(404L);
        assertThat(span.getAttributes().get(AttributeKey.stringKey("relay.tenant.id"))).isEqualTo("tenant-1");
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.UNSET);
        assertThat(traceIdInChain[0]).isEqualTo(span.getTraceId());
        assertThat(response.getHeader(HttpTracingFilter.TRACE_HEADER)).isEqualTo(span.getTraceId());
        assertThat(MDC.get(HttpTracingFilter.MDC_TRACE_ID)).isNull();
    }

    @Test
    void serverErrorMarksTheSpan() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("POST", "/api/execute"), response,
            (req, res) -> ((HttpServletResponse) res).setStatus(500));

        assertThat(onlySpan().getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
    }

    @Test
    void incomingTraceparentIsContinued() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/tools");
        request.addHeader("traceparent", "00-0af7651916cd43dd8448eb211c80319c-b7ad6b7169203331-01");

        filter.doFilter(request, new MockHttpServletResponse(), (req, res) -> { });

        SpanData span = onlySpan();
        assertThat(span.getTraceId()).isEqualTo("0af7651916cd43dd8448eb211c80319c");
        assertThat(span.getParentSpanId()).isEqualTo("b7ad6b7169203331");
    }

    @Test
    void asyncRequestSpanEndsWhenTheAsyncCycleCompletes() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/agents/agent-1/commands");
        request.setAsyncSupported(true);
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> req.startAsync(req, res));

        assertThat(spans.getFinishedSpanItems()).isEmpty();

        request.getAsyncContext().complete();

        assertThat(onlySpan().getName()).isEqualTo("POST /api/agents/{id}/commands");
    }

    @Test
    void actuatorRequestsAreNotTraced() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("GET", "/actuator/prometheus"), response, (req, res) -> { });

        assertThat(spans.getFinishedSpanItems()).isEmpty();
        assertThat(response.getHeader(HttpTracingFilter.TRACE_HEADER)).isNull();
    }

    private SpanData onlySpan() {
        assertThat(spans.getFinishedSpanItems()).hasSize(1);
        return spans.getFinishedSpanItems().get(0);
    }
}
