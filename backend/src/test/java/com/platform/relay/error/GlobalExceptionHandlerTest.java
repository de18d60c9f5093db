package com.platform.relay.error;

import com.platform.relay.observability.RelayMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import java.time.Duration;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final GlobalExceptionHandler handler = new GlobalExceptionHandler(new RelayMetrics(meterRegistry));
    private final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/agents/a1/execute");

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void agentAndNetworkErrorsMapToGatewayStatuses() {
        assertThat(GlobalExceptionHandler.mapErrorCodeToStatus(ErrorCode.AGENT_UNAVAILABLE))
            .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(GlobalExceptionHandler.mapErrorCodeToStatus(ErrorCode.COMMAND_TIMEOUT))
            .isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
        assertThat(GlobalExceptionHandler.mapErrorCodeToStatus(ErrorCode.COMMAND_FAILED))
            .isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(GlobalExceptionHandler.mapErrorCodeToStatus(ErrorCode.NETWORK_ISOLATION_VIOLATION))
            .isEqualTo(HttpStatus.CONFLICT);
        assertThat(GlobalExceptionHandler.mapErrorCodeToStatus(ErrorCode.UNKNOWN_TOOL))
            .isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(GlobalExceptionHandler.mapErrorCodeToStatus(ErrorCode.INVALID_CREDENTIAL))
            .isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(GlobalExceptionHandler.mapErrorCodeToStatus(ErrorCode.ENCRYPTION_ERROR))
            .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @Test
    void relayExceptionCarriesCodeAndMetadata() {
        ResponseEntity<ErrorResponse> response = handler.handleRelayException(
            new CommandTimeoutException("agent-1", "cmd-9", Duration.ofSeconds(60)), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
        ErrorResponse body = response.getBody();
        assertThat(body).isNotNull();
        assertThat(body.isSuccess()).isFalse();
        assertThat(body.getCode()).isEqualTo("RL-401");
        assertThat(body.getPath()).isEqualTo("/api/agents/a1/execute");
        assertThat(body.getTraceId()).isNotBlank();
        assertThat(body.getMetadata()).containsEntry("agentId", "agent-1").containsEntry("commandId", "cmd-9");
        assertThat(meterRegistry.get("relay.errors").tag("code", "RL-401").counter().count()).isEqualTo(1.0);
    }

    @Test
    void validationErrorListsTheField() {
        ResponseEntity<ErrorResponse> response = handler.handleRelayException(
            ValidationException.unknownTool("format_disk"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getFieldErrors()).singleElement()
            .satisfies(error -> {
                assertThat(error.getField()).isEqualTo("tool");
                assertThat(error.getRejectedValue()).isEqualTo("format_disk");
            });
    }

    @Test
    void wrappedAsyncFailureIsUnwrapped() {
        CompletionException wrapped = new CompletionException(new AgentUnavailableException("agent-1"));

        ResponseEntity<ErrorResponse> response = handler.handleAsyncWrapper(wrapped, request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().getCode()).isEqualTo("RL-400");
        assertThat(response.getBody().getMetadata()).containsOnlyKeys("agentId");
    }

    @Test
    void unexpectedErrorIsInternal() {
        ResponseEntity<ErrorResponse> response = handler.handleGenericException(new IllegalStateException("boom"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getCode()).isEqualTo("RL-902");
        assertThat(response.getBody().isFatal()).isTrue();
    }
}
