package com.platform.relay.agent;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.relay.config.RelayProperties;
import com.platform.relay.dispatch.CommandDispatcher;
import com.platform.relay.error.AgentOwnershipException;
import com.platform.relay.error.AgentProtocolException;
import com.platform.relay.observability.LoggingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;

/**
 * Endpoint for executor connections.
 *
 * Registers the authenticated agent, routes its messages to the registry
 * (heartbeat, status) or the dispatcher (response, error), and unregisters it
 * when the transport closes or fails. Malformed messages are logged and dropped.
 */
@Slf4j
@Component
public class AgentWebSocketHandler extends TextWebSocketHandler {

    private static final String ATTR_CONNECTION = "relay.connection";
    private static final TypeReference<Map<String, Object>> STATUS_TYPE = new TypeReference<>() {
    };

    private final AgentRegistry registry;
    private final CommandDispatcher dispatcher;
    private final AgentMessageCodec codec;
    private final ObjectMapper objectMapper;
    private final int sendTimeLimitMs;
    private final int sendBufferSize;

    public AgentWebSocketHandler(
            AgentRegistry registry,
            CommandDispatcher dispatcher,
            AgentMessageCodec codec,
            ObjectMapper objectMapper,
            RelayProperties properties) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.codec = codec;
        this.objectMapper = objectMapper;
        this.sendTimeLimitMs = (int) properties.getAgents().getSendTimeLimit().toMillis();
        this.sendBufferSize = properties.getAgents().getSendBufferSizeBytes();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        String agentId = agentId(session);
        String tenantId = (String) session.getAttributes().get(AgentHandshakeInterceptor.ATTR_TENANT_ID);
        AgentMetadata metadata = (AgentMetadata) session.getAttributes().get(AgentHandshakeInterceptor.ATTR_METADATA);

        AgentConnection connection = new WebSocketAgentConnection(session, sendTimeLimitMs, sendBufferSize);
        session.getAttributes().put(ATTR_CONNECTION, connection);

        try {
            registry.register(agentId, tenantId, connection, metadata);
        } catch (AgentOwnershipException e) {
            session.close(CloseStatus.POLICY_VIOLATION.withReason("agent id in use"));
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String agentId = agentId(session);
        AgentConnection connection = connection(session);

        boolean current = registry.get(agentId)
            .map(record -> record.getConnection().id().equals(connection.id()))
            .orElse(false);
        if (!current) {
            log.warn("Dropping message from unregistered connection {} of agent {}", session.getId(), agentId);
            return;
        }

        LoggingConfig.setCommandContext(agentId, null);
        try {
            registry.touch(agentId);
            codec.decode(message.getPayload()).dispatch(new Router(agentId));
        } catch (AgentProtocolException e) {
            log.warn("Dropping message from agent {}: {}", agentId, e.getMessage());
        } finally {
            LoggingConfig.clearCommandContext();
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws IOException {
        log.error("Transport error on agent {} connection {}: {}", agentId(session), session.getId(), exception.getMessage());
        AgentConnection connection = connection(session);
        if (connection != null) {
            registry.connectionClosed(agentId(session), connection, "transport error");
        }
        if (session.isOpen()) {
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        AgentConnection connection = connection(session);
        if (connection != null) {
            registry.connectionClosed(agentId(session), connection, "closed (" + status.getCode() + ")");
        }
    }

    private static String agentId(WebSocketSession session) {
        return (String) session.getAttributes().get(AgentHandshakeInterceptor.ATTR_AGENT_ID);
    }

    private static AgentConnection connection(WebSocketSession session) {
        return (AgentConnection) session.getAttributes().get(ATTR_CONNECTION);
    }

    private final class Router implements InboundMessageHandler {

        private final String agentId;

        private Router(String agentId) {
            this.agentId = agentId;
        }

        @Override
        public void onHeartbeat(InboundMessage.Heartbeat heartbeat) {
            // lastSeen already refreshed
        }

        @Override
        public void onResponse(InboundMessage.CommandResponse response) {
            dispatcher.onResponse(agentId, response.commandId(), response.result());
        }

        @Override
        public void onError(InboundMessage.CommandError error) {
            dispatcher.onError(agentId, error.commandId(), error.error());
        }

        @Override
        public void onStatus(InboundMessage.StatusUpdate status) {
            if (!status.status().isObject()) {
                log.warn("Ignoring non-object status from agent {}", agentId);
                return;
            }
            registry.updateStatus(agentId, objectMapper.convertValue(status.status(), STATUS_TYPE));
        }
    }
}
