package com.platform.relay.config;

import com.platform.relay.agent.AgentHandshakeInterceptor;
import com.platform.relay.agent.AgentWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * WebSocket endpoint for executor agents.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String AGENT_ENDPOINT = "/agents/ws";

    private final AgentWebSocketHandler agentHandler;
    private final AgentHandshakeInterceptor handshakeInterceptor;
    private final RelayProperties properties;

    public WebSocketConfig(
            AgentWebSocketHandler agentHandler,
            AgentHandshakeInterceptor handshakeInterceptor,
            RelayProperties properties) {
        this.agentHandler = agentHandler;
        this.handshakeInterceptor = handshakeInterceptor;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(agentHandler, AGENT_ENDPOINT)
            .addInterceptors(handshakeInterceptor)
            .setAllowedOriginPatterns(properties.getAgents().getAllowedOrigins().split(","));
    }
}
