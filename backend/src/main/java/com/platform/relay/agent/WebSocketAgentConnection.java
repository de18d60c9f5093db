package com.platform.relay.agent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * {@link AgentConnection} over a WebSocket session. Sends are serialized by
 * the session decorator so dispatcher threads can write concurrently.
 */
@Slf4j
public class WebSocketAgentConnection implements AgentConnection {

    private final WebSocketSession session;

    public WebSocketAgentConnection(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(String text) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("WebSocket session " + session.getId() + " is closed");
        }
        session.sendMessage(new TextMessage(text));
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close(String reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.GOING_AWAY.withReason(truncate(reason)));
        } catch (IOException e) {
            log.debug("Error closing session {}: {}", session.getId(), e.getMessage());
        }
    }

    // Close reasons are limited to 123 bytes
    private static String truncate(String reason) {
        if (reason == null) {
            return null;
        }
        return reason.length() > 100 ? reason.substring(0, 100) : reason;
    }
}
