package com.platform.relay.agent;

import java.io.IOException;

/**
 * One live transport to an executor. Implementations must allow concurrent sends.
 */
public interface AgentConnection {

    /**
     * Identifier unique to this connection, distinct across reconnects of the same agent.
     */
    String id();

    void send(String text) throws IOException;

    boolean isOpen();

    void close(String reason);
}
