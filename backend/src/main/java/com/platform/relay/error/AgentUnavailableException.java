package com.platform.relay.error;

/**
 * The target agent has no live connection, or the command could not be written to it.
 */
public class AgentUnavailableException extends AgentCommandException {

    public AgentUnavailableException(String agentId) {
        super(ErrorCode.AGENT_UNAVAILABLE, String.format("Agent %s not connected", agentId), agentId, null);
    }

    public AgentUnavailableException(String agentId, Throwable cause) {
        super(ErrorCode.AGENT_UNAVAILABLE,
            String.format("Failed to send command to agent %s: %s", agentId, cause.getMessage()),
            agentId, null, cause);
    }
}
