package com.platform.relay.error;

public class AgentDisconnectedException extends AgentCommandException {

    public AgentDisconnectedException(String agentId, String commandId) {
        super(ErrorCode.AGENT_DISCONNECTED, "Agent disconnected", agentId, commandId);
    }
}
