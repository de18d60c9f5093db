package com.platform.relay.error;

/**
 * An agent id already connected under one tenant was presented by another.
 */
public class AgentOwnershipException extends RelayException {

    public AgentOwnershipException(String agentId) {
        super(ErrorCode.FORBIDDEN, String.format("Agent %s is registered to another tenant", agentId));
    }
}
