package com.platform.relay.error;

public class AgentProtocolException extends RelayException {

    public AgentProtocolException(String message) {
        super(ErrorCode.AGENT_PROTOCOL_ERROR, message);
    }

    public AgentProtocolException(String message, Throwable cause) {
        super(ErrorCode.AGENT_PROTOCOL_ERROR, message, cause);
    }
}
