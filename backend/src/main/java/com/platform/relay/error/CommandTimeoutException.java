package com.platform.relay.error;

import java.time.Duration;

public class CommandTimeoutException extends AgentCommandException {

    private final Duration timeout;

    public CommandTimeoutException(String agentId, String commandId, Duration timeout) {
        super(ErrorCode.COMMAND_TIMEOUT, "Command timeout", agentId, commandId);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
