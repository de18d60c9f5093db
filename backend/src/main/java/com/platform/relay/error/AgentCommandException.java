package com.platform.relay.error;

/**
 * Base for failures tied to one agent and, once sent, one command.
 */
public abstract class AgentCommandException extends RelayException {

    private final String agentId;
    private final String commandId;

    protected AgentCommandException(ErrorCode errorCode, String message, String agentId, String commandId) {
        super(errorCode, message);
        this.agentId = agentId;
        this.commandId = commandId;
    }

    protected AgentCommandException(ErrorCode errorCode, String message, String agentId, String commandId,
                                    Throwable cause) {
        super(errorCode, message, cause);
        this.agentId = agentId;
        this.commandId = commandId;
    }

    public String getAgentId() {
        return agentId;
    }

    /**
     * Null when the command never got an id (agent unavailable before send).
     */
    public String getCommandId() {
        return commandId;
    }
}
