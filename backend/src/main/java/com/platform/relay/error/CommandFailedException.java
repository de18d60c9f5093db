package com.platform.relay.error;

/**
 * The agent answered a command with an error message. The agent's text is
 * carried verbatim, including executor-side payload authentication failures.
 */
public class CommandFailedException extends AgentCommandException {

    public CommandFailedException(String agentId, String commandId, String agentError) {
        super(ErrorCode.COMMAND_FAILED, agentError, agentId, commandId);
    }
}
