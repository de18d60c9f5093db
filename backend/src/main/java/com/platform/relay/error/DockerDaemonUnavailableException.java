package com.platform.relay.error;

/**
 * The Docker daemon could not be reached, or its circuit breaker is open.
 */
public class DockerDaemonUnavailableException extends RelayException {

    private final String operation;

    public DockerDaemonUnavailableException(String operation, Throwable cause) {
        super(ErrorCode.DOCKER_UNAVAILABLE,
            String.format("Docker daemon unavailable during %s: %s", operation, cause.getMessage()), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
