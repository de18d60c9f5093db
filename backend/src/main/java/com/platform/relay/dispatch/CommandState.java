package com.platform.relay.dispatch;

/**
 * Lifecycle of a relayed command. SENT is the only non-terminal state.
 */
public enum CommandState {
    SENT,
    COMPLETED,
    FAILED,
    TIMED_OUT,
    DISCONNECTED;

    public String metricTag() {
        return name().toLowerCase();
    }
}
