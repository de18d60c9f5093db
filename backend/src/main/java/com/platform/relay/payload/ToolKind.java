package com.platform.relay.payload;

/**
 * How a tool is delivered to the executor.
 */
public enum ToolKind {
    /**
     * A catalog script, encrypted together with its helper scripts.
     */
    SCRIPT,

    /**
     * A raw shell command taken from the {@code command} argument.
     */
    COMMAND
}
