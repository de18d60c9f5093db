package com.platform.relay.agent;

public record AgentMetadata(String hostname, String platform, String executorVersion) {

    public static AgentMetadata unknown() {
        return new AgentMetadata(null, null, null);
    }
}
