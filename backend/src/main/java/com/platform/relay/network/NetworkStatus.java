package com.platform.relay.network;

public enum NetworkStatus {
    ACTIVE,
    /**
     * Teardown started but the Docker network is not confirmed gone. The subnet stays reserved.
     */
    RELEASING,
    RELEASED
}
