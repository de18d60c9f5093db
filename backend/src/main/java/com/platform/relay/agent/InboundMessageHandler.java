package com.platform.relay.agent;

public interface InboundMessageHandler {

    void onHeartbeat(InboundMessage.Heartbeat heartbeat);

    void onResponse(InboundMessage.CommandResponse response);

    void onError(InboundMessage.CommandError error);

    void onStatus(InboundMessage.StatusUpdate status);
}
