package com.platform.relay.agent;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Messages an agent may send. The set is closed; adding a kind forces every
 * {@link InboundMessageHandler} to handle it.
 */
public sealed interface InboundMessage {

    void dispatch(InboundMessageHandler handler);

    record Heartbeat() implements InboundMessage {
        @Override
        public void dispatch(InboundMessageHandler handler) {
            handler.onHeartbeat(this);
        }
    }

    record CommandResponse(String commandId, JsonNode result) implements InboundMessage {
        @Override
        public void dispatch(InboundMessageHandler handler) {
            handler.onResponse(this);
        }
    }

    record CommandError(String commandId, String error) implements InboundMessage {
        @Override
        public void dispatch(InboundMessageHandler handler) {
            handler.onError(this);
        }
    }

    record StatusUpdate(JsonNode status) implements InboundMessage {
        @Override
        public void dispatch(InboundMessageHandler handler) {
            handler.onStatus(this);
        }
    }
}
