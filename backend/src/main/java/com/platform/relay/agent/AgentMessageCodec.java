package com.platform.relay.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.relay.error.AgentProtocolException;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * JSON text frames exchanged with agents.
 *
 * Outbound: {@code welcome} and {@code {commandId, type, payload}} commands.
 * Inbound: {@code heartbeat}, {@code response}, {@code error}, {@code status}.
 */
@Component
public class AgentMessageCodec {

    private final ObjectMapper objectMapper;

    public AgentMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public InboundMessage decode(String text) {
        JsonNode node;
        try {
            node = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new AgentProtocolException("Invalid JSON from agent", e);
        }
        if (node == null || !node.isObject()) {
            throw new AgentProtocolException("Agent message must be a JSON object");
        }

        String type = node.path("type").asText("");
        switch (type) {
            case "heartbeat":
                return new InboundMessage.Heartbeat();
            case "response":
                return new InboundMessage.CommandResponse(requireCommandId(node, type),
                    node.hasNonNull("result") ? node.get("result") : NullNode.instance);
            case "error":
                return new InboundMessage.CommandError(requireCommandId(node, type), errorText(node.get("error")));
            case "status":
                return new InboundMessage.StatusUpdate(node.path("status"));
            default:
                throw new AgentProtocolException("Unknown message type: " + (type.isEmpty() ? "<missing>" : type));
        }
    }

    public String encodeWelcome(String agentId, Instant timestamp) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", "welcome");
        node.put("agentId", agentId);
        node.put("timestamp", timestamp.toString());
        return write(node);
    }

    public String encodeCommand(String commandId, String type, Object payload) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("commandId", commandId);
        node.put("type", type);
        node.set("payload", payload == null ? objectMapper.createObjectNode() : objectMapper.valueToTree(payload));
        return write(node);
    }

    private String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode agent message", e);
        }
    }

    private static String requireCommandId(JsonNode node, String type) {
        String commandId = node.path("commandId").asText("");
        if (commandId.isEmpty()) {
            throw new AgentProtocolException("Message of type " + type + " is missing commandId");
        }
        return commandId;
    }

    private static String errorText(JsonNode error) {
        if (error == null || error.isNull()) {
            return "Unknown agent error";
        }
        if (error.isTextual()) {
            return error.asText();
        }
        return error.path("message").isTextual() ? error.path("message").asText() : error.toString();
    }
}
