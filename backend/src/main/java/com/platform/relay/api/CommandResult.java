package com.platform.relay.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Successful agent reply as returned to the tenant.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommandResult(boolean success, JsonNode result) {

    public static CommandResult of(JsonNode result) {
        return new CommandResult(true, result);
    }
}
