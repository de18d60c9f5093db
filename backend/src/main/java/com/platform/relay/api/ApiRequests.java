package com.platform.relay.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request bodies accepted by the tenant API.
 */
public class ApiRequests {

    /**
     * Tool invocation. The tool name is checked against the catalog, not here,
     * so a missing or unknown tool gets the catalog's error message.
     */
    @Data
    public static class ToolRequest {

        @Size(max = 100, message = "Tool name cannot exceed 100 characters")
        private String tool;

        private Map<String, Object> arguments = new LinkedHashMap<>();
    }

    @Data
    public static class CommandRequest {

        @NotBlank(message = "Command type is required")
        @Pattern(regexp = "^[a-z][a-z0-9_-]*(\\.[a-z][a-z0-9_-]*)*$", message = "Invalid command type")
        @Size(max = 64, message = "Command type cannot exceed 64 characters")
        private String type;

        private Object payload;
    }

    @Data
    public static class ExecRequest {

        /**
         * A shell string or an argv array.
         */
        @NotNull(message = "Command is required")
        private Object command;
    }
}
