package com.platform.relay.payload;

import java.util.List;

public record ToolDefinition(
    String name,
    String description,
    String script,
    List<String> helpers,
    ToolKind kind,
    ArgumentRules arguments
) {
    public ToolDefinition {
        helpers = helpers == null ? List.of() : List.copyOf(helpers);
        kind = kind == null ? ToolKind.SCRIPT : kind;
        arguments = arguments == null ? ArgumentRules.none() : arguments;
    }

    static ToolDefinition script(String name, String script, String description, String... helpers) {
        return new ToolDefinition(name, description, script, List.of(helpers), ToolKind.SCRIPT, null);
    }

    static ToolDefinition command(String name, String description) {
        return new ToolDefinition(name, description, null, List.of(), ToolKind.COMMAND, null);
    }

    ToolDefinition withArguments(ArgumentRules rules) {
        return new ToolDefinition(name, description, script, helpers, kind, rules);
    }
}
