package com.platform.relay.payload;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-tool argument handling: default values, renamed flags and arguments
 * delivered as environment variables instead of on the command line.
 */
public record ArgumentRules(
    Map<String, Object> defaults,
    Map<String, String> flags,
    Map<String, String> environment
) {
    private static final ArgumentRules NONE = new ArgumentRules(Map.of(), Map.of(), Map.of());

    public ArgumentRules {
        defaults = ordered(defaults);
        flags = ordered(flags);
        environment = ordered(environment);
    }

    public static ArgumentRules none() {
        return NONE;
    }

    public ArgumentRules withDefault(String argument, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(defaults);
        merged.put(argument, value);
        return new ArgumentRules(merged, flags, environment);
    }

    public ArgumentRules withFlag(String argument, String flag) {
        Map<String, String> merged = new LinkedHashMap<>(flags);
        merged.put(argument, flag);
        return new ArgumentRules(defaults, merged, environment);
    }

    public ArgumentRules withEnvironment(String argument, String variable) {
        Map<String, String> merged = new LinkedHashMap<>(environment);
        merged.put(argument, variable);
        return new ArgumentRules(defaults, flags, merged);
    }

    private static <V> Map<String, V> ordered(Map<String, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /**
     * Caller arguments in their original order, with defaults filled in for
     * missing or null entries.
     */
    Map<String, Object> applyDefaults(Map<String, ?> arguments) {
        Map<String, Object> effective = new LinkedHashMap<>();
        if (arguments != null) {
            effective.putAll(arguments);
        }
        defaults.forEach((argument, value) -> {
            if (effective.get(argument) == null) {
                effective.put(argument, value);
            }
        });
        return effective;
    }

    String flagFor(String argument) {
        return flags.getOrDefault(argument, argument);
    }

    boolean isEnvironment(String argument) {
        return environment.containsKey(argument);
    }

    /**
     * Environment variables for the executor. Arguments without a value are left out.
     */
    Map<String, String> environmentFor(Map<String, ?> arguments) {
        Map<String, String> variables = new LinkedHashMap<>();
        if (arguments != null) {
            environment.forEach((argument, variable) -> {
                Object value = arguments.get(argument);
                if (value != null && !"".equals(value)) {
                    ScriptArguments.requireScalar(argument, value);
                    variables.put(variable, String.valueOf(value));
                }
            });
        }
        return variables;
    }
}
