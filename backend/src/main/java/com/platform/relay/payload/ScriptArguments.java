package com.platform.relay.payload;

import com.platform.relay.error.ValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Converts a tool's argument object into command-line arguments.
 */
public final class ScriptArguments {

    static final String JSON_FLAG = "--json";

    private ScriptArguments() {
    }

    public static List<String> toCli(Map<String, ?> arguments) {
        return toCli(arguments, ArgumentRules.none());
    }

    /**
     * {@code {x: 10, double: true}} becomes {@code --x 10 --double --json}.
     * A value of {@code true}, {@code null} or an empty string yields a bare flag,
     * {@code false} drops the flag. Arguments routed to the environment never
     * appear on the command line. The JSON output flag is appended exactly once.
     *
     * @throws ValidationException if a value is an object or an array
     */
    public static List<String> toCli(Map<String, ?> arguments, ArgumentRules rules) {
        List<String> cli = new ArrayList<>();
        rules.applyDefaults(arguments).forEach((key, value) -> {
            if (rules.isEnvironment(key) || Boolean.FALSE.equals(value)) {
                return;
            }
            requireScalar(key, value);
            cli.add("--" + rules.flagFor(key));
            if (!isBareFlag(value)) {
                cli.add(String.valueOf(value));
            }
        });
        if (!cli.contains(JSON_FLAG)) {
            cli.add(JSON_FLAG);
        }
        return cli;
    }

    static void requireScalar(String key, Object value) {
        if (value instanceof Map || value instanceof Collection || (value != null && value.getClass().isArray())) {
            throw ValidationException.invalidArgument(key, value);
        }
    }

    private static boolean isBareFlag(Object value) {
        return value == null || Boolean.TRUE.equals(value) || "".equals(value);
    }
}
