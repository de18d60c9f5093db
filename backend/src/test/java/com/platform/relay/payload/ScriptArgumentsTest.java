package com.platform.relay.payload;

import com.platform.relay.error.ErrorCode;
import com.platform.relay.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScriptArgumentsTest {

    @Test
    void valuesBecomeFlagValuePairs() {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("x", 10);
        arguments.put("y", 20);

        assertThat(ScriptArguments.toCli(arguments)).containsExactly("--x", "10", "--y", "20", "--json");
    }

    @Test
    void trueNullAndEmptyBecomeBareFlagsAndFalseIsDropped() {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("double", true);
        arguments.put("verbose", null);
        arguments.put("quiet", "");
        arguments.put("right", false);

        assertThat(ScriptArguments.toCli(arguments))
            .containsExactly("--double", "--verbose", "--quiet", "--json");
    }

    @Test
    void jsonFlagIsAppendedOnlyOnce() {
        Map<String, Object> arguments = new HashMap<>();
        arguments.put("json", true);

        assertThat(ScriptArguments.toCli(arguments)).containsExactly("--json");
    }

    @Test
    void noArgumentsStillRequestJsonOutput() {
        assertThat(ScriptArguments.toCli(null)).containsExactly("--json");
        assertThat(ScriptArguments.toCli(Map.of())).containsExactly("--json");
    }

    @Test
    void nestedValuesAreRejected() {
        assertThatThrownBy(() -> ScriptArguments.toCli(Map.of("point", Map.of("x", 1))))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("point")
            .extracting(e -> ((ValidationException) e).getErrorCode())
            .isEqualTo(ErrorCode.INVALID_FIELD_VALUE);
        assertThatThrownBy(() -> ScriptArguments.toCli(Map.of("keys", List.of("ctrl", "c"))))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ScriptArguments.toCli(Map.of("raw", new int[] {1, 2})))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void defaultsFillMissingAndNullArguments() {
        ArgumentRules rules = ArgumentRules.none().withDefault("interval", 0.05);
        Map<String, Object> explicitNull = new LinkedHashMap<>();
        explicitNull.put("text", "hi");
        explicitNull.put("interval", null);

        assertThat(ScriptArguments.toCli(Map.of("text", "hi"), rules))
            .containsExactly("--text", "hi", "--interval", "0.05", "--json");
        assertThat(ScriptArguments.toCli(explicitNull, rules))
            .containsExactly("--text", "hi", "--interval", "0.05", "--json");
        assertThat(ScriptArguments.toCli(Map.of("interval", 0.2), rules))
            .containsExactly("--interval", "0.2", "--json");
    }

    @Test
    void renamedFlagWithTrueDefault() {
        ArgumentRules rules = ArgumentRules.none()
            .withDefault("partial_match", true)
            .withFlag("partial_match", "partial");

        assertThat(ScriptArguments.toCli(Map.of("text", "File"), rules))
            .containsExactly("--text", "File", "--partial", "--json");

        Map<String, Object> exact = new LinkedHashMap<>();
        exact.put("text", "File");
        exact.put("partial_match", false);
        assertThat(ScriptArguments.toCli(exact, rules)).containsExactly("--text", "File", "--json");
    }

    @Test
    void environmentArgumentsStayOffTheCommandLine() {
        ArgumentRules rules = ArgumentRules.none().withEnvironment("terminal_port", "TERMINAL_PORT");
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("command", "dir");
        arguments.put("terminal_port", 9100);

        assertThat(ScriptArguments.toCli(arguments, rules)).containsExactly("--command", "dir", "--json");
        assertThat(rules.environmentFor(arguments)).containsExactly(Map.entry("TERMINAL_PORT", "9100"));
        assertThat(rules.environmentFor(Map.of("command", "dir"))).isEmpty();
    }
}
