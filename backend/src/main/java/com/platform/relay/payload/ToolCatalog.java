package com.platform.relay.payload;

import com.platform.relay.config.RelayProperties;
import com.platform.relay.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tool name to script mapping exposed through /api/tools and /api/execute.
 * Configured tools under relay.scripts.tools replace the built-in set.
 */
@Slf4j
@Component
public class ToolCatalog {

    static final List<ToolDefinition> DEFAULT_TOOLS = List.of(
        ToolDefinition.script("take_screenshot", "screenshot.py", "Capture screenshot with OCR analysis"),
        ToolDefinition.script("get_ui_elements", "get_ui_elements.py",
            "Get all UI elements including taskbar icons using UI Automation"),
        ToolDefinition.command("execute_powershell", "Execute PowerShell commands"),
        ToolDefinition.script("move_mouse", "mouse-move.py", "Move mouse to coordinates"),
        ToolDefinition.script("click_mouse", "mouse-click.py", "Click mouse at coordinates")
            .withArguments(ArgumentRules.none().withDefault("button", "left")),
        ToolDefinition.script("get_mouse_position", "mouse-position.py", "Get current mouse position"),
        ToolDefinition.script("type_text", "keyboard-type.py", "Type text using keyboard")
            .withArguments(ArgumentRules.none().withDefault("interval", 0.05)),
        ToolDefinition.script("press_key", "keyboard-press.py", "Press keyboard key"),
        ToolDefinition.script("scroll_mouse", "mouse-scroll.py", "Scroll mouse wheel")
            .withArguments(ArgumentRules.none().withDefault("clicks", 3)),
        ToolDefinition.script("find_text_on_screen", "find_text_on_screen.py", "Search for text on screen",
            "ocr_detector.py")
            .withArguments(ArgumentRules.none()
                .withDefault("partial_match", true)
                .withFlag("partial_match", "partial")),
        ToolDefinition.script("send_to_terminal", "send-to-terminal.py", "Send command to terminal")
            .withArguments(ArgumentRules.none().withEnvironment("terminal_port", "TERMINAL_PORT"))
    );

    private final Map<String, ToolDefinition> tools;

    public ToolCatalog(RelayProperties properties) {
        Map<String, RelayProperties.Scripts.Tool> configured = properties.getScripts().getTools();
        Map<String, ToolDefinition> byName = new LinkedHashMap<>();

        if (configured.isEmpty()) {
            DEFAULT_TOOLS.forEach(tool -> byName.put(tool.name(), tool));
        } else {
            configured.forEach((name, tool) -> byName.put(name, new ToolDefinition(
                name,
                tool.getDescription(),
                tool.getScript(),
                tool.getHelpers(),
                ToolKind.valueOf(tool.getKind().toUpperCase()),
                new ArgumentRules(tool.getDefaults(), tool.getFlags(), tool.getEnvironment()))));
        }

        this.tools = Collections.unmodifiableMap(byName);
        log.info("Tool catalog loaded with {} tools", tools.size());
    }

    public Optional<ToolDefinition> find(String name) {
        return Optional.ofNullable(name).map(tools::get);
    }

    public ToolDefinition require(String name) {
        if (name == null || name.isBlank()) {
            throw ValidationException.missingField("tool");
        }
        return find(name).orElseThrow(() -> ValidationException.unknownTool(name));
    }

    public Collection<ToolDefinition> all() {
        return tools.values();
    }
}
