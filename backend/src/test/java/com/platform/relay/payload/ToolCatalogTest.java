package com.platform.relay.payload;

import com.platform.relay.config.RelayProperties;
import com.platform.relay.error.ErrorCode;
import com.platform.relay.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolCatalogTest {

    @Test
    void builtInToolsAreAvailableByDefault() {
        ToolCatalog catalog = new ToolCatalog(new RelayProperties());

        assertThat(catalog.all()).hasSize(11);
        assertThat(catalog.require("get_ui_elements").script()).isEqualTo("get_ui_elements.py");
        assertThat(catalog.require("move_mouse").script()).isEqualTo("mouse-move.py");
        assertThat(catalog.require("find_text_on_screen").helpers()).containsExactly("ocr_detector.py");
        assertThat(catalog.require("execute_powershell").kind()).isEqualTo(ToolKind.COMMAND);
    }

    @Test
    void builtInToolsCarryTheirArgumentRules() {
        ToolCatalog catalog = new ToolCatalog(new RelayProperties());

        ArgumentRules findText = catalog.require("find_text_on_screen").arguments();
        assertThat(findText.defaults()).containsEntry("partial_match", true);
        assertThat(findText.flags()).containsEntry("partial_match", "partial");
        assertThat(catalog.require("send_to_terminal").arguments().environment())
            .containsEntry("terminal_port", "TERMINAL_PORT");
        assertThat(catalog.require("click_mouse").arguments().defaults()).containsEntry("button", "left");
        assertThat(catalog.require("move_mouse").arguments()).isEqualTo(ArgumentRules.none());
    }

    @Test
    void unknownToolIsAValidationError() {
        ToolCatalog catalog = new ToolCatalog(new RelayProperties());

        assertThatThrownBy(() -> catalog.require("format_disk"))
            .isInstanceOf(ValidationException.class)
            .extracting(e -> ((ValidationException) e).getErrorCode())
            .isEqualTo(ErrorCode.UNKNOWN_TOOL);
    }

    @Test
    void missingToolNameIsAValidationError() {
        ToolCatalog catalog = new ToolCatalog(new RelayProperties());

        assertThatThrownBy(() -> catalog.require(" "))
            .isInstanceOf(ValidationException.class)
            .extracting(e -> ((ValidationException) e).getErrorCode())
            .isEqualTo(ErrorCode.MISSING_REQUIRED_FIELD);
        assertThat(catalog.find(null)).isEmpty();
    }

    @Test
    void configuredToolsReplaceBuiltIns() {
        RelayProperties properties = new RelayProperties();
        RelayProperties.Scripts.Tool tool = new RelayProperties.Scripts.Tool();
        tool.setScript("inventory.py");
        tool.setDescription("Collect installed software");
        tool.setHelpers(List.of("wmi.py"));
        tool.getDefaults().put("format", "csv");
        tool.getEnvironment().put("share", "INVENTORY_SHARE");
        properties.getScripts().getTools().put("inventory", tool);

        ToolCatalog catalog = new ToolCatalog(properties);

        assertThat(catalog.all()).extracting(ToolDefinition::name).containsExactly("inventory");
        assertThat(catalog.require("inventory").helpers()).containsExactly("wmi.py");
        assertThat(catalog.require("inventory").kind()).isEqualTo(ToolKind.SCRIPT);
        assertThat(catalog.require("inventory").arguments().defaults()).containsEntry("format", "csv");
        assertThat(catalog.require("inventory").arguments().environment())
            .containsEntry("share", "INVENTORY_SHARE");
        assertThat(catalog.find("take_screenshot")).isEmpty();
    }
}
