package com.platform.relay.payload;

import com.platform.relay.config.RelayProperties;
import com.platform.relay.crypto.CipherService;
import com.platform.relay.crypto.EncryptedPayload;
import com.platform.relay.error.ScriptUnavailableException;
import com.platform.relay.error.ValidationException;
import com.platform.relay.keystore.TenantKey;
import com.platform.relay.observability.RelayMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.security.SecureRandom;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PayloadBuilderTest {

    private static final TenantKey TENANT = new TenantKey("tenant-1", "vm-1", "0f".repeat(32));

    private SimpleMeterRegistry meterRegistry;
    private ScriptCatalog scriptCatalog;
    private CipherService cipherService;
    private PayloadBuilder payloadBuilder;

    @BeforeEach
    void setUp() {
        RelayProperties properties = new RelayProperties();
        meterRegistry = new SimpleMeterRegistry();
        scriptCatalog = new ScriptCatalog(new DefaultResourceLoader(), properties);
        cipherService = new CipherService(new SecureRandom());
        payloadBuilder = new PayloadBuilder(scriptCatalog, new ToolCatalog(properties), cipherService,
            new RelayMetrics(meterRegistry));
    }

    @Test
    void scriptToolIsEncryptedWithTenantKey() {
        EncryptedExecutionUnit unit = payloadBuilder.buildForTool("move_mouse", Map.of("x", 10), TENANT);

        assertThat(unit.isSuccess()).isTrue();
        assertThat(unit.isEncrypted()).isTrue();
        assertThat(unit.getType()).isEqualTo("script");
        assertThat(unit.getScriptName()).isEqualTo("mouse-move.py");
        assertThat(unit.getArguments()).containsExactly("--x", "10", "--json");
        assertThat(unit.getDecryption().getAlgorithm()).isEqualTo("aes-256-gcm");
        assertThat(unit.getDecryption().getKey()).isEqualTo(TENANT.encryptionKey());
        assertThat(unit.getHelperScripts()).isNull();

        EncryptedPayload script = EncryptedPayload.fromHex(unit.getEncryptedScript(), unit.getIv(), unit.getAuthTag());
        assertThat(cipherService.decryptToString(script, TENANT.keyBytes()))
            .isEqualTo(scriptCatalog.load("mouse-move.py"));
        assertThat(meterRegistry.get("relay.payloads.built").tag("tool", "move_mouse").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    void helpersAreEncryptedSeparately() {
        EncryptedExecutionUnit unit = payloadBuilder.buildForTool("find_text_on_screen", Map.of("text", "OK"), TENANT);

        assertThat(unit.getArguments()).containsExactly("--text", "OK", "--partial", "--json");
        assertThat(unit.getHelperScripts()).hasSize(1);
        EncryptedExecutionUnit.HelperScript helper = unit.getHelperScripts().get(0);
        assertThat(helper.getName()).isEqualTo("ocr_detector.py");
        assertThat(helper.getIv()).isNotEqualTo(unit.getIv());

        EncryptedPayload content = EncryptedPayload.fromHex(helper.getEncryptedContent(), helper.getIv(), helper.getAuthTag());
        assertThat(cipherService.decryptToString(content, TENANT.keyBytes()))
            .isEqualTo(scriptCatalog.load("ocr_detector.py"));
    }

    @Test
    void terminalPortTravelsAsEnvironment() {
        EncryptedExecutionUnit unit = payloadBuilder.buildForTool("send_to_terminal",
            Map.of("command", "npm test", "terminal_port", 9100), TENANT);

        assertThat(unit.getArguments()).containsExactly("--command", "npm test", "--json");
        assertThat(unit.getEnvironment()).containsExactly(Map.entry("TERMINAL_PORT", "9100"));
    }

    @Test
    void toolWithoutEnvironmentArgumentsHasNoEnvironment() {
        EncryptedExecutionUnit unit = payloadBuilder.buildForTool("send_to_terminal",
            Map.of("command", "npm test"), TENANT);

        assertThat(unit.getEnvironment()).isNull();
    }

    @Test
    void uiElementsScriptIsBundled() {
        EncryptedExecutionUnit unit = payloadBuilder.buildForTool("get_ui_elements", null, TENANT);

        assertThat(unit.getScriptName()).isEqualTo("get_ui_elements.py");
        assertThat(unit.getArguments()).containsExactly("--json");
    }

    @Test
    void nestedArgumentIsRejectedBeforeEncryption() {
        assertThatThrownBy(() -> payloadBuilder.buildForTool("move_mouse", Map.of("point", Map.of("x", 1)), TENANT))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("point");
        assertThat(meterRegistry.find("relay.payloads.built").counter()).isNull();
    }

    @Test
    void unreadableHelperIsLeftOut() {
        EncryptedExecutionUnit unit = payloadBuilder.build("screenshot.py", List.of("--json"), TENANT,
            List.of("ocr_detector.py", "missing-helper.py"));

        assertThat(unit.getHelperScripts()).extracting(EncryptedExecutionUnit.HelperScript::getName)
            .containsExactly("ocr_detector.py");
        assertThat(meterRegistry.get("relay.payloads.helpers.skipped").tag("script", "missing-helper.py")
            .counter().count()).isEqualTo(1.0);
    }

    @Test
    void unreadablePrimaryScriptFailsTheBuild() {
        assertThatThrownBy(() -> payloadBuilder.build("missing.py", List.of(), TENANT, List.of()))
            .isInstanceOf(ScriptUnavailableException.class);
    }

    @Test
    void powershellToolEncryptsTheCommand() {
        EncryptedExecutionUnit unit = payloadBuilder.buildForTool("execute_powershell",
            Map.of("command", "Get-ChildItem C:\\"), TENANT);

        assertThat(unit.getType()).isEqualTo("command");
        assertThat(unit.getEncryptedScript()).isNull();
        assertThat(unit.getInstruction()).isEqualTo(PayloadBuilder.COMMAND_INSTRUCTION);

        EncryptedPayload command = EncryptedPayload.fromHex(unit.getEncryptedCommand(), unit.getIv(), unit.getAuthTag());
        assertThat(cipherService.decryptToString(command, TENANT.keyBytes())).isEqualTo("Get-ChildItem C:\\");
    }

    @Test
    void powershellToolRequiresACommand() {
        assertThatThrownBy(() -> payloadBuilder.buildForTool("execute_powershell", Map.of(), TENANT))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("arguments.command");
    }
}
