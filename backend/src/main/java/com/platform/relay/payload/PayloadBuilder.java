package com.platform.relay.payload;

import com.platform.relay.crypto.CipherService;
import com.platform.relay.crypto.EncryptedPayload;
import com.platform.relay.error.ScriptUnavailableException;
import com.platform.relay.error.ValidationException;
import com.platform.relay.keystore.TenantKey;
import com.platform.relay.observability.RelayMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Packages scripts and commands into encrypted execution units.
 *
 * Every part (primary script, each helper, a command) is encrypted on its own
 * with a fresh nonce. A helper that cannot be loaded is left out; a primary
 * script that cannot be loaded fails the build.
 */
@Slf4j
@Service
public class PayloadBuilder {

    static final String SCRIPT_INSTRUCTION = "Decrypt and execute this Python script with the provided arguments";
    static final String COMMAND_INSTRUCTION = "Decrypt and execute this PowerShell command";
    static final String DECRYPTION_INSTRUCTIONS = "Decrypt using AES-256-GCM with provided key, IV, and auth tag";

    private final ScriptCatalog scriptCatalog;
    private final ToolCatalog toolCatalog;
    private final CipherService cipherService;
    private final RelayMetrics metrics;

    public PayloadBuilder(
            ScriptCatalog scriptCatalog,
            ToolCatalog toolCatalog,
            CipherService cipherService,
            RelayMetrics metrics) {
        this.scriptCatalog = scriptCatalog;
        this.toolCatalog = toolCatalog;
        this.cipherService = cipherService;
        this.metrics = metrics;
    }

    /**
     * Resolve a tool by name and package it with the caller's arguments.
     */
    public EncryptedExecutionUnit buildForTool(String toolName, Map<String, ?> arguments, TenantKey tenantKey) {
        ToolDefinition tool = toolCatalog.require(toolName);
        log.info("Preparing tool {} for tenant {}", tool.name(), tenantKey.tenantId());

        EncryptedExecutionUnit unit;
        if (tool.kind() == ToolKind.COMMAND) {
            Object command = arguments == null ? null : arguments.get("command");
            if (command == null || String.valueOf(command).isBlank()) {
                throw ValidationException.missingField("arguments.command");
            }
            unit = buildCommand(String.valueOf(command), tenantKey);
        } else {
            unit = build(tool.script(), ScriptArguments.toCli(arguments, tool.arguments()), tenantKey, tool.helpers());
            Map<String, String> environment = tool.arguments().environmentFor(arguments);
            if (!environment.isEmpty()) {
                unit.setEnvironment(environment);
            }
        }

        int helpers = unit.getHelperScripts() == null ? 0 : unit.getHelperScripts().size();
        metrics.recordPayloadBuilt(tool.name(), helpers);
        return unit;
    }

    public EncryptedExecutionUnit build(
            String primaryScript,
            List<String> arguments,
            TenantKey tenantKey,
            List<String> helperScripts) {

        byte[] key = tenantKey.keyBytes();
        EncryptedPayload primary = cipherService.encrypt(scriptCatalog.load(primaryScript), key);

        EncryptedExecutionUnit.EncryptedExecutionUnitBuilder unit = EncryptedExecutionUnit.builder()
            .type("script")
            .encryptedScript(primary.ciphertextHex())
            .iv(primary.nonceHex())
            .authTag(primary.tagHex())
            .scriptName(primaryScript)
            .arguments(List.copyOf(arguments))
            .decryption(decryption(tenantKey))
            .instruction(SCRIPT_INSTRUCTION);

        if (helperScripts != null && !helperScripts.isEmpty()) {
            List<EncryptedExecutionUnit.HelperScript> bundled = new ArrayList<>();
            for (String helper : helperScripts) {
                try {
                    EncryptedPayload encrypted = cipherService.encrypt(scriptCatalog.load(helper), key);
                    bundled.add(EncryptedExecutionUnit.HelperScript.builder()
                        .name(helper)
                        .encryptedContent(encrypted.ciphertextHex())
                        .iv(encrypted.nonceHex())
                        .authTag(encrypted.tagHex())
                        .build());
                } catch (ScriptUnavailableException e) {
                    log.warn("Skipping helper script {} for {}: {}", helper, primaryScript, e.getMessage());
                    metrics.recordHelperScriptSkipped(helper);
                }
            }
            unit.helperScripts(bundled);
            log.debug("Bundled {} of {} helper scripts with {}", bundled.size(), helperScripts.size(), primaryScript);
        }

        return unit.build();
    }

    public EncryptedExecutionUnit buildCommand(String command, TenantKey tenantKey) {
        EncryptedPayload encrypted = cipherService.encrypt(command, tenantKey.keyBytes());
        return EncryptedExecutionUnit.builder()
            .type("command")
            .encryptedCommand(encrypted.ciphertextHex())
            .iv(encrypted.nonceHex())
            .authTag(encrypted.tagHex())
            .decryption(decryption(tenantKey))
            .instruction(COMMAND_INSTRUCTION)
            .build();
    }

    private EncryptedExecutionUnit.Decryption decryption(TenantKey tenantKey) {
        return EncryptedExecutionUnit.Decryption.builder()
            .algorithm(CipherService.ALGORITHM)
            .key(tenantKey.encryptionKey())
            .instructions(DECRYPTION_INSTRUCTIONS)
            .build();
    }
}
