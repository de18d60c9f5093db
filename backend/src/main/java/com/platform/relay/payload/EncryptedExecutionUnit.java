package com.platform.relay.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * What an executor needs to run one tool invocation: the encrypted script or
 * command, its nonce and tag, arguments, bundled helpers and key material.
 * Field names are the wire format.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EncryptedExecutionUnit {

    @Builder.Default
    private boolean success = true;

    @Builder.Default
    private boolean encrypted = true;

    /**
     * "script" or "command".
     */
    private String type;

    private String encryptedScript;

    private String encryptedCommand;

    private String iv;

    private String authTag;

    private String scriptName;

    private List<String> arguments;

    private List<HelperScript> helperScripts;

    /**
     * Variables the executor sets before running the script.
     */
    private Map<String, String> environment;

    private Decryption decryption;

    private String instruction;

    @Data
    @Builder
    public static class HelperScript {
        private String name;
        private String encryptedContent;
        private String iv;
        private String authTag;
    }

    @Data
    @Builder
    public static class Decryption {
        private String algorithm;
        private String key;
        private String instructions;
    }
}
