package com.platform.relay.error;

/**
 * A catalog script could not be read. Indicates a broken deployment, not a caller mistake.
 */
public class ScriptUnavailableException extends RelayException {

    private final String scriptName;

    public ScriptUnavailableException(String scriptName, Throwable cause) {
        super(ErrorCode.SCRIPT_UNAVAILABLE,
            String.format("Failed to load script %s", scriptName), cause);
        this.scriptName = scriptName;
    }

    public ScriptUnavailableException(String scriptName, String reason) {
        super(ErrorCode.SCRIPT_UNAVAILABLE,
            String.format("Failed to load script %s: %s", scriptName, reason));
        this.scriptName = scriptName;
    }

    public String getScriptName() {
        return scriptName;
    }
}
