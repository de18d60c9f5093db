package com.platform.relay.error;

/**
 * Standardized error codes for the relay.
 * Each error has a unique code that clients can use to take specific actions.
 *
 * Format: RL-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors
 * - 2xx: Authentication errors
 * - 3xx: Resource errors (not found, conflict)
 * - 4xx: Agent and command errors
 * - 5xx: Network provisioning errors
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {

    // ==================== Validation Errors (1xx) ====================

    VALIDATION_ERROR("RL-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("RL-101", "Invalid request format", ErrorCategory.RECOVERABLE),
    MISSING_REQUIRED_FIELD("RL-102", "Missing required field", ErrorCategory.RECOVERABLE),
    INVALID_FIELD_VALUE("RL-103", "Invalid field value", ErrorCategory.RECOVERABLE),
    UNKNOWN_TOOL("RL-104", "Unknown tool", ErrorCategory.RECOVERABLE),

    // ==================== Auth Errors (2xx) ====================

    MISSING_CREDENTIAL("RL-200", "Unauthorized: API key required", ErrorCategory.RECOVERABLE),
    INVALID_CREDENTIAL("RL-201", "Unauthorized: Invalid API key", ErrorCategory.RECOVERABLE),
    FORBIDDEN("RL-202", "Access denied", ErrorCategory.RECOVERABLE),

    // ==================== Resource Errors (3xx) ====================

    RESOURCE_NOT_FOUND("RL-300", "Resource not found", ErrorCategory.RECOVERABLE),
    AGENT_NOT_FOUND("RL-301", "Agent not found", ErrorCategory.RECOVERABLE),
    NETWORK_NOT_FOUND("RL-302", "Tenant network not found", ErrorCategory.RECOVERABLE),
    SCRIPT_UNAVAILABLE("RL-310", "Script unavailable", ErrorCategory.FATAL),

    // ==================== Agent / Command Errors (4xx) ====================

    AGENT_UNAVAILABLE("RL-400", "Agent not connected", ErrorCategory.RECOVERABLE),
    COMMAND_TIMEOUT("RL-401", "Command timed out", ErrorCategory.RECOVERABLE),
    AGENT_DISCONNECTED("RL-402", "Agent disconnected", ErrorCategory.RECOVERABLE),
    COMMAND_FAILED("RL-403", "Command failed on agent", ErrorCategory.RECOVERABLE),
    AGENT_PROTOCOL_ERROR("RL-404", "Malformed agent message", ErrorCategory.RECOVERABLE),

    // ==================== Network Errors (5xx) ====================

    NETWORK_ISOLATION_VIOLATION("RL-500", "Tenant network isolation violated", ErrorCategory.FATAL),
    NETWORK_POOL_EXHAUSTED("RL-501", "No free tenant subnet", ErrorCategory.FATAL),
    NETWORK_PROVISIONING_FAILED("RL-502", "Network provisioning failed", ErrorCategory.RECOVERABLE),
    DOCKER_UNAVAILABLE("RL-503", "Docker daemon unavailable", ErrorCategory.RECOVERABLE),

    // ==================== Internal Errors (9xx) ====================

    DATABASE_ERROR("RL-900", "Database error", ErrorCategory.FATAL),
    INTERNAL_ERROR("RL-901", "Internal server error", ErrorCategory.FATAL),
    UNEXPECTED_ERROR("RL-902", "Unexpected error occurred", ErrorCategory.FATAL),
    ENCRYPTION_ERROR("RL-903", "Encryption failed", ErrorCategory.FATAL),
    DECRYPTION_FAILED("RL-904", "Payload authentication failed", ErrorCategory.RECOVERABLE);

    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;

    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }

    public boolean isRecoverable() {
        return category == ErrorCategory.RECOVERABLE;
    }

    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - client can retry or fix the request.
         */
        RECOVERABLE,

        /**
         * Fatal errors - relay is misconfigured or a dependency is broken.
         */
        FATAL
    }
}
