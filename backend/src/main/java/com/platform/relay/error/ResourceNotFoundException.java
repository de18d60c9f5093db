package com.platform.relay.error;

/**
 * Exception for resource not found errors.
 */
public class ResourceNotFoundException extends RelayException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        this(ErrorCode.RESOURCE_NOT_FOUND, resourceType, resourceId);
    }

    public ResourceNotFoundException(ErrorCode errorCode, String resourceType, String resourceId) {
        super(errorCode,
            String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public static ResourceNotFoundException agent(String agentId) {
        return new ResourceNotFoundException(ErrorCode.AGENT_NOT_FOUND, "Agent", agentId);
    }

    public static ResourceNotFoundException network(String tenantId) {
        return new ResourceNotFoundException(ErrorCode.NETWORK_NOT_FOUND, "Tenant network", tenantId);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
