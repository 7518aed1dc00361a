package com.astralcore.common.error;

/**
 * Thrown when a referenced record (MFA enrollment, PHI record, session) does not exist.
 */
public class ResourceNotFoundException extends AstralSecurityException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(ErrorCategory.RESOURCE_NOT_FOUND,
                "%s not found: %s".formatted(resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String resourceType() {
        return resourceType;
    }

    public String resourceId() {
        return resourceId;
    }
}
