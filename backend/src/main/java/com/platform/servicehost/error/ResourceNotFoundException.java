package com.platform.servicehost.error;

/**
 * Exception for unknown service ids.
 */
public class ResourceNotFoundException extends ServiceHostException {
    
    private final String resourceType;
    private final String resourceId;
    
    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(ErrorCode.SERVICE_NOT_FOUND, 
            String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
    
    public String getResourceType() {
        return resourceType;
    }
    
    public String getResourceId() {
        return resourceId;
    }
}
