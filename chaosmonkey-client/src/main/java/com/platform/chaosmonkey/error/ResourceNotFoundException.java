package com.platform.chaosmonkey.error;

/**
 * Exception for resource not found errors.
 */
public class ResourceNotFoundException extends ChaosMonkeyException {
    
    private final String resourceType;
    private final String resourceId;
    
    public ResourceNotFoundException(ErrorCode errorCode, String resourceType, String resourceId) {
        super(errorCode, 
            String.format("%s \"%s\" does not exist", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
    
    public static ResourceNotFoundException simpleDbDomain(String domainName) {
        return new ResourceNotFoundException(ErrorCode.SIMPLEDB_DOMAIN_NOT_FOUND, "SimpleDB domain", domainName);
    }
    
    public String getResourceType() {
        return resourceType;
    }
    
    public String getResourceId() {
        return resourceId;
    }
}
