package com.platform.chaosmonkey.error;

/**
 * Exception for failures reported by the AWS SDK.
 */
public class CloudServiceException extends ChaosMonkeyException {
    
    private final String serviceName;
    private final String operation;
    
    public CloudServiceException(String serviceName, String operation, Throwable cause) {
        super(ErrorCode.AWS_SERVICE_ERROR,
            String.format("%s %s failed: %s", serviceName, operation, cause.getMessage()), cause);
        this.serviceName = serviceName;
        this.operation = operation;
    }
    
    public static CloudServiceException autoScaling(String operation, Throwable cause) {
        return new CloudServiceException("autoscaling", operation, cause);
    }
    
    public static CloudServiceException simpleDb(String operation, Throwable cause) {
        return new CloudServiceException("simpledb", operation, cause);
    }
    
    public String getServiceName() {
        return serviceName;
    }
    
    public String getOperation() {
        return operation;
    }
}
