package com.platform.chaosmonkey.error;

/**
 * Standardized error codes for the Chaos Monkey client.
 * Each error has a unique code that callers can use to take specific actions.
 * 
 * Format: CM-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors
 * - 3xx: Resource errors (not found)
 * - 4xx: Remote and transport errors (Chaos Monkey API, AWS)
 * - 9xx: Internal errors
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    INVALID_FIELD_VALUE("CM-103", "Invalid field value", ErrorCategory.RECOVERABLE),
    
    // ==================== Resource Errors (3xx) ====================
    
    SIMPLEDB_DOMAIN_NOT_FOUND("CM-301", "SimpleDB domain not found", ErrorCategory.RECOVERABLE),
    
    // ==================== Remote Errors (4xx) ====================
    
    NETWORK_FAILURE("CM-400", "Chaos Monkey API unreachable", ErrorCategory.RECOVERABLE),
    REMOTE_FAILURE("CM-401", "Chaos Monkey API reported a failure", ErrorCategory.RECOVERABLE),
    HTTP_ERROR("CM-402", "Unexpected HTTP status from Chaos Monkey API", ErrorCategory.RECOVERABLE),
    MALFORMED_RESPONSE("CM-403", "Malformed response from Chaos Monkey API", ErrorCategory.FATAL),
    AWS_SERVICE_ERROR("CM-410", "AWS service error", ErrorCategory.RECOVERABLE),
    
    // ==================== Internal Errors (9xx) ====================
    
    SERIALIZATION_ERROR("CM-903", "Serialization error", ErrorCategory.FATAL);
    
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
         * Recoverable errors - the caller can retry or fix the request.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - the remote side or the client is misbehaving.
         */
        FATAL
    }
}
