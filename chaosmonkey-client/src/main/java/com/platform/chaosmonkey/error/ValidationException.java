package com.platform.chaosmonkey.error;

/**
 * Exception for validation errors.
 */
public class ValidationException extends ChaosMonkeyException {
    
    private final String field;
    
    public ValidationException(String field, String message) {
        super(ErrorCode.INVALID_FIELD_VALUE, 
            String.format("Invalid value for field '%s': %s", field, message));
        this.field = field;
    }
    
    public String getField() {
        return field;
    }
}
