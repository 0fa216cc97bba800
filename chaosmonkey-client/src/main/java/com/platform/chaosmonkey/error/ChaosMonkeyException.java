package com.platform.chaosmonkey.error;

/**
 * Base exception for all Chaos Monkey client exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class ChaosMonkeyException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected ChaosMonkeyException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected ChaosMonkeyException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
