package com.platform.chaosmonkey.error;

/**
 * Thrown when a request payload cannot be encoded as JSON.
 */
public class SerializationException extends ChaosMonkeyException {
    
    public SerializationException(String message, Throwable cause) {
        super(ErrorCode.SERIALIZATION_ERROR, message, cause);
    }
}
