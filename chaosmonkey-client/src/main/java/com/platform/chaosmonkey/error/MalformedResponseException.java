package com.platform.chaosmonkey.error;

/**
 * Thrown when a successful (200) response body cannot be decoded.
 */
public class MalformedResponseException extends ChaosMonkeyException {
    
    public MalformedResponseException(String message, Throwable cause) {
        super(ErrorCode.MALFORMED_RESPONSE, message, cause);
    }
}
