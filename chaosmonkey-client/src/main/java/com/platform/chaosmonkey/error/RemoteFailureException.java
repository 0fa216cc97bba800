package com.platform.chaosmonkey.error;

/**
 * Failure reported by the Chaos Monkey API itself.
 * The message is the {@code message} field of the error body, verbatim.
 */
public class RemoteFailureException extends ChaosMonkeyException {
    
    private final int statusCode;
    
    public RemoteFailureException(int statusCode, String message) {
        super(ErrorCode.REMOTE_FAILURE, message);
        this.statusCode = statusCode;
    }
    
    public int getStatusCode() {
        return statusCode;
    }
}
