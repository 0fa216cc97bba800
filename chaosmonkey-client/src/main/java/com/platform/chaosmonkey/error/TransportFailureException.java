package com.platform.chaosmonkey.error;

/**
 * Non-200 response whose body carried no usable error message.
 */
public class TransportFailureException extends ChaosMonkeyException {
    
    private final int statusCode;
    private final String statusLine;
    
    public TransportFailureException(int statusCode, String statusLine) {
        super(ErrorCode.HTTP_ERROR, "HTTP error: " + statusLine);
        this.statusCode = statusCode;
        this.statusLine = statusLine;
    }
    
    public int getStatusCode() {
        return statusCode;
    }
    
    public String getStatusLine() {
        return statusLine;
    }
}
