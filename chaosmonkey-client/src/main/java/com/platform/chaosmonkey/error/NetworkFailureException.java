package com.platform.chaosmonkey.error;

import java.net.URI;

/**
 * Thrown when the HTTP exchange could not complete, before any status code was received.
 */
public class NetworkFailureException extends ChaosMonkeyException {
    
    private final URI uri;
    
    public NetworkFailureException(String method, URI uri, Throwable cause) {
        super(ErrorCode.NETWORK_FAILURE,
            String.format("%s %s failed: %s", method, uri, cause.getMessage()), cause);
        this.uri = uri;
    }
    
    public URI getUri() {
        return uri;
    }
}
