package com.platform.chaosmonkey.config;

import lombok.Builder;
import lombok.Value;

import java.net.http.HttpClient;

/**
 * Configuration of a {@link com.platform.chaosmonkey.client.ChaosMonkeyClient}.
 * 
 * Callers may leave any field unset; {@link ConfigResolver} fills the gaps from
 * the environment and built-in defaults.
 */
@Value
@Builder(toBuilder = true)
public class ClientConfig {
    
    /**
     * Address and port of the Chaos Monkey API server.
     */
    String endpoint;
    
    /**
     * Optional AWS region (ignored by vanilla Chaos Monkey).
     */
    String region;
    
    /**
     * Optional username for HTTP Basic Authentication.
     */
    String username;
    
    /**
     * Optional password for HTTP Basic Authentication.
     */
    String password;
    
    /**
     * Custom HTTP User-Agent.
     */
    String userAgent;
    
    /**
     * HTTP client used for every request.
     */
    HttpClient httpClient;
    
    public static ClientConfig empty() {
        return ClientConfig.builder().build();
    }
    
    /**
     * Whether requests carry HTTP Basic Authentication.
     */
    public boolean hasCredentials() {
        return username != null && !username.isEmpty()
            && password != null && !password.isEmpty();
    }
    
    @Override
    public String toString() {
        return "ClientConfig(endpoint=" + endpoint + ", region=" + region
            + ", username=" + username + ", password=" + (password == null || password.isEmpty() ? "" : "****")
            + ", userAgent=" + userAgent + ")";
    }
}
