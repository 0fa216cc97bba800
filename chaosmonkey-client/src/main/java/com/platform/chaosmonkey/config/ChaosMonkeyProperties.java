package com.platform.chaosmonkey.config;

import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the Chaos Monkey client.
 */
@Data
@ConfigurationProperties(prefix = "chaosmonkey")
public class ChaosMonkeyProperties {
    
    /**
     * Whether the Chaos Monkey client beans are created.
     */
    private boolean enabled = true;
    
    /**
     * Address and port of the Chaos Monkey API server.
     * Falls back to CHAOSMONKEY_ENDPOINT, then http://127.0.0.1:8080.
     */
    private String endpoint;
    
    /**
     * AWS region sent with triggered events (ignored by vanilla Chaos Monkey).
     */
    private String region;
    
    /**
     * Username for HTTP Basic Authentication.
     */
    private String username;
    
    /**
     * Password for HTTP Basic Authentication.
     */
    @ToString.Exclude
    private String password;
    
    /**
     * User-Agent header sent with every request.
     */
    private String userAgent;
    
    /**
     * Connection timeout in milliseconds.
     */
    private int connectTimeoutMs = 5000;
    
    public ClientConfig toClientConfig() {
        return ClientConfig.builder()
            .endpoint(endpoint)
            .region(region)
            .username(username)
            .password(password)
            .userAgent(userAgent)
            .build();
    }
}
