package com.platform.chaosmonkey.config;

import org.springframework.core.env.PropertyResolver;
import org.springframework.core.env.StandardEnvironment;

import java.net.http.HttpClient;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Resolves a partially populated {@link ClientConfig} into a complete one.
 * 
 * For every field the first non-empty value wins: the caller's value, then the
 * environment, then the built-in default. The environment is consulted on each
 * call to {@link #resolve(ClientConfig)}; nothing is cached and the input is
 * never modified.
 */
public class ConfigResolver {
    
    public static final String ENDPOINT_VARIABLE = "CHAOSMONKEY_ENDPOINT";
    public static final String USERNAME_VARIABLE = "CHAOSMONKEY_USERNAME";
    public static final String PASSWORD_VARIABLE = "CHAOSMONKEY_PASSWORD";
    
    public static final String DEFAULT_ENDPOINT = "http://127.0.0.1:8080";
    public static final String DEFAULT_USER_AGENT = "chaosmonkey Java library";
    
    private final PropertyResolver environment;
    private final Supplier<HttpClient> defaultHttpClient;
    
    public ConfigResolver(PropertyResolver environment) {
        this(environment, () -> HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build());
    }
    
    public ConfigResolver(PropertyResolver environment, Supplier<HttpClient> defaultHttpClient) {
        this.environment = environment;
        this.defaultHttpClient = defaultHttpClient;
    }
    
    /**
     * Resolver backed by the process environment and system properties.
     */
    public static ConfigResolver fromSystemEnvironment() {
        return new ConfigResolver(new StandardEnvironment());
    }
    
    public ClientConfig resolve(ClientConfig config) {
        String endpoint = firstNonEmpty(config.getEndpoint(), environment.getProperty(ENDPOINT_VARIABLE), DEFAULT_ENDPOINT);
        
        return ClientConfig.builder()
            .endpoint(normalizeEndpoint(endpoint))
            .region(emptyIfNull(config.getRegion()))
            .username(firstNonEmpty(config.getUsername(), environment.getProperty(USERNAME_VARIABLE), ""))
            .password(firstNonEmpty(config.getPassword(), environment.getProperty(PASSWORD_VARIABLE), ""))
            .userAgent(firstNonEmpty(config.getUserAgent(), DEFAULT_USER_AGENT))
            .httpClient(config.getHttpClient() != null ? config.getHttpClient() : defaultHttpClient.get())
            .build();
    }
    
    /**
     * Prefixes {@code http://} unless the endpoint already starts with an
     * {@code http://} or {@code https://} scheme, in any case.
     */
    static String normalizeEndpoint(String endpoint) {
        String lower = endpoint.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return endpoint;
        }
        return "http://" + endpoint;
    }
    
    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return "";
    }
    
    private static String emptyIfNull(String value) {
        return value == null ? "" : value;
    }
}
