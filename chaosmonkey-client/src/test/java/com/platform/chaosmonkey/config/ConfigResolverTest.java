package com.platform.chaosmonkey.config;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.net.http.HttpClient;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigResolverTest {
    
    private final MockEnvironment environment = new MockEnvironment();
    private final ConfigResolver resolver = new ConfigResolver(environment);
    
    @Test
    void defaultsWhenNothingIsSet() {
        ClientConfig config = resolver.resolve(ClientConfig.empty());
        
        assertThat(config.getEndpoint()).isEqualTo("http://127.0.0.1:8080");
        assertThat(config.getUserAgent()).isEqualTo("chaosmonkey Java library");
        assertThat(config.getUsername()).isEmpty();
        assertThat(config.getPassword()).isEmpty();
        assertThat(config.getRegion()).isEmpty();
        assertThat(config.getHttpClient()).isNotNull();
        assertThat(config.hasCredentials()).isFalse();
    }
    
    @Test
    void environmentEndpointGetsHttpScheme() {
        environment.setProperty("CHAOSMONKEY_ENDPOINT", "foo.example.com:9090");
        
        ClientConfig config = resolver.resolve(ClientConfig.empty());
        
        assertThat(config.getEndpoint()).isEqualTo("http://foo.example.com:9090");
    }
    
    @Test
    void httpsEndpointIsLeftAlone() {
        ClientConfig config = resolver.resolve(ClientConfig.builder().endpoint("https://chaos.example.com").build());
        
        assertThat(config.getEndpoint()).isEqualTo("https://chaos.example.com");
    }
    
    @Test
    void hostNameStartingWithHttpGetsScheme() {
        assertThat(resolver.resolve(ClientConfig.builder().endpoint("httpd.internal:8080").build()).getEndpoint())
            .isEqualTo("http://httpd.internal:8080");
        assertThat(resolver.resolve(ClientConfig.builder().endpoint("http-gw:9090").build()).getEndpoint())
            .isEqualTo("http://http-gw:9090");
    }
    
    @Test
    void upperCaseSchemeIsLeftAlone() {
        ClientConfig config = resolver.resolve(ClientConfig.builder().endpoint("HTTPS://chaos.example.com").build());
        
        assertThat(config.getEndpoint()).isEqualTo("HTTPS://chaos.example.com");
    }
    
    @Test
    void defaultHttpClientFollowsRedirects() {
        ClientConfig config = resolver.resolve(ClientConfig.empty());
        
        assertThat(config.getHttpClient().followRedirects()).isEqualTo(HttpClient.Redirect.NORMAL);
    }
    
    @Test
    void callerValuesWinOverEnvironment() {
        environment.setProperty("CHAOSMONKEY_ENDPOINT", "env.example.com");
        environment.setProperty("CHAOSMONKEY_USERNAME", "env-user");
        environment.setProperty("CHAOSMONKEY_PASSWORD", "env-pass");
        
        ClientConfig config = resolver.resolve(ClientConfig.builder()
            .endpoint("http://caller.example.com")
            .username("caller-user")
            .password("caller-pass")
            .build());
        
        assertThat(config.getEndpoint()).isEqualTo("http://caller.example.com");
        assertThat(config.getUsername()).isEqualTo("caller-user");
        assertThat(config.getPassword()).isEqualTo("caller-pass");
    }
    
    @Test
    void emptyCallerValuesFallBackToEnvironment() {
        environment.setProperty("CHAOSMONKEY_USERNAME", "env-user");
        environment.setProperty("CHAOSMONKEY_PASSWORD", "env-pass");
        
        ClientConfig config = resolver.resolve(ClientConfig.builder().username("").build());
        
        assertThat(config.getUsername()).isEqualTo("env-user");
        assertThat(config.getPassword()).isEqualTo("env-pass");
        assertThat(config.hasCredentials()).isTrue();
    }
    
    @Test
    void environmentIsReadOnEveryResolution() {
        assertThat(resolver.resolve(ClientConfig.empty()).getEndpoint()).isEqualTo(ConfigResolver.DEFAULT_ENDPOINT);
        
        environment.setProperty("CHAOSMONKEY_ENDPOINT", "later.example.com");
        
        assertThat(resolver.resolve(ClientConfig.empty()).getEndpoint()).isEqualTo("http://later.example.com");
    }
    
    @Test
    void callerConfigIsNotModified() {
        ClientConfig partial = ClientConfig.builder().region("us-east-1").build();
        
        ClientConfig resolved = resolver.resolve(partial);
        
        assertThat(partial.getEndpoint()).isNull();
        assertThat(resolved.getRegion()).isEqualTo("us-east-1");
    }
    
    @Test
    void callerHttpClientIsKept() {
        HttpClient httpClient = HttpClient.newHttpClient();
        
        ClientConfig config = resolver.resolve(ClientConfig.builder().httpClient(httpClient).build());
        
        assertThat(config.getHttpClient()).isSameAs(httpClient);
    }
    
    @Test
    void resolutionIsIdempotent() {
        environment.setProperty("CHAOSMONKEY_ENDPOINT", "foo.example.com:9090");
        ClientConfig once = resolver.resolve(ClientConfig.builder().userAgent("agent").build());
        
        ClientConfig twice = resolver.resolve(once);
        
        assertThat(twice).isEqualTo(once);
    }
    
    @Test
    void passwordIsMaskedInToString() {
        ClientConfig config = ClientConfig.builder().username("user").password("secret").build();
        
        assertThat(config.toString()).doesNotContain("secret");
    }
}
