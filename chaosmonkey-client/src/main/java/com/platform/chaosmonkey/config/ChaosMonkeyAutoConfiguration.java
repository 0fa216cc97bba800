package com.platform.chaosmonkey.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.chaosmonkey.aws.AwsClientFactory;
import com.platform.chaosmonkey.aws.AwsResources;
import com.platform.chaosmonkey.aws.DefaultAwsClientFactory;
import com.platform.chaosmonkey.client.ChaosMonkeyClient;
import com.platform.chaosmonkey.observability.ClientMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Auto-configuration of the Chaos Monkey client and the AWS resource facade.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(ChaosMonkeyProperties.class)
@ConditionalOnProperty(name = "chaosmonkey.enabled", havingValue = "true", matchIfMissing = true)
public class ChaosMonkeyAutoConfiguration {
    
    @Bean
    @ConditionalOnMissingBean
    public ConfigResolver chaosMonkeyConfigResolver(Environment environment, ChaosMonkeyProperties properties) {
        return new ConfigResolver(environment, () -> HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build());
    }
    
    @Bean
    @ConditionalOnMissingBean
    public ClientMetrics chaosMonkeyClientMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        return registry != null ? new ClientMetrics(registry) : ClientMetrics.noop();
    }
    
    @Bean
    @ConditionalOnMissingBean
    public ChaosMonkeyClient chaosMonkeyClient(ChaosMonkeyProperties properties, ConfigResolver resolver,
                                               ObjectProvider<ObjectMapper> objectMapper, ClientMetrics metrics) {
        ChaosMonkeyClient client = new ChaosMonkeyClient(
            properties.toClientConfig(), resolver, objectMapper.getIfAvailable(ObjectMapper::new), metrics);
        log.info("Chaos Monkey client configured for {}", client.getConfig().getEndpoint());
        return client;
    }
    
    @Bean
    @ConditionalOnMissingBean
    public AwsClientFactory awsClientFactory() {
        return new DefaultAwsClientFactory();
    }
    
    @Bean
    @ConditionalOnMissingBean
    public AwsResources awsResources(AwsClientFactory awsClientFactory) {
        return new AwsResources(awsClientFactory);
    }
}
