package com.platform.chaosmonkey.aws;

import com.amazonaws.ClientConfiguration;
import com.amazonaws.services.autoscaling.AmazonAutoScaling;
import com.amazonaws.services.autoscaling.AmazonAutoScalingClientBuilder;
import com.amazonaws.services.simpledb.AmazonSimpleDB;
import com.amazonaws.services.simpledb.AmazonSimpleDBClientBuilder;

import java.time.Duration;

/**
 * Builds AWS clients with the default credentials chain (environment variables,
 * profile, instance role) and a fixed request timeout.
 */
public class DefaultAwsClientFactory implements AwsClientFactory {
    
    public static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);
    
    private final ClientConfiguration clientConfiguration;
    
    public DefaultAwsClientFactory() {
        int timeoutMs = (int) REQUEST_TIMEOUT.toMillis();
        this.clientConfiguration = new ClientConfiguration()
            .withRequestTimeout(timeoutMs)
            .withClientExecutionTimeout(timeoutMs);
    }
    
    @Override
    public AmazonAutoScaling autoScaling(String region) {
        return AmazonAutoScalingClientBuilder.standard()
            .withRegion(region)
            .withClientConfiguration(clientConfiguration)
            .build();
    }
    
    @Override
    public AmazonSimpleDB simpleDb(String region) {
        return AmazonSimpleDBClientBuilder.standard()
            .withRegion(region)
            .withClientConfiguration(clientConfiguration)
            .build();
    }
}
