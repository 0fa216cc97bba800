package com.platform.chaosmonkey.aws;

import com.amazonaws.services.autoscaling.AmazonAutoScaling;
import com.amazonaws.services.simpledb.AmazonSimpleDB;

/**
 * Creates region-bound AWS service clients.
 */
public interface AwsClientFactory {
    
    AmazonAutoScaling autoScaling(String region);
    
    AmazonSimpleDB simpleDb(String region);
}
