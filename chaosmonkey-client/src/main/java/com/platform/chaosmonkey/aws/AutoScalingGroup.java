package com.platform.chaosmonkey.aws;

/**
 * Summary of an AWS auto scaling group.
 */
public record AutoScalingGroup(
    String name,
    int instancesInService,
    int desiredCapacity,
    int minSize,
    int maxSize
) {
}
