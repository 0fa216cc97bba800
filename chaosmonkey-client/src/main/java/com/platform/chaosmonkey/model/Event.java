package com.platform.chaosmonkey.model;

import java.time.Instant;

/**
 * Termination of an EC2 instance by Chaos Monkey.
 *
 * @param instanceId           ID of the EC2 instance that was terminated
 * @param autoScalingGroupName name of the auto scaling group containing the instance
 * @param region               AWS region of the instance, empty when the server does not report it
 * @param strategy             chaos strategy used to terminate the instance
 * @param triggeredAt          when the chaos event was triggered, with second precision
 */
public record Event(
    String instanceId,
    String autoScalingGroupName,
    String region,
    Strategy strategy,
    Instant triggeredAt
) {
}
