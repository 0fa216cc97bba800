package com.platform.chaosmonkey.model;

import java.util.Objects;

/**
 * Chaos strategy used by Chaos Monkey to "break" an instance.
 * 
 * Strategies are opaque tokens: the client never validates them, the Chaos Monkey
 * server decides which ones it supports. The constants below are the strategies
 * shipped with vanilla Chaos Monkey; any other name can be used via {@link #of(String)}.
 */
public record Strategy(String name) {
    
    public static final Strategy SHUTDOWN_INSTANCE = new Strategy("ShutdownInstance");
    public static final Strategy BLOCK_ALL_NETWORK_TRAFFIC = new Strategy("BlockAllNetworkTraffic");
    public static final Strategy DETACH_VOLUMES = new Strategy("DetachVolumes");
    public static final Strategy BURN_CPU = new Strategy("BurnCpu");
    public static final Strategy BURN_IO = new Strategy("BurnIo");
    public static final Strategy KILL_PROCESSES = new Strategy("KillProcesses");
    public static final Strategy NULL_ROUTE = new Strategy("NullRoute");
    public static final Strategy FAIL_EC2 = new Strategy("FailEc2");
    public static final Strategy FAIL_DNS = new Strategy("FailDns");
    public static final Strategy FAIL_DYNAMODB = new Strategy("FailDynamoDb");
    public static final Strategy FAIL_S3 = new Strategy("FailS3");
    public static final Strategy FILL_DISK = new Strategy("FillDisk");
    public static final Strategy NETWORK_CORRUPTION = new Strategy("NetworkCorruption");
    public static final Strategy NETWORK_LATENCY = new Strategy("NetworkLatency");
    public static final Strategy NETWORK_LOSS = new Strategy("NetworkLoss");
    
    public Strategy {
        Objects.requireNonNull(name, "name");
    }
    
    public static Strategy of(String name) {
        return new Strategy(name == null ? "" : name);
    }
    
    @Override
    public String toString() {
        return name;
    }
}
