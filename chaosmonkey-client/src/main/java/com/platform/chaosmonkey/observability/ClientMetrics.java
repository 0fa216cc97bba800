package com.platform.chaosmonkey.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer metrics for Chaos Monkey API requests.
 */
public class ClientMetrics {
    
    public static final String REQUEST_TIMER = "chaosmonkey.client.requests";
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();
    
    public ClientMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }
    
    /**
     * Metrics that are recorded nowhere.
     */
    public static ClientMetrics noop() {
        return new ClientMetrics(new CompositeMeterRegistry());
    }
    
    public void recordRequest(String method, Outcome outcome, Duration elapsed) {
        String key = method + "." + outcome;
        timers.computeIfAbsent(key, k ->
            Timer.builder(REQUEST_TIMER)
                .description("Chaos Monkey API requests")
                .tag("method", method)
                .tag("outcome", outcome.tagValue())
                .register(meterRegistry))
            .record(elapsed);
    }
    
    /**
     * How a request ended.
     */
    public enum Outcome {
        SUCCESS,
        REMOTE_FAILURE,
        HTTP_ERROR,
        MALFORMED_RESPONSE,
        INVALID_REQUEST,
        NETWORK_FAILURE;
        
        public String tagValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
