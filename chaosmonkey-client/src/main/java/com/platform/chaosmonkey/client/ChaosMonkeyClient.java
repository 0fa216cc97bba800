package com.platform.chaosmonkey.client;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.chaosmonkey.config.ClientConfig;
import com.platform.chaosmonkey.config.ConfigResolver;
import com.platform.chaosmonkey.error.MalformedResponseException;
import com.platform.chaosmonkey.error.ValidationException;
import com.platform.chaosmonkey.model.ChaosMonkeyModels.ApiRequest;
import com.platform.chaosmonkey.model.ChaosMonkeyModels.ApiResponse;
import com.platform.chaosmonkey.model.Event;
import com.platform.chaosmonkey.model.Strategy;
import com.platform.chaosmonkey.observability.ClientMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Client for the Chaos Monkey REST API.
 * 
 * Triggers chaos events, which make Chaos Monkey "break" an EC2 instance of an
 * auto scaling group using a given {@link Strategy}, and lists past events.
 * Triggering requires an unleashed Chaos Monkey with on-demand termination enabled:
 * <pre>
 * simianarmy.chaos.leashed = false
 * simianarmy.chaos.terminateOndemand.enabled = true
 * </pre>
 * 
 * Instances are immutable and safe for concurrent use. Every call is a single
 * request; failures are thrown as {@link com.platform.chaosmonkey.error.ChaosMonkeyException}
 * subclasses and never retried.
 */
@Slf4j
public class ChaosMonkeyClient {
    
    public static final String API_PATH = "/simianarmy/api/v1/chaos";
    
    private final ClientConfig config;
    private final ApiRequestSender sender;
    private final JavaType responseType;
    private final JavaType responseListType;
    
    /**
     * Create a client, resolving missing configuration from the process environment.
     */
    public ChaosMonkeyClient(ClientConfig config) {
        this(config, ConfigResolver.fromSystemEnvironment(), new ObjectMapper(), ClientMetrics.noop());
    }
    
    public ChaosMonkeyClient(ClientConfig config, ConfigResolver resolver, ObjectMapper objectMapper, ClientMetrics metrics) {
        this.config = resolver.resolve(config);
        this.sender = new ApiRequestSender(this.config, objectMapper, metrics);
        this.responseType = objectMapper.constructType(ApiResponse.class);
        this.responseListType = objectMapper.getTypeFactory().constructCollectionType(List.class, ApiResponse.class);
        log.debug("Chaos Monkey client created for {}", this.config.getEndpoint());
    }
    
    /**
     * Trigger a chaos event which makes Chaos Monkey break an instance of the
     * given auto scaling group using the given strategy.
     */
    public Event triggerEvent(String groupName, Strategy strategy) {
        ApiRequest request = ApiRequest.chaosTermination(groupName, strategy, config.getRegion());
        String url = config.getEndpoint() + API_PATH;
        
        ApiResponse response = sender.send("POST", url, request, responseType);
        if (response == null) {
            throw new MalformedResponseException("Empty response to POST " + url, null);
        }
        
        Event event = response.toEvent();
        log.info("Triggered {} on instance {} of group {}", event.strategy(), event.instanceId(), groupName);
        return event;
    }
    
    /**
     * All chaos events.
     */
    public List<Event> events() {
        return eventsSince(Instant.EPOCH);
    }
    
    /**
     * Chaos events since the given time, in the order returned by the server.
     * The time is sent with second precision.
     *
     * @throws ValidationException if {@code since} does not fit in epoch milliseconds
     */
    public List<Event> eventsSince(Instant since) {
        long sinceMillis;
        try {
            sinceMillis = Math.multiplyExact(since.getEpochSecond(), 1000L);
        } catch (ArithmeticException e) {
            throw new ValidationException("since", since + " is out of range for epoch milliseconds");
        }
        String url = config.getEndpoint() + API_PATH + "?since=" + sinceMillis;
        
        List<ApiResponse> responses = sender.send("GET", url, null, responseListType);
        List<Event> events = new ArrayList<>();
        if (responses != null) {
            for (ApiResponse response : responses) {
                if (response != null) {
                    events.add(response.toEvent());
                }
            }
        }
        return events;
    }
    
    /**
     * The resolved configuration this client uses.
     */
    public ClientConfig getConfig() {
        return config;
    }
}
