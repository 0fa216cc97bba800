package com.platform.chaosmonkey.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * DTOs for Chaos Monkey API communication.
 */
public final class ChaosMonkeyModels {
    
    /**
     * Event type of an on-demand termination.
     */
    public static final String EVENT_TYPE_CHAOS_TERMINATION = "CHAOS_TERMINATION";
    
    /**
     * Group type of an auto scaling group.
     */
    public static final String GROUP_TYPE_ASG = "ASG";
    
    private ChaosMonkeyModels() {
    }
    
    /**
     * Request sent to the chaos endpoint.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ApiRequest {
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        private String chaosType;
        private String eventType;
        private String groupName;
        private String groupType;
        
        // Ignored by vanilla Chaos Monkey
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        private String region;
        
        public static ApiRequest chaosTermination(String groupName, Strategy strategy, String region) {
            return ApiRequest.builder()
                .eventType(EVENT_TYPE_CHAOS_TERMINATION)
                .groupType(GROUP_TYPE_ASG)
                .groupName(groupName)
                .chaosType(strategy.name())
                .region(region)
                .build();
        }
    }
    
    /**
     * Response returned by the chaos endpoint, either for a single event or as
     * an element of the event history. Error bodies use the same shape with
     * {@code message} set.
     */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiResponse {
        private String chaosType;
        private String eventId;
        private long eventTime;
        private String eventType;
        private String groupName;
        private String groupType;
        private String monkeyType;
        private String region;
        private String message;
        
        /**
         * Converts the response into an {@link Event}. The event time is sent in
         * milliseconds and truncated to whole seconds.
         */
        public Event toEvent() {
            return new Event(
                nullToEmpty(eventId),
                nullToEmpty(groupName),
                nullToEmpty(region),
                Strategy.of(chaosType),
                Instant.ofEpochSecond(Math.floorDiv(eventTime, 1000L))
            );
        }
        
        private static String nullToEmpty(String value) {
            return value == null ? "" : value;
        }
    }
}
