package com.platform.chaosmonkey.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.chaosmonkey.config.ClientConfig;
import com.platform.chaosmonkey.error.ChaosMonkeyException;
import com.platform.chaosmonkey.error.MalformedResponseException;
import com.platform.chaosmonkey.error.NetworkFailureException;
import com.platform.chaosmonkey.error.RemoteFailureException;
import com.platform.chaosmonkey.error.SerializationException;
import com.platform.chaosmonkey.error.TransportFailureException;
import com.platform.chaosmonkey.error.ValidationException;
import com.platform.chaosmonkey.model.ChaosMonkeyModels.ApiResponse;
import com.platform.chaosmonkey.observability.ClientMetrics;
import com.platform.chaosmonkey.observability.ClientMetrics.Outcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Performs a single HTTP exchange with the Chaos Monkey API and classifies the result.
 * 
 * Only HTTP 200 counts as success. Error bodies are decoded as {@link ApiResponse}
 * so that the server's {@code message} can be surfaced verbatim; when there is
 * none the status line is reported instead.
 */
@Slf4j
class ApiRequestSender {
    
    private final ClientConfig config;
    private final ObjectMapper objectMapper;
    private final ClientMetrics metrics;
    
    ApiRequestSender(ClientConfig config, ObjectMapper objectMapper, ClientMetrics metrics) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }
    
    /**
     * Send a request and decode a 200 response body into {@code responseType}.
     *
     * @param url  absolute request URL
     * @param body request payload to encode as JSON, or null for no body
     * @return the decoded body; null if the body was the JSON literal {@code null}
     * @throws ValidationException if {@code url} is not a valid HTTP(S) URL
     */
    <T> T send(String method, String url, Object body, JavaType responseType) {
        long start = System.nanoTime();
        try {
            T result = exchange(method, url, body, responseType);
            metrics.recordRequest(method, Outcome.SUCCESS, Duration.ofNanos(System.nanoTime() - start));
            return result;
        } catch (ChaosMonkeyException e) {
            metrics.recordRequest(method, outcomeOf(e), Duration.ofNanos(System.nanoTime() - start));
            throw e;
        }
    }
    
    private <T> T exchange(String method, String url, Object body, JavaType responseType) {
        URI uri;
        HttpRequest request;
        try {
            uri = URI.create(url);
            request = buildRequest(method, uri, body);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("endpoint", "cannot send " + method + " to " + url + ": " + e.getMessage());
        }
        log.debug("Sending {} {}", method, uri);
        
        HttpResponse<InputStream> response;
        try {
            response = config.getHttpClient().send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw new NetworkFailureException(method, uri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkFailureException(method, uri, e);
        }
        
        try (InputStream in = response.body()) {
            int status = response.statusCode();
            log.debug("{} {} returned {}", method, uri, status);
            if (status != HttpStatus.OK.value()) {
                throw decodeError(status, in);
            }
            return objectMapper.readValue(in, responseType);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException(
                String.format("Cannot decode response of %s %s: %s", method, uri, e.getOriginalMessage()), e);
        } catch (IOException e) {
            throw new NetworkFailureException(method, uri, e);
        }
    }
    
    HttpRequest buildRequest(String method, URI uri, Object body) {
        HttpRequest.BodyPublisher publisher = HttpRequest.BodyPublishers.noBody();
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .header(HttpHeaders.USER_AGENT, config.getUserAgent())
            .header(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        
        if (body != null) {
            publisher = HttpRequest.BodyPublishers.ofByteArray(encode(body));
            builder.header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        }
        if (config.hasCredentials()) {
            builder.header(HttpHeaders.AUTHORIZATION, "Basic "
                + HttpHeaders.encodeBasicAuth(config.getUsername(), config.getPassword(), StandardCharsets.UTF_8));
        }
        
        return builder.method(method, publisher).build();
    }
    
    private byte[] encode(Object body) {
        try {
            return objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Cannot encode request body: " + e.getOriginalMessage(), e);
        }
    }
    
    private ChaosMonkeyException decodeError(int status, InputStream in) {
        String message = null;
        try {
            ApiResponse error = objectMapper.readValue(in, ApiResponse.class);
            if (error != null) {
                message = error.getMessage();
            }
        } catch (IOException e) {
            log.debug("Error body of HTTP {} is not an API response: {}", status, e.getMessage());
        }
        
        if (message != null && !message.isEmpty()) {
            return new RemoteFailureException(status, message);
        }
        return new TransportFailureException(status, statusLine(status));
    }
    
    static String statusLine(int status) {
        HttpStatus httpStatus = HttpStatus.resolve(status);
        return httpStatus != null ? status + " " + httpStatus.getReasonPhrase() : String.valueOf(status);
    }
    
    private static Outcome outcomeOf(ChaosMonkeyException e) {
        switch (e.getErrorCode()) {
            case REMOTE_FAILURE:
                return Outcome.REMOTE_FAILURE;
            case HTTP_ERROR:
                return Outcome.HTTP_ERROR;
            case MALFORMED_RESPONSE:
            case SERIALIZATION_ERROR:
                return Outcome.MALFORMED_RESPONSE;
            case INVALID_FIELD_VALUE:
                return Outcome.INVALID_REQUEST;
            default:
                return Outcome.NETWORK_FAILURE;
        }
    }
}
