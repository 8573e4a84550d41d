package com.regressionsentinel.core.alerting.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.regressionsentinel.core.store.ObjectMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link WebhookTransport} on top of {@link HttpClient}.
 * <p>
 * A {@code 429 Too Many Requests} answer is retried once after a short pause;
 * any other status of 400 or above fails the delivery.
 * </p>
 */
public class HttpClientWebhookTransport implements WebhookTransport {

    private static final Logger LOG = LoggerFactory.getLogger(HttpClientWebhookTransport.class);

    static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration RATE_LIMIT_PAUSE = Duration.ofSeconds(1);
    private static final int TOO_MANY_REQUESTS = 429;

    private final HttpClient client;
    private final ObjectMapper mapper;

    public HttpClientWebhookTransport() {
        this(HttpClient.newBuilder().connectTimeout(REQUEST_TIMEOUT).build(), ObjectMappers.standard());
    }

    public HttpClientWebhookTransport(HttpClient client, ObjectMapper mapper) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public void post(String url, Object payload) {
        String json;
        try {
            json = mapper.writer().without(SerializationFeature.INDENT_OUTPUT).writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new AlertDeliveryException("Cannot serialize webhook payload: " + e.getOriginalMessage(), e);
        }

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                    .timeout(REQUEST_TIMEOUT)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(json))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new AlertDeliveryException("Invalid webhook URL: " + url, e);
        }

        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() == TOO_MANY_REQUESTS) {
                LOG.warn("Webhook {} rate limited the request, retrying once", url);
                Thread.sleep(RATE_LIMIT_PAUSE.toMillis());
                response = client.send(request, HttpResponse.BodyHandlers.ofString());
            }
            if (response.statusCode() >= 400) {
                throw new AlertDeliveryException("HTTP " + response.statusCode() + " from " + url);
            }
            LOG.debug("Webhook {} accepted alert with HTTP {}", url, response.statusCode());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AlertDeliveryException("Interrupted while posting to " + url, e);
        } catch (IOException e) {
            throw new AlertDeliveryException("Webhook request to " + url + " failed: " + e.getMessage(), e);
        }
    }
}
