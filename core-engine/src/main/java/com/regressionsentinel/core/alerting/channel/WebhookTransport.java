package com.regressionsentinel.core.alerting.channel;

/**
 * Sends a JSON document to an HTTP endpoint. Swapped for a recording fake in
 * tests.
 */
@FunctionalInterface
public interface WebhookTransport {

    /**
     * @param url     target endpoint
     * @param payload object serialized to the request body
     * @throws AlertDeliveryException if the request fails or the endpoint
     *                                answers with an error status
     */
    void post(String url, Object payload);
}
