package com.regressionsentinel.core.alerting.channel;

/**
 * A channel could not deliver an alert: the endpoint was unreachable,
 * rejected the request or the channel is misconfigured.
 */
public class AlertDeliveryException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AlertDeliveryException(String message) {
        super(message);
    }

    public AlertDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
