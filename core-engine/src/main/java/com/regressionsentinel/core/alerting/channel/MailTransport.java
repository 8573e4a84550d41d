package com.regressionsentinel.core.alerting.channel;

/**
 * Hands a finished email to whatever actually sends mail.
 */
@FunctionalInterface
public interface MailTransport {

    /**
     * @throws AlertDeliveryException if the message could not be handed off
     */
    void send(EmailMessage message);
}
