package com.regressionsentinel.core.alerting.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link MailTransport}: records each email in the log instead of
 * sending it. Deployments that need real mail plug in their own transport.
 */
public class LoggingMailTransport implements MailTransport {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingMailTransport.class);

    @Override
    public void send(EmailMessage message) {
        LOG.info("Email alert to {}: {}", message.getTo(), message.getSubject());
        LOG.debug("Email body (html={}):\n{}", message.isHtml(), message.getBody());
    }
}
