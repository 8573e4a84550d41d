package com.regressionsentinel.core.alerting.channel;

import com.regressionsentinel.core.config.AlertChannelConfig;
import com.regressionsentinel.core.model.EnhancedAlert;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public class EmailAlertChannel implements AlertChannel {

    private final AlertChannelConfig config;
    private final MailTransport transport;
    private final List<String> recipients;

    public EmailAlertChannel(AlertChannelConfig config, MailTransport transport) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.recipients = config.getStringList("recipients");
        if (recipients.isEmpty()) {
            throw new IllegalArgumentException("Email channel '" + config.getName() + "' requires 'recipients'");
        }
    }

    @Override
    public Map<String, Object> deliver(EnhancedAlert alert, AlertMessage message) {
        transport.send(new EmailMessage(recipients, message.getSubject(), message.getBody(), message.isHtml()));
        return Map.of("recipients", recipients);
    }

    @Override
    public AlertChannelConfig getConfig() {
        return config;
    }

    @Override
    public ChannelType getType() {
        return ChannelType.EMAIL;
    }
}
