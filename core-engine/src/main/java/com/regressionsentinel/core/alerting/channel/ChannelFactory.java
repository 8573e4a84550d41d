package com.regressionsentinel.core.alerting.channel;

import com.regressionsentinel.core.config.AlertChannelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Builds {@link AlertChannel} instances from {@link AlertChannelConfig}
 * entries.
 *
 * <p>
 * This is the single point of extension when adding new channel types:
 * register the new type string in {@link ChannelType} and create the
 * corresponding channel here. The outbound transports are shared by every
 * channel the factory builds.
 * </p>
 *
 * @since 1.0.0
 */
public final class ChannelFactory {

    private static final Logger LOG = LoggerFactory.getLogger(ChannelFactory.class);

    private final WebhookTransport webhookTransport;
    private final MailTransport mailTransport;
    private final PrintStream console;
    private final Clock clock;
    private final String environment;

    public ChannelFactory(WebhookTransport webhookTransport, MailTransport mailTransport,
                          PrintStream console, Clock clock, String environment) {
        this.webhookTransport = Objects.requireNonNull(webhookTransport, "webhookTransport must not be null");
        this.mailTransport = Objects.requireNonNull(mailTransport, "mailTransport must not be null");
        this.console = Objects.requireNonNull(console, "console must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.environment = environment;
    }

    /**
     * Factory with the HTTP webhook transport, log-only mail and standard
     * error as the console.
     */
    public static ChannelFactory defaults(Clock clock, String environment) {
        return new ChannelFactory(new HttpClientWebhookTransport(), new LoggingMailTransport(),
                System.err, clock, environment);
    }

    /**
     * Create a channel for the given configuration.
     *
     * @param config the channel configuration; must not be {@code null}
     * @return the channel
     * @throws NullPointerException     if {@code config} or its type is {@code null}
     * @throws IllegalArgumentException if the type is unknown or a required
     *                                  setting is missing
     */
    public AlertChannel create(AlertChannelConfig config) {
        Objects.requireNonNull(config, "AlertChannelConfig must not be null");
        Objects.requireNonNull(config.getType(), "Channel type must not be null");

        return switch (ChannelType.fromString(config.getType())) {
            case CONSOLE -> new ConsoleAlertChannel(config, console);
            case FILE -> new FileAlertChannel(config, clock);
            case WEBHOOK -> new WebhookAlertChannel(config, webhookTransport, clock, environment);
            case CHATOPS -> new ChatOpsAlertChannel(config, webhookTransport, clock);
            case EMAIL -> new EmailAlertChannel(config, mailTransport);
        };
    }

    /**
     * Create channels for every configuration in the list.
     *
     * @return unmodifiable list of channels, one per configuration
     */
    public List<AlertChannel> createAll(List<AlertChannelConfig> configs) {
        Objects.requireNonNull(configs, "Channel list must not be null");
        LOG.info("Creating {} alert channel(s) from configuration", configs.size());
        return Collections.unmodifiableList(configs.stream()
                .map(this::create)
                .toList());
    }
}
