package com.regressionsentinel.core.alerting.channel;

import com.regressionsentinel.core.config.AlertChannelConfig;
import com.regressionsentinel.core.model.EnhancedAlert;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Prints the plain-text alert to a stream (standard error by default).
 */
public class ConsoleAlertChannel implements AlertChannel {

    private final AlertChannelConfig config;
    private final PrintStream out;

    public ConsoleAlertChannel(AlertChannelConfig config, PrintStream out) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public Map<String, Object> deliver(EnhancedAlert alert, AlertMessage message) {
        out.println("PERFORMANCE ALERT [" + alert.getSeverity().label().toUpperCase(Locale.ROOT) + "] "
                + message.getSubject());
        out.println(message.getTextBody());
        out.flush();
        return Map.of();
    }

    @Override
    public AlertChannelConfig getConfig() {
        return config;
    }

    @Override
    public ChannelType getType() {
        return ChannelType.CONSOLE;
    }
}
