package com.regressionsentinel.core.alerting.channel;

import java.util.Locale;

public enum ChannelType {
    CONSOLE,
    FILE,
    WEBHOOK,
    CHATOPS,
    EMAIL;

    /**
     * @param value channel type name, any case; {@code slack} maps to
     *              {@link #CHATOPS}
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ChannelType fromString(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "console" -> CONSOLE;
            case "file" -> FILE;
            case "webhook" -> WEBHOOK;
            case "chatops", "slack" -> CHATOPS;
            case "email" -> EMAIL;
            default -> throw new IllegalArgumentException("Unknown channel type: '" + value
                    + "'. Supported types: console, file, webhook, chatops, email");
        };
    }
}
