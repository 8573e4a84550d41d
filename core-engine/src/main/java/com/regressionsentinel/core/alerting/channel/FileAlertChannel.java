package com.regressionsentinel.core.alerting.channel;

import com.regressionsentinel.core.config.AlertChannelConfig;
import com.regressionsentinel.core.model.EnhancedAlert;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Appends one line per alert to {@code config.logFile}:
 * {@code <ISO timestamp> [SEVERITY] <subject> | <text body>}.
 */
public class FileAlertChannel implements AlertChannel {

    private final AlertChannelConfig config;
    private final Path logFile;
    private final Clock clock;

    public FileAlertChannel(AlertChannelConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        String path = config.getString("logFile");
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("File channel '" + config.getName() + "' requires 'logFile'");
        }
        this.logFile = Path.of(path);
    }

    @Override
    public Map<String, Object> deliver(EnhancedAlert alert, AlertMessage message) {
        String line = clock.instant() + " [" + alert.getSeverity().label().toUpperCase(Locale.ROOT) + "] "
                + message.getSubject() + " | " + message.getTextBody().strip().replaceAll("\\s*\\R\\s*", " | ")
                + System.lineSeparator();
        try {
            Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(logFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new AlertDeliveryException("Cannot append to " + logFile + ": " + e.getMessage(), e);
        }
        return Map.of("logFile", logFile.toString());
    }

    @Override
    public AlertChannelConfig getConfig() {
        return config;
    }

    @Override
    public ChannelType getType() {
        return ChannelType.FILE;
    }
}
