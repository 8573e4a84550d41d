package com.regressionsentinel.core.alerting;

import com.regressionsentinel.core.config.AlertTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The three message templates, with built-in defaults loaded from
 * {@code templates/*.html} on the classpath.
 *
 * @since 1.0.0
 */
public final class AlertTemplates {

    public static final String PERFORMANCE_REGRESSION = "performanceRegression";
    public static final String VISUAL_REGRESSION = "visualRegression";
    public static final String ESCALATION = "escalation";

    private final Map<String, AlertTemplate> templates;

    private AlertTemplates(Map<String, AlertTemplate> templates) {
        this.templates = Collections.unmodifiableMap(templates);
    }

    /**
     * Built-in templates overlaid with {@code overrides}; an override missing
     * its subject or body keeps the default for that part.
     */
    public static AlertTemplates withOverrides(Map<String, AlertTemplate> overrides) {
        Map<String, AlertTemplate> merged = new LinkedHashMap<>();
        merged.put(PERFORMANCE_REGRESSION, new AlertTemplate(
                "Performance Regression Detected: {{testName}}",
                readResource("templates/performance-regression.html"), "html"));
        merged.put(VISUAL_REGRESSION, new AlertTemplate(
                "Visual Regression Detected: {{testName}}",
                readResource("templates/visual-regression.html"), "html"));
        merged.put(ESCALATION, new AlertTemplate(
                "ESCALATION: Unacknowledged Performance Alert - {{testName}}",
                readResource("templates/escalation.html"), "html"));

        if (overrides != null) {
            overrides.forEach((name, override) -> {
                AlertTemplate base = merged.get(name);
                if (base == null || override == null) {
                    merged.put(name, override);
                    return;
                }
                merged.put(name, new AlertTemplate(
                        override.getSubject() != null ? override.getSubject() : base.getSubject(),
                        override.getBody() != null ? override.getBody() : base.getBody(),
                        override.getFormat() != null ? override.getFormat() : base.getFormat()));
            });
        }
        return new AlertTemplates(merged);
    }

    public static AlertTemplates defaults() {
        return withOverrides(Map.of());
    }

    public AlertTemplate get(String name) {
        AlertTemplate template = templates.get(name);
        if (template == null) {
            throw new IllegalArgumentException("No alert template named '" + name + "'");
        }
        return template;
    }

    private static String readResource(String name) {
        try (InputStream in = AlertTemplates.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                throw new IllegalStateException("Alert template resource not found on classpath: " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read alert template " + name, e);
        }
    }
}
