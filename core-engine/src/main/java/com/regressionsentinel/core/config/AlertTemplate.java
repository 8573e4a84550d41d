package com.regressionsentinel.core.config;

import java.util.Locale;

/**
 * Message template with {@code {{variable}}} placeholders.
 *
 * @since 1.0.0
 */
public class AlertTemplate {

    private String subject;
    private String body;

    /** {@code html} or {@code text}. */
    private String format = "html";

    public AlertTemplate() {
    }

    public AlertTemplate(String subject, String body, String format) {
        this.subject = subject;
        this.body = body;
        this.format = format;
    }

    public boolean isHtml() {
        return format != null && format.toLowerCase(Locale.ROOT).equals("html");
    }

    public String getSubject() {
        return subject;
    }

    public void setSubject(String subject) {
        this.subject = subject;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }
}
