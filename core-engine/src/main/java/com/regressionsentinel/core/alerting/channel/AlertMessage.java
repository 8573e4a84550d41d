package com.regressionsentinel.core.alerting.channel;

import java.util.Objects;

/**
 * An alert rendered through its template, in both the template's own format
 * and plain text.
 */
public final class AlertMessage {

    private final String subject;
    private final String body;
    private final String textBody;
    private final boolean html;

    public AlertMessage(String subject, String body, String textBody, boolean html) {
        this.subject = Objects.requireNonNull(subject, "subject must not be null");
        this.body = Objects.requireNonNull(body, "body must not be null");
        this.textBody = Objects.requireNonNull(textBody, "textBody must not be null");
        this.html = html;
    }

    public String getSubject() {
        return subject;
    }

    /** Body in the template's format. */
    public String getBody() {
        return body;
    }

    /** Body with markup removed. */
    public String getTextBody() {
        return textBody;
    }

    public boolean isHtml() {
        return html;
    }
}
