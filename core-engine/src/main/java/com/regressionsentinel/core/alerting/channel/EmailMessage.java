package com.regressionsentinel.core.alerting.channel;

import java.util.List;
import java.util.Objects;

public final class EmailMessage {

    private final List<String> to;
    private final String subject;
    private final String body;
    private final boolean html;

    public EmailMessage(List<String> to, String subject, String body, boolean html) {
        this.to = List.copyOf(Objects.requireNonNull(to, "to must not be null"));
        this.subject = Objects.requireNonNull(subject, "subject must not be null");
        this.body = Objects.requireNonNull(body, "body must not be null");
        this.html = html;
    }

    public List<String> getTo() {
        return to;
    }

    public String getSubject() {
        return subject;
    }

    public String getBody() {
        return body;
    }

    public boolean isHtml() {
        return html;
    }

    @Override
    public String toString() {
        return "EmailMessage{to=" + to + ", subject='" + subject + "', html=" + html + '}';
    }
}
