package com.regressionsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * Delivery bookkeeping for an {@link EnhancedAlert}. {@code sent} becomes
 * {@code true} once at least one channel accepted the alert; {@code failed}
 * records that at least one channel did not.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeliveryStatus {

    private boolean sent;
    private Instant sentAt;
    private boolean failed;
    private String failureReason;
    private int retryCount;

    public boolean isSent() {
        return sent;
    }

    public void setSent(boolean sent) {
        this.sent = sent;
    }

    public Instant getSentAt() {
        return sentAt;
    }

    public void setSentAt(Instant sentAt) {
        this.sentAt = sentAt;
    }

    public boolean isFailed() {
        return failed;
    }

    public void setFailed(boolean failed) {
        this.failed = failed;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public void setFailureReason(String failureReason) {
        this.failureReason = failureReason;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    /** Record a successful delivery at {@code at}; the first success wins. */
    public void markSent(Instant at) {
        if (!sent) {
            sent = true;
            sentAt = at;
        }
    }

    /** Record a failed delivery. */
    public void markFailed(String reason) {
        failed = true;
        failureReason = reason;
    }

    @Override
    public String toString() {
        return "DeliveryStatus{sent=" + sent + ", sentAt=" + sentAt + ", failed=" + failed
                + ", failureReason='" + failureReason + "', retryCount=" + retryCount + '}';
    }
}
