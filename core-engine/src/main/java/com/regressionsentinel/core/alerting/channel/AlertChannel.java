package com.regressionsentinel.core.alerting.channel;

import com.regressionsentinel.core.config.AlertChannelConfig;
import com.regressionsentinel.core.model.EnhancedAlert;

import java.util.Map;

/**
 * Contract for every delivery channel.
 * <p>
 * A channel is built once from its {@link AlertChannelConfig} and reused for
 * every alert. {@link #deliver} either returns normally or throws; the
 * alerting engine turns both outcomes into a delivery result.
 * </p>
 */
public interface AlertChannel {

    /**
     * Deliver one alert.
     *
     * @param alert   the enriched alert
     * @param message the alert rendered through its template
     * @return metadata describing the delivery (target path, URL, recipients)
     * @throws AlertDeliveryException if the alert could not be delivered
     */
    Map<String, Object> deliver(EnhancedAlert alert, AlertMessage message);

    AlertChannelConfig getConfig();

    ChannelType getType();

    default String getName() {
        return getConfig().getName();
    }
}
