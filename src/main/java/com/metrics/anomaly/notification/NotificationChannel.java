package com.metrics.anomaly.notification;

import com.metrics.anomaly.exception.DispatchException;
import com.metrics.anomaly.model.Alert;
import com.metrics.anomaly.model.ChannelConfig;
import com.metrics.anomaly.model.ChannelType;

/**
 * Delivers an alert to one kind of external target. Implementations are synchronous;
 * the dispatcher runs them on its worker pool and enforces the timeout.
 */
public interface NotificationChannel {

    ChannelType type();

    /**
     * @throws DispatchException if the alert could not be delivered
     */
    void send(Alert alert, ChannelConfig config) throws DispatchException;
}
