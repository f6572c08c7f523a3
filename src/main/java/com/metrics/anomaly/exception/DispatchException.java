package com.metrics.anomaly.exception;

import com.metrics.anomaly.model.ChannelType;

/**
 * Raised by a notification channel when an alert could not be delivered.
 */
public class DispatchException extends Exception {

    private final ChannelType channelType;

    public DispatchException(ChannelType channelType, String message) {
        super(message);
        this.channelType = channelType;
    }

    public DispatchException(ChannelType channelType, String message, Throwable cause) {
        super(message, cause);
        this.channelType = channelType;
    }

    public ChannelType getChannelType() {
        return channelType;
    }
}
