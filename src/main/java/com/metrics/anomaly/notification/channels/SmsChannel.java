package com.metrics.anomaly.notification.channels;

import com.metrics.anomaly.config.TwilioNotificationConfig;
import com.metrics.anomaly.exception.DispatchException;
import com.metrics.anomaly.model.Alert;
import com.metrics.anomaly.model.ChannelConfig;
import com.metrics.anomaly.model.ChannelType;
import com.metrics.anomaly.notification.NotificationChannel;
import com.twilio.Twilio;
import com.twilio.exception.ApiException;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * SMS or WhatsApp delivery through Twilio.
 * {@code settings.to} overrides the configured default recipient; {@code settings.channel}
 * ("sms" or "whatsapp") overrides the configured default channel.
 */
@Component
public class SmsChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(SmsChannel.class);

    public static final String TO = "to";
    public static final String CHANNEL = "channel";

    private final TwilioNotificationConfig config;

    public SmsChannel(TwilioNotificationConfig config) {
        this.config = config;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio SMS channel initialized. Default channel: {}", config.getChannel());
        } else {
            log.info("Twilio SMS channel is DISABLED.");
        }
    }

    @Override
    public ChannelType type() {
        return ChannelType.SMS;
    }

    @Override
    public void send(Alert alert, ChannelConfig channelConfig) throws DispatchException {
        if (!config.isEnabled()) {
            throw new DispatchException(type(), "Twilio is disabled (twilio.enabled=false)");
        }
        String to = channelConfig.getSetting(TO, config.getToNumber());
        if (to == null || to.isBlank()) {
            throw new DispatchException(type(), "No SMS recipient: set 'to' or twilio.to-number");
        }
        if (config.getFromNumber() == null || config.getFromNumber().isBlank()) {
            throw new DispatchException(type(), "twilio.from-number is not configured");
        }
        String variant = channelConfig.getSetting(CHANNEL, config.getChannel());

        try {
            Message message = Message.creator(
                    new PhoneNumber(resolveNumber(to, variant)),
                    new PhoneNumber(resolveNumber(config.getFromNumber(), variant)),
                    buildMessageBody(alert)
            ).create();
            log.info("Twilio {} sent for alert={}, sid={}", variant, alert.getId(), message.getSid());
        } catch (ApiException e) {
            throw new DispatchException(type(), "Twilio rejected message: " + e.getMessage(), e);
        }
    }

    static String buildMessageBody(Alert alert) {
        return String.format(
                "[%s ALERT] %s\n" +
                "Metric: %s\n" +
                "Value: %.4f\n" +
                "%s",
                alert.getSeverity().name(),
                alert.getRuleName(),
                alert.getMetric(),
                alert.getAggregateValue(),
                alert.getMessage()
        );
    }

    static String resolveNumber(String number, String variant) {
        if ("whatsapp".equalsIgnoreCase(variant) && !number.startsWith("whatsapp:")) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
