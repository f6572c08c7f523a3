package com.metrics.anomaly.notification.channels;

import com.metrics.anomaly.exception.DispatchException;
import com.metrics.anomaly.model.Alert;
import com.metrics.anomaly.model.ChannelConfig;
import com.metrics.anomaly.model.ChannelType;
import com.metrics.anomaly.notification.AlertFormatter;
import com.metrics.anomaly.notification.NotificationChannel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

/**
 * Sends a plain-text mail to the comma-separated addresses in {@code settings.to}.
 * Requires {@code spring.mail.*} to be configured; without a mail sender every attempt fails.
 */
@Component
public class EmailChannel implements NotificationChannel {

    public static final String TO = "to";
    public static final String FROM = "from";
    public static final String SUBJECT_PREFIX = "subjectPrefix";

    private final ObjectProvider<JavaMailSender> mailSender;

    public EmailChannel(ObjectProvider<JavaMailSender> mailSender) {
        this.mailSender = mailSender;
    }

    @Override
    public ChannelType type() {
        return ChannelType.EMAIL;
    }

    @Override
    public void send(Alert alert, ChannelConfig config) throws DispatchException {
        JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null) {
            throw new DispatchException(type(), "Mail is not configured (spring.mail.host)");
        }
        String to = config.getSetting(TO, null);
        if (to == null) {
            throw new DispatchException(type(), "Email channel has no 'to' setting");
        }

        SimpleMailMessage message = new SimpleMailMessage();
        message.setTo(to.split("\\s*,\\s*"));
        String from = config.getSetting(FROM, null);
        if (from != null) {
            message.setFrom(from);
        }
        message.setSubject(config.getSetting(SUBJECT_PREFIX, "") + AlertFormatter.subject(alert));
        message.setText(AlertFormatter.body(alert));

        try {
            sender.send(message);
        } catch (MailException e) {
            throw new DispatchException(type(), "Mail to " + to + " failed: " + e.getMessage(), e);
        }
    }
}
