package de.jwiegmann.ultraupload.control.error.handler;

import de.jwiegmann.ultraupload.config.EnvironmentProperties;
import de.jwiegmann.ultraupload.config.ErrorManagerProperties;
import de.jwiegmann.ultraupload.control.error.ErrorOccurredEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Verschickt die Fehlerbenachrichtigung per Mail an die konfigurierten Empfänger.
 * Ein Versandfehler wird protokolliert und verdrängt nie den ursprünglichen Fehler.
 */
@Slf4j(topic = "ultra.errors")
@Component
public class ErrorNotificationListener {

    private final JavaMailSender mailSender;
    private final ErrorManagerProperties.Notification notification;
    private final String appName;
    private final String environment;

    public ErrorNotificationListener(JavaMailSender mailSender,
                                     ErrorManagerProperties properties,
                                     EnvironmentProperties environmentProperties,
                                     @Value("${spring.application.name:ultra-upload-manager}") String appName) {
        this.mailSender = mailSender;
        this.notification = properties.getNotification();
        this.appName = appName;
        this.environment = environmentProperties.getEnvironment();
    }

    @EventListener
    public void onError(ErrorOccurredEvent event) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setTo(event.getRecipients().toArray(new String[0]));
        if (notification.getFrom() != null && !notification.getFrom().isBlank()) {
            message.setFrom(notification.getFrom());
        }
        message.setSubject(subject(event));
        message.setText(body(event));

        try {
            mailSender.send(message);
            log.info("Error notification for {} sent to {}", event.getErrorCode(), event.getRecipients());
        } catch (MailException e) {
            log.error("Could not send error notification for {} to {}: {}",
                    event.getErrorCode(), event.getRecipients(), e.getMessage());
        }
    }

    String subject(ErrorOccurredEvent event) {
        return notification.getSubjectPrefix() + appName + " (" + environment + "): " + event.getErrorCode();
    }

    String body(ErrorOccurredEvent event) {
        StringBuilder text = new StringBuilder()
                .append("Application: ").append(appName).append('\n')
                .append("Environment: ").append(environment).append('\n')
                .append("Error code: ").append(event.getErrorCode()).append('\n')
                .append("Type: ").append(event.getType().value()).append('\n')
                .append("Blocking: ").append(event.getBlocking().value()).append('\n')
                .append("Message: ").append(event.getDevMessage()).append('\n');

        text.append("\nContext:\n");
        if (!notification.isIncludeContext()) {
            text.append("  [Context Redacted by Config]\n");
        } else if (event.getContext().isEmpty()) {
            text.append("  (none)\n");
        } else {
            for (Map.Entry<String, Object> entry : event.getContext().entrySet()) {
                text.append("  ").append(entry.getKey()).append(" = ").append(entry.getValue()).append('\n');
            }
        }

        if (event.getException() != null) {
            text.append("\nException: ").append(event.getException().getClassName())
                    .append(": ").append(event.getException().getMessage()).append('\n');
        }
        return text.toString();
    }
}
