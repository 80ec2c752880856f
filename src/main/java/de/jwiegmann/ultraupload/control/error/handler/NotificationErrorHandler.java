package de.jwiegmann.ultraupload.control.error.handler;

import de.jwiegmann.ultraupload.config.ErrorManagerProperties;
import de.jwiegmann.ultraupload.control.error.ContextSanitizer;
import de.jwiegmann.ultraupload.control.error.ErrorConfig;
import de.jwiegmann.ultraupload.control.error.ErrorHandler;
import de.jwiegmann.ultraupload.control.error.ErrorMessageFormatter;
import de.jwiegmann.ultraupload.control.error.ErrorOccurredEvent;
import de.jwiegmann.ultraupload.control.error.ExceptionSummary;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Meldet Fehler mit devTeamEmailNeed an das Entwicklerteam, sofern die
 * Benachrichtigung aktiviert ist und Empfänger konfiguriert sind.
 * Der Versand per Mail läuft in {@link ErrorNotificationListener}.
 */
@RequiredArgsConstructor
public class NotificationErrorHandler implements ErrorHandler {

    private final ErrorMessageFormatter formatter;
    private final ApplicationEventPublisher eventPublisher;
    private final ErrorManagerProperties.Notification notification;
    private final ContextSanitizer sanitizer = new ContextSanitizer();

    @Override
    public boolean shouldHandle(ErrorConfig config) {
        return config.isDevTeamEmailNeed()
                && notification.isEnabled()
                && notification.getRecipients() != null
                && !notification.getRecipients().isEmpty();
    }

    @Override
    public void handle(String errorCode, ErrorConfig config, Map<String, Object> context, Throwable exception) {
        eventPublisher.publishEvent(ErrorOccurredEvent.builder()
                .errorCode(errorCode)
                .type(config.resolvedType())
                .blocking(config.resolvedBlocking())
                .devMessage(formatter.developerMessage(config, context))
                .context(Collections.unmodifiableMap(sanitizer.sanitize(context)))
                .exception(ExceptionSummary.of(exception))
                .recipients(List.copyOf(notification.getRecipients()))
                .build());
    }
}
