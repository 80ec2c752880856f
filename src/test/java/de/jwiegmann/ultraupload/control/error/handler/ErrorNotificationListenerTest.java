package de.jwiegmann.ultraupload.control.error.handler;

import de.jwiegmann.ultraupload.config.EnvironmentProperties;
import de.jwiegmann.ultraupload.config.ErrorManagerProperties;
import de.jwiegmann.ultraupload.control.error.BlockingLevel;
import de.jwiegmann.ultraupload.control.error.ContextSanitizer;
import de.jwiegmann.ultraupload.control.error.ErrorOccurredEvent;
import de.jwiegmann.ultraupload.control.error.ErrorType;
import de.jwiegmann.ultraupload.control.error.ExceptionSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ErrorNotificationListenerTest {

    @Mock
    private JavaMailSender mailSender;

    private final ErrorManagerProperties properties = new ErrorManagerProperties();
    private final EnvironmentProperties environment = new EnvironmentProperties();
    private ErrorNotificationListener listener;

    @BeforeEach
    void setUp() {
        environment.setEnvironment("testing");
        properties.getNotification().setFrom("uploads@example.org");
        listener = new ErrorNotificationListener(mailSender, properties, environment, "ultra-upload-manager");
    }

    private ErrorOccurredEvent event() {
        // Kontext kommt bereits bereinigt vom NotificationErrorHandler
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("fileName", "a.pdf");
        context.put("password", ContextSanitizer.REDACTED);
        return ErrorOccurredEvent.builder()
                .errorCode("IMPOSSIBLE_SAVE_FILE")
                .type(ErrorType.CRITICAL)
                .blocking(BlockingLevel.BLOCKING)
                .devMessage("Could not store a.pdf")
                .context(context)
                .exception(ExceptionSummary.of(new IllegalStateException("disk full")))
                .recipients(List.of("dev@example.org", "ops@example.org"))
                .build();
    }

    @Test
    void sends_mail_to_all_recipients() {
        // 1) Ereignis zustellen
        listener.onError(event());

        // 2) Versendete Nachricht abgreifen
        ArgumentCaptor<SimpleMailMessage> captor = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(captor.capture());
        SimpleMailMessage message = captor.getValue();

        // 3) Empfänger, Absender, Betreff und Inhalt
        assertThat(message.getTo()).containsExactly("dev@example.org", "ops@example.org");
        assertThat(message.getFrom()).isEqualTo("uploads@example.org");
        assertThat(message.getSubject()).isEqualTo("[UEM Error] ultra-upload-manager (testing): IMPOSSIBLE_SAVE_FILE");
        assertThat(message.getText())
                .contains("Environment: testing")
                .contains("Type: critical")
                .contains("Message: Could not store a.pdf")
                .contains("fileName = a.pdf")
                .contains("password = [REDACTED]")
                .contains("Exception: java.lang.IllegalStateException: disk full");
    }

    @Test
    void context_is_left_out_when_disabled() {
        properties.getNotification().setIncludeContext(false);

        String body = listener.body(event());

        assertThat(body).contains("[Context Redacted by Config]").doesNotContain("fileName");
    }

    @Test
    void failed_delivery_is_logged_not_thrown() {
        doThrow(new MailSendException("smtp down")).when(mailSender).send(any(SimpleMailMessage.class));

        assertThatCode(() -> listener.onError(event())).doesNotThrowAnyException();
    }
}
