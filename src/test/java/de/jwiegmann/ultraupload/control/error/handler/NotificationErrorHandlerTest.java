package de.jwiegmann.ultraupload.control.error.handler;

import de.jwiegmann.ultraupload.config.ErrorManagerProperties;
import de.jwiegmann.ultraupload.control.error.ErrorConfig;
import de.jwiegmann.ultraupload.control.error.ErrorMessageFormatter;
import de.jwiegmann.ultraupload.control.error.ErrorOccurredEvent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationErrorHandlerTest {

    private final List<Object> events = new ArrayList<>();
    private final ErrorManagerProperties.Notification notification = new ErrorManagerProperties.Notification();
    private final NotificationErrorHandler handler = new NotificationErrorHandler(
            new ErrorMessageFormatter((key, params) -> Optional.empty()), events::add, notification);

    private final ErrorConfig notifying = ErrorConfig.builder()
            .devMessage("Disk full while storing :fileName")
            .devTeamEmailNeed(true)
            .build();

    @Test
    void requires_flag_enabled_notification_and_recipients() {
        assertThat(handler.shouldHandle(notifying)).isFalse();

        notification.setEnabled(true);
        assertThat(handler.shouldHandle(notifying)).isFalse();

        notification.setRecipients(List.of("dev@example.org"));
        assertThat(handler.shouldHandle(notifying)).isTrue();
        assertThat(handler.shouldHandle(new ErrorConfig())).isFalse();
    }

    @Test
    void publishes_event_with_formatted_developer_message() {
        notification.setEnabled(true);
        notification.setRecipients(List.of("dev@example.org"));

        handler.handle("IMPOSSIBLE_SAVE_FILE", notifying, Map.of("fileName", "a.pdf"), new IllegalStateException("io"));

        assertThat(events).hasSize(1);
        ErrorOccurredEvent event = (ErrorOccurredEvent) events.get(0);
        assertThat(event.getErrorCode()).isEqualTo("IMPOSSIBLE_SAVE_FILE");
        assertThat(event.getDevMessage()).isEqualTo("Disk full while storing a.pdf");
        assertThat(event.getRecipients()).containsExactly("dev@example.org");
        assertThat(event.getException().getMessage()).isEqualTo("io");
    }
}
