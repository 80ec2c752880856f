package de.jwiegmann.ultraupload.control.error.handler;

import de.jwiegmann.ultraupload.config.ErrorManagerProperties;
import de.jwiegmann.ultraupload.control.error.BlockingLevel;
import de.jwiegmann.ultraupload.control.error.ErrorConfig;
import de.jwiegmann.ultraupload.control.error.ErrorMessageFormatter;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class UserInterfaceErrorHandlerTest {

    private final Map<String, Object> flashed = new LinkedHashMap<>();
    private final ErrorManagerProperties.Ui ui = new ErrorManagerProperties.Ui();
    private final UserInterfaceErrorHandler handler = new UserInterfaceErrorHandler(
            new ErrorMessageFormatter((key, params) -> Optional.empty()), flashed::put, ui);

    @Test
    void log_only_and_missing_user_message_are_skipped() {
        assertThat(handler.shouldHandle(ErrorConfig.builder().userMessage("x").msgTo("log-only").build())).isFalse();
        assertThat(handler.shouldHandle(ErrorConfig.builder().devMessage("dev only").build())).isFalse();
        assertThat(handler.shouldHandle(ErrorConfig.builder().userMessageKey("errors.user.x").build())).isTrue();
    }

    @Test
    void flashes_message_under_display_mode_key() {
        ErrorConfig config = ErrorConfig.builder()
                .userMessage("File :fileName rejected")
                .blocking(BlockingLevel.SEMI_BLOCKING)
                .msgTo("sweet-alert")
                .build();

        handler.handle("INVALID_FILE", config, Map.of("fileName", "a.txt"), null);

        assertThat(flashed).containsEntry("error_sweet-alert", "File a.txt rejected");
        assertThat(flashed).doesNotContainKey("error_code_sweet-alert");
        @SuppressWarnings("unchecked")
        Map<String, Object> info = (Map<String, Object>) flashed.get("error_info");
        assertThat(info).containsEntry("error_code", "INVALID_FILE")
                .containsEntry("blocking", "semi-blocking")
                .containsEntry("display_mode", "sweet-alert");
    }

    @Test
    void error_code_is_flashed_when_enabled_and_default_mode_applies() {
        ui.setShowErrorCodes(true);

        handler.handle("SCAN_ERROR", ErrorConfig.builder().userMessage("Scan failed").build(), Map.of(), null);

        assertThat(flashed).containsEntry("error_div", "Scan failed")
                .containsEntry("error_code_div", "SCAN_ERROR");
    }
}
