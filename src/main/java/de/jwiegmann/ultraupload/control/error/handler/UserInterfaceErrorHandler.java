package de.jwiegmann.ultraupload.control.error.handler;

import de.jwiegmann.ultraupload.config.ErrorManagerProperties;
import de.jwiegmann.ultraupload.control.error.ErrorConfig;
import de.jwiegmann.ultraupload.control.error.ErrorFlashStore;
import de.jwiegmann.ultraupload.control.error.ErrorHandler;
import de.jwiegmann.ultraupload.control.error.ErrorMessageFormatter;
import lombok.RequiredArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Legt die Benutzermeldung für den nächsten Seitenaufbau ab.
 * Schlüssel: error_&lt;mode&gt;, optional error_code_&lt;mode&gt;, sowie error_info.
 */
@RequiredArgsConstructor
public class UserInterfaceErrorHandler implements ErrorHandler {

    public static final String LOG_ONLY = "log-only";

    private final ErrorMessageFormatter formatter;
    private final ErrorFlashStore flashStore;
    private final ErrorManagerProperties.Ui ui;

    @Override
    public boolean shouldHandle(ErrorConfig config) {
        if (LOG_ONLY.equals(displayMode(config))) {
            return false;
        }
        return hasText(config.getUserMessage()) || hasText(config.getUserMessageKey());
    }

    @Override
    public void handle(String errorCode, ErrorConfig config, Map<String, Object> context, Throwable exception) {
        String mode = displayMode(config);
        String userMessage = formatter.userMessage(config, context);

        flashStore.flash("error_" + mode, userMessage);
        if (ui.isShowErrorCodes()) {
            flashStore.flash("error_code_" + mode, errorCode);
        }

        Map<String, Object> errorInfo = new LinkedHashMap<>();
        errorInfo.put("error_code", errorCode);
        errorInfo.put("message", userMessage);
        errorInfo.put("blocking", config.resolvedBlocking().value());
        errorInfo.put("display_mode", mode);
        flashStore.flash("error_info", errorInfo);
    }

    private String displayMode(ErrorConfig config) {
        return config.getMsgTo() != null ? config.getMsgTo() : ui.getDefaultDisplayMode();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
