package de.jwiegmann.ultraupload.control.error;

import de.jwiegmann.ultraupload.control.i18n.Translator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Erzeugt Entwickler- und Benutzermeldungen: zuerst Übersetzungsschlüssel,
 * dann direkte Meldung, dann Rückfalltext. Platzhalter :name kommen aus dem Kontext.
 */
@Component
@RequiredArgsConstructor
public class ErrorMessageFormatter {

    static final String DEV_FALLBACK = "An error occurred (no developer message configured)";
    static final String USER_FALLBACK = "An error has occurred. Please try again later.";

    private final Translator translator;

    public String developerMessage(ErrorConfig config, Map<String, Object> context) {
        return format(config.getDevMessageKey(), config.getDevMessage(), DEV_FALLBACK, context);
    }

    public String userMessage(ErrorConfig config, Map<String, Object> context) {
        return format(config.getUserMessageKey(), config.getUserMessage(), USER_FALLBACK, context);
    }

    String format(String key, String directMessage, String fallback, Map<String, Object> context) {
        String message = null;
        if (key != null && !key.isBlank()) {
            message = translator.translate(key, context).orElse(null);
        }
        if (message == null && directMessage != null && !directMessage.isBlank()) {
            message = directMessage;
        }
        if (message == null) {
            message = fallback;
        }
        return Translator.replacePlaceholders(message, context);
    }
}
