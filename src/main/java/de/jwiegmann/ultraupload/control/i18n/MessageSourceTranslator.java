package de.jwiegmann.ultraupload.control.i18n;

import lombok.RequiredArgsConstructor;
import org.springframework.context.MessageSource;
import org.springframework.context.i18n.LocaleContextHolder;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Übersetzungen aus den messages*.properties Bundles der Anwendung.
 */
@Component
@RequiredArgsConstructor
public class MessageSourceTranslator implements Translator {

    private final MessageSource messageSource;

    @Override
    public Optional<String> translate(String key, Map<String, ?> params) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String template = messageSource.getMessage(key, null, null, LocaleContextHolder.getLocale());
        return Optional.ofNullable(template).map(t -> Translator.replacePlaceholders(t, params));
    }
}
