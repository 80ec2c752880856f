package de.jwiegmann.ultraupload.control.i18n;

import java.util.Map;
import java.util.Optional;

/**
 * Nachschlagen übersetzter Texte. Platzhalter im Format :name werden aus params ersetzt.
 */
public interface Translator {

    /**
     * @return die Übersetzung oder leer, wenn der Schlüssel unbekannt ist
     */
    Optional<String> translate(String key, Map<String, ?> params);

    static String replacePlaceholders(String template, Map<String, ?> params) {
        String result = template;
        if (params == null) {
            return result;
        }
        for (Map.Entry<String, ?> entry : params.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean
                    || value instanceof Character || value instanceof Enum<?>) {
                result = result.replace(":" + entry.getKey(), String.valueOf(value));
            }
        }
        return result;
    }
}
