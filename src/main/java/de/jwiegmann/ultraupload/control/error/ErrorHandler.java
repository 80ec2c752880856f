package de.jwiegmann.ultraupload.control.error;

import java.util.Map;

/**
 * Verarbeitungsschritt für behandelte Fehler (Anzeige, Logging, Benachrichtigung).
 */
public interface ErrorHandler {

    boolean shouldHandle(ErrorConfig config);

    void handle(String errorCode, ErrorConfig config, Map<String, Object> context, Throwable exception);
}
