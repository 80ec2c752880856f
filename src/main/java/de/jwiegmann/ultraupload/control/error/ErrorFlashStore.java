package de.jwiegmann.ultraupload.control.error;

/**
 * Ablage für Fehlerdaten, die beim nächsten Seitenaufbau angezeigt werden.
 */
public interface ErrorFlashStore {

    void flash(String key, Object value);
}
