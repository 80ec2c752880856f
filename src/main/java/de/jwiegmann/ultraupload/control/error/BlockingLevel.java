package de.jwiegmann.ultraupload.control.error;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Schweregrad: muss die laufende Operation anhalten, darf sie mit Warnung weiterlaufen
 * oder ist der Fehler rein informativ.
 */
public enum BlockingLevel {
    BLOCKING("blocking"),
    SEMI_BLOCKING("semi-blocking"),
    NOT("not");

    private final String value;

    BlockingLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
